package com.helia.controller;

import com.helia.api.dto.ChatRequest;
import com.helia.api.dto.MessageView;
import com.helia.auth.Authenticator;
import com.helia.infra.TurnSseEncoder;
import com.helia.service.SessionManager;
import com.helia.service.StreamingChatEngine;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Streaming chat endpoint plus read-only history.
 *
 * <p>Validation and the user-message write happen before the response starts, so those
 * failures come back as plain JSON errors with their HTTP status. Once streaming has begun,
 * failures are reported as a final {@code error} event.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ChatController {

    private final Authenticator authenticator;
    private final StreamingChatEngine engine;
    private final SessionManager sessionManager;
    private final TurnSseEncoder encoder;

    @Operation(summary = "Send a message and stream the persona's reply as SSE")
    @PostMapping(value = "/chat/send",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<String>>>> send(@RequestBody ChatRequest request,
                                                                   ServerHttpRequest httpRequest) {
        return authenticator.identify(httpRequest)
                .flatMap(ownerId -> engine.open(ownerId, request.toCommand()))
                .map(turn -> {
                    log.info("SSE open, sessionId={}", turn.sessionId());
                    Flux<ServerSentEvent<String>> body = engine.stream(turn)
                            .map(encoder::encode)
                            .onErrorResume(ex -> Mono.just(encoder.error(ex)));
                    return ResponseEntity.ok()
                            .contentType(MediaType.TEXT_EVENT_STREAM)
                            .body(body);
                });
    }

    @Operation(summary = "Full message history of one session, oldest first")
    @GetMapping(value = "/history/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<MessageView>> history(@PathVariable("sessionId") String sessionId,
                                           ServerHttpRequest httpRequest) {
        return authenticator.identify(httpRequest)
                .publishOn(Schedulers.boundedElastic())
                .map(ownerId -> sessionManager.history(ownerId, sessionId).stream()
                        .map(MessageView::of)
                        .toList());
    }
}
