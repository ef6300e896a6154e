package com.helia.controller;

import com.helia.api.dto.CreateSessionRequest;
import com.helia.api.dto.RenameSessionRequest;
import com.helia.api.dto.SessionView;
import com.helia.auth.Authenticator;
import com.helia.service.SessionManager;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Session CRUD, always scoped to the caller. A session owned by someone else answers 404.
 */
@RestController
@RequestMapping(value = "/api/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class SessionController {

    private final Authenticator authenticator;
    private final SessionManager sessionManager;

    @Operation(summary = "Most recently active sessions of the caller")
    @GetMapping
    public Mono<List<SessionView>> list(ServerHttpRequest httpRequest) {
        return owner(httpRequest)
                .map(ownerId -> sessionManager.list(ownerId).stream().map(SessionView::of).toList());
    }

    @Operation(summary = "Create an empty session bound to a persona")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SessionView> create(@Valid @RequestBody CreateSessionRequest request,
                                    ServerHttpRequest httpRequest) {
        return owner(httpRequest)
                .map(ownerId -> SessionView.of(sessionManager.create(ownerId, request.personaId(), request.title())));
    }

    @Operation(summary = "One session of the caller")
    @GetMapping("/{sessionId}")
    public Mono<SessionView> get(@PathVariable("sessionId") String sessionId, ServerHttpRequest httpRequest) {
        return owner(httpRequest)
                .map(ownerId -> SessionView.of(sessionManager.get(ownerId, sessionId)));
    }

    @Operation(summary = "Rename a session")
    @PutMapping(value = "/{sessionId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SessionView> rename(@PathVariable("sessionId") String sessionId,
                                    @Valid @RequestBody RenameSessionRequest request,
                                    ServerHttpRequest httpRequest) {
        return owner(httpRequest)
                .map(ownerId -> SessionView.of(sessionManager.rename(ownerId, sessionId, request.title())));
    }

    @Operation(summary = "Delete a session together with its messages")
    @DeleteMapping("/{sessionId}")
    public Mono<Map<String, String>> delete(@PathVariable("sessionId") String sessionId,
                                            ServerHttpRequest httpRequest) {
        return owner(httpRequest)
                .map(ownerId -> {
                    sessionManager.delete(ownerId, sessionId);
                    return Map.of("status", "success", "message", "Chat session deleted");
                });
    }

    /** Store calls block; everything after identification runs off the event loop. */
    private Mono<String> owner(ServerHttpRequest httpRequest) {
        return authenticator.identify(httpRequest).publishOn(Schedulers.boundedElastic());
    }
}
