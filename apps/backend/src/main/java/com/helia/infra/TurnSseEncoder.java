package com.helia.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.helia.api.dto.ErrorResponse;
import com.helia.domain.TurnEvent;
import com.helia.error.ChatException;
import com.helia.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps turn events onto the SSE wire format:
 * <pre>
 *   event: session   data: {"sessionId":"..."}      (new sessions only)
 *   event: message   data: &lt;chunk text&gt;            (one per chunk)
 *   event: end       data: END                      (success)
 *   event: error     data: {"code":"...","message":"..."}  (failure, replaces end)
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnSseEncoder {

    public static final String END_MARKER = "END";

    private final ObjectMapper mapper;

    public ServerSentEvent<String> encode(TurnEvent event) {
        return switch (event.type()) {
            case SESSION -> ServerSentEvent.<String>builder(json(Map.of("sessionId", event.sessionId())))
                    .event("session")
                    .build();
            case CHUNK -> ServerSentEvent.<String>builder(event.text())
                    .event("message")
                    .build();
            case END -> ServerSentEvent.<String>builder(END_MARKER)
                    .event("end")
                    .id(event.message().id())
                    .build();
        };
    }

    public ServerSentEvent<String> error(Throwable error) {
        ErrorResponse body = error instanceof ChatException chat
                ? ErrorResponse.of(chat)
                : new ErrorResponse(ErrorCode.PROVIDER_ERROR.name(), ErrorCode.PROVIDER_ERROR.defaultMessage());
        return ServerSentEvent.<String>builder(json(body))
                .event("error")
                .build();
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("[SSE] failed to serialize event payload type={}", value.getClass().getSimpleName(), e);
            return "{\"code\":\"" + ErrorCode.STORAGE_ERROR.name() + "\",\"message\":\"serialize failed\"}";
        }
    }
}
