package com.helia.api.dto;

import com.helia.domain.TurnCommand;

/** Body of {@code POST /api/chat/send}. Leave {@code sessionId} empty to start a new session with {@code personaId}. */
public record ChatRequest(
        String sessionId,
        String personaId,
        String message,
        String imageUrl
) {
    public TurnCommand toCommand() {
        return new TurnCommand(sessionId, personaId, message, imageUrl);
    }
}
