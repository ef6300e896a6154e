package com.helia.domain;

/**
 * Input of one chat turn. Without {@code sessionId} a new session is opened with {@code personaId}.
 */
public record TurnCommand(String sessionId, String personaId, String text, String imageUrl) { }
