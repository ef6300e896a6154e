package com.helia.domain;

/**
 * What a turn emits to the caller, in order: an optional SESSION event when the turn opened a new
 * session, one CHUNK per model chunk, then END carrying the stored assistant message.
 */
public record TurnEvent(Type type, String sessionId, String text, ChatMessage message) {

    public enum Type {
        SESSION, CHUNK, END
    }

    public static TurnEvent session(Session session) {
        return new TurnEvent(Type.SESSION, session.id(), null, null);
    }

    public static TurnEvent chunk(String sessionId, String text) {
        return new TurnEvent(Type.CHUNK, sessionId, text, null);
    }

    public static TurnEvent end(ChatMessage assistantMessage) {
        return new TurnEvent(Type.END, assistantMessage.sessionId(), null, assistantMessage);
    }
}
