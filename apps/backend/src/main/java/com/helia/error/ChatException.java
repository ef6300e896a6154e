package com.helia.error;

import java.time.Duration;

/**
 * Base failure of the chat backend. The {@link ErrorCode} decides the HTTP status and the
 * code reported in error payloads and stream error events.
 */
public class ChatException extends RuntimeException {

    private final ErrorCode code;

    public ChatException(ErrorCode code, String message) {
        super(message == null || message.isBlank() ? code.defaultMessage() : message);
        this.code = code;
    }

    public ChatException(ErrorCode code, String message, Throwable cause) {
        super(message == null || message.isBlank() ? code.defaultMessage() : message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    public static ChatException unauthorized() {
        return new ChatException(ErrorCode.UNAUTHORIZED, null);
    }

    /** Same message for "missing" and "owned by someone else". */
    public static ChatException notFound() {
        return new ChatException(ErrorCode.NOT_FOUND, null);
    }

    public static ChatException invalidPersona(String personaId) {
        return new ChatException(ErrorCode.INVALID_PERSONA, "Unknown persona: " + personaId);
    }

    public static ChatException invalidInput(String message) {
        return new ChatException(ErrorCode.INVALID_INPUT, message);
    }

    public static ChatException storage(String operation, Throwable cause) {
        return new ChatException(ErrorCode.STORAGE_ERROR, "Conversation storage failed during " + operation, cause);
    }

    public static ChatException turnTimeout(Duration limit) {
        return new ChatException(ErrorCode.TURN_TIMEOUT, "Model response exceeded " + limit.toMillis() + " ms");
    }
}
