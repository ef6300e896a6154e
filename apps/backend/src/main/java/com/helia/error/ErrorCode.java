package com.helia.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Could not validate credentials"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "Chat session not found"),
    INVALID_PERSONA(HttpStatus.BAD_REQUEST, "Unknown persona"),
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "Invalid request"),
    PROVIDER_ERROR(HttpStatus.BAD_GATEWAY, "Model provider failed"),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Conversation storage failed"),
    TURN_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Model response timed out");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
