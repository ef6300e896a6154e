package com.helia.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MessageRole {
    USER,
    ASSISTANT;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("message role is null");
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
