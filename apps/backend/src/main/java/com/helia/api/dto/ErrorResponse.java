package com.helia.api.dto;

import com.helia.error.ChatException;

public record ErrorResponse(String code, String message) {

    public static ErrorResponse of(ChatException ex) {
        return new ErrorResponse(ex.code().name(), ex.getMessage());
    }
}
