package com.helia.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateSessionRequest(@NotBlank String personaId, String title) { }
