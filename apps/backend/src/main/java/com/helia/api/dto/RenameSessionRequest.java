package com.helia.api.dto;

import jakarta.validation.constraints.NotBlank;

public record RenameSessionRequest(@NotBlank String title) { }
