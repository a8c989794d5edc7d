package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record RoundAnswerRequest(
        @NotNull UUID userId,
        @NotNull Boolean participate
) {
}
