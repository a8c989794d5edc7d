package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record AbortRoundRequest(
        @NotNull UUID actorId,
        @NotBlank @Size(max = 500) String reason
) {
}
