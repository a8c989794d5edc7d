package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record StartRoundRequest(
        @NotNull UUID actorId
) {
}
