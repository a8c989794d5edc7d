package com.poolmate.backend.modules.pool.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record PoolTransitionRequest(
        @NotNull UUID actorId
) {
}
