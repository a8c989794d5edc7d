package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * The minimum reason length is checked by the ledger so the caller gets {@code CANCEL_REASON_TOO_SHORT}.
 */
public record CancelDrawRequest(
        @NotNull UUID actorId,
        @Size(max = 500) String reason
) {
}
