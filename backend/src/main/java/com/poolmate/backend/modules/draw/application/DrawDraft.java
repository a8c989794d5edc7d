package com.poolmate.backend.modules.draw.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawAudit;
import com.poolmate.backend.modules.draw.domain.DrawMethod;

public record DrawDraft(
        UUID poolId,
        int roundNumber,
        UUID winnerMemberId,
        long amount,
        DrawMethod method,
        DrawAudit audit,
        UUID createdBy,
        OffsetDateTime drawnAt
) {
}
