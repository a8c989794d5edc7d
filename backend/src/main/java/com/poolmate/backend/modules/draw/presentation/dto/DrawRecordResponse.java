package com.poolmate.backend.modules.draw.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawAudit;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrawRecordResponse(
        UUID drawId,
        UUID poolId,
        int roundNumber,
        UUID winnerMemberId,
        UUID winnerUserId,
        String winnerDisplayName,
        long amount,
        String method,
        String status,
        OffsetDateTime drawnAt,
        DrawAudit audit,
        String cancelReason,
        UUID cancelledBy,
        OffsetDateTime cancelledAt
) {

    public static DrawRecordResponse from(DrawRecord record) {
        return new DrawRecordResponse(
                record.getId(),
                record.getPool().getId(),
                record.getRoundNumber(),
                record.getWinner().getId(),
                record.getWinner().getUserId(),
                record.getWinner().getDisplayName(),
                record.getAmount(),
                record.getMethod().name(),
                record.getStatus().name(),
                record.getDrawnAt(),
                record.getAudit(),
                record.getCancelReason(),
                record.getCancelledBy(),
                record.getCancelledAt()
        );
    }
}
