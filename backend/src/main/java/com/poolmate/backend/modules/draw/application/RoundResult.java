package com.poolmate.backend.modules.draw.application;

import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.RoundOutcome;

public record RoundResult(
        UUID roundId,
        int roundNumber,
        RoundOutcome outcome,
        UUID drawRecordId,
        UUID winnerMemberId,
        String detail
) {
}
