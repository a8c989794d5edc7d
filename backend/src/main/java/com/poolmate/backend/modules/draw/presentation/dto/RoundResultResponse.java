package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import com.poolmate.backend.modules.draw.application.RoundResult;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundResultResponse(
        UUID roundId,
        int roundNumber,
        String outcome,
        UUID drawRecordId,
        UUID winnerMemberId,
        String detail
) {

    public static RoundResultResponse from(RoundResult result) {
        return new RoundResultResponse(
                result.roundId(),
                result.roundNumber(),
                result.outcome().name(),
                result.drawRecordId(),
                result.winnerMemberId(),
                result.detail()
        );
    }
}
