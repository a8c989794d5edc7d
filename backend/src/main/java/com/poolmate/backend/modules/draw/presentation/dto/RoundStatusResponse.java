package com.poolmate.backend.modules.draw.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.ParticipationDecision;
import com.poolmate.backend.modules.draw.domain.RoundParticipation;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RoundStatusResponse(
        UUID roundId,
        UUID poolId,
        int roundNumber,
        String windowState,
        String closeReason,
        String outcome,
        String outcomeDetail,
        String eligibilityPolicy,
        OffsetDateTime notifiedAt,
        OffsetDateTime deadlineAt,
        OffsetDateTime closedAt,
        UUID drawRecordId,
        long optedIn,
        long optedOut,
        long unanswered,
        List<ParticipationResponse> participations
) {

    public static RoundStatusResponse from(DrawRound round, List<RoundParticipation> participations) {
        return new RoundStatusResponse(
                round.getId(),
                round.getPool().getId(),
                round.getRoundNumber(),
                round.getWindowState().name(),
                round.getCloseReason() != null ? round.getCloseReason().name() : null,
                round.getOutcome().name(),
                round.getOutcomeDetail(),
                round.getEligibilityPolicy().name(),
                round.getNotifiedAt(),
                round.getDeadlineAt(),
                round.getClosedAt(),
                round.getDrawRecordId(),
                count(participations, ParticipationDecision.OPTED_IN),
                count(participations, ParticipationDecision.OPTED_OUT),
                count(participations, ParticipationDecision.UNANSWERED),
                participations.stream().map(ParticipationResponse::from).toList()
        );
    }

    private static long count(List<RoundParticipation> participations, ParticipationDecision decision) {
        return participations.stream().filter(participation -> participation.getDecision() == decision).count();
    }
}
