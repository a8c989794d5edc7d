package com.poolmate.backend.modules.draw.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.RoundParticipation;

public record ParticipationResponse(
        UUID memberId,
        UUID userId,
        String displayName,
        String decision,
        boolean autoEnrolled,
        OffsetDateTime notifiedAt,
        OffsetDateTime respondedAt
) {

    public static ParticipationResponse from(RoundParticipation participation) {
        return new ParticipationResponse(
                participation.getMember().getId(),
                participation.getMember().getUserId(),
                participation.getMember().getDisplayName(),
                participation.getDecision().name(),
                participation.isAutoEnrolled(),
                participation.getNotifiedAt(),
                participation.getRespondedAt()
        );
    }
}
