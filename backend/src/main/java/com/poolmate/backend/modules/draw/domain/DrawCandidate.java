package com.poolmate.backend.modules.draw.domain;

import java.util.UUID;

public record DrawCandidate(
        UUID memberId,
        UUID userId,
        String displayName,
        ParticipationDecision decision,
        boolean autoEnrolled
) {
}
