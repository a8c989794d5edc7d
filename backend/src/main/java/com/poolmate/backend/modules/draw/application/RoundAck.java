package com.poolmate.backend.modules.draw.application;

import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.ParticipationDecision;

/**
 * @param windowClosed whether this answer was the last one missing and closed the window
 */
public record RoundAck(UUID roundId, ParticipationDecision decision, boolean windowClosed) {
}
