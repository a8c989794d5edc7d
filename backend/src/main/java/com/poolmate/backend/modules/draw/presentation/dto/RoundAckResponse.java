package com.poolmate.backend.modules.draw.presentation.dto;

import java.util.UUID;

import com.poolmate.backend.modules.draw.application.RoundAck;

public record RoundAckResponse(UUID roundId, String decision, boolean windowClosed) {

    public static RoundAckResponse from(RoundAck ack) {
        return new RoundAckResponse(ack.roundId(), ack.decision().name(), ack.windowClosed());
    }
}
