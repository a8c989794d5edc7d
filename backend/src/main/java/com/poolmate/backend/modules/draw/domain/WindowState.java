package com.poolmate.backend.modules.draw.domain;

/**
 * Consensus window states of one round: {@code NOT_STARTED -> NOTIFIED -> AWAITING_RESPONSES -> CLOSED}.
 */
public enum WindowState {
    NOT_STARTED,
    NOTIFIED,
    AWAITING_RESPONSES,
    CLOSED;

    public boolean acceptsResponses() {
        return this == NOTIFIED || this == AWAITING_RESPONSES;
    }
}
