package com.poolmate.backend.modules.draw.domain;

public enum RoundOutcome {
    IN_PROGRESS,
    COMMITTED,
    NO_PARTICIPANTS,
    REJECTED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
