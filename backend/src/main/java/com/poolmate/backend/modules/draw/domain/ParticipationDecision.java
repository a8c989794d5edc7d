package com.poolmate.backend.modules.draw.domain;

public enum ParticipationDecision {
    UNANSWERED,
    OPTED_IN,
    OPTED_OUT;

    public static ParticipationDecision of(boolean participate) {
        return participate ? OPTED_IN : OPTED_OUT;
    }
}
