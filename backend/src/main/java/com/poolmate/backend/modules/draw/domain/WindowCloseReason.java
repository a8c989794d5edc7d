package com.poolmate.backend.modules.draw.domain;

public enum WindowCloseReason {
    ALL_RESPONDED,
    DEADLINE_ELAPSED,
    ABORTED
}
