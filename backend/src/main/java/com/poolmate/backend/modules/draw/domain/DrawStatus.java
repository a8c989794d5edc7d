package com.poolmate.backend.modules.draw.domain;

public enum DrawStatus {
    COMPLETED,
    CANCELLED
}
