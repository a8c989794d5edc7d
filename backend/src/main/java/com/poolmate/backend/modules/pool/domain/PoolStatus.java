package com.poolmate.backend.modules.pool.domain;

public enum PoolStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    CLOSED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
