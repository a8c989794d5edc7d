package com.poolmate.backend.modules.pool.domain;

public enum PoolFrequency {
    WEEKLY,
    MONTHLY
}
