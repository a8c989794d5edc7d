package com.poolmate.backend.modules.draw.domain;

public enum DrawMethod {
    RANDOM,
    MANUAL
}
