package com.poolmate.backend.modules.payment.domain;

public enum PaymentStatus {
    PENDING,
    VALIDATED,
    REJECTED
}
