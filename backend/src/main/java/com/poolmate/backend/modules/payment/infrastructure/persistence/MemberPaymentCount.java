package com.poolmate.backend.modules.payment.infrastructure.persistence;

import java.util.UUID;

public record MemberPaymentCount(UUID memberId, long count) {
}
