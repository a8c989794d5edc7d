package com.poolmate.backend.modules.draw.domain;

/**
 * Payment requirement applied before a round may start.
 */
public enum EligibilityPolicy {
    /** Every member who has not won yet must have paid the installment of the round. */
    STRICT,
    /** Only paid-up members compete; unpaid members are left out of the round. */
    RELAXED
}
