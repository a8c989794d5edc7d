package com.poolmate.backend.modules.payment.application;

import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of validated cotization payments.
 */
public interface PaymentLedger {

    /**
     * Number of validated payments per roster member for one installment.
     * Members without a validated payment are absent from the map.
     */
    Map<UUID, Long> countValidatedForInstallment(UUID poolId, int installmentNumber);
}
