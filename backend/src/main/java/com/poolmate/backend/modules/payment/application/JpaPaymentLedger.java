package com.poolmate.backend.modules.payment.application;

import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import com.poolmate.backend.modules.payment.domain.PaymentStatus;
import com.poolmate.backend.modules.payment.infrastructure.persistence.MemberPaymentCount;
import com.poolmate.backend.modules.payment.infrastructure.persistence.PaymentRecordRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class JpaPaymentLedger implements PaymentLedger {

    private final PaymentRecordRepository paymentRecordRepository;

    public JpaPaymentLedger(PaymentRecordRepository paymentRecordRepository) {
        this.paymentRecordRepository = paymentRecordRepository;
    }

    @Override
    public Map<UUID, Long> countValidatedForInstallment(UUID poolId, int installmentNumber) {
        return paymentRecordRepository
                .countByMemberForInstallment(poolId, installmentNumber, PaymentStatus.VALIDATED)
                .stream()
                .collect(Collectors.toUnmodifiableMap(MemberPaymentCount::memberId, MemberPaymentCount::count));
    }
}
