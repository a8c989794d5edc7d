package com.poolmate.backend.modules.payment.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.payment.domain.PaymentRecord;
import com.poolmate.backend.modules.payment.domain.PaymentStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, UUID> {

    @Query("""
            select new com.poolmate.backend.modules.payment.infrastructure.persistence.MemberPaymentCount(
                       p.member.id, count(p))
              from PaymentRecord p
             where p.pool.id = :poolId
               and p.installmentNumber = :installment
               and p.status = :status
             group by p.member.id
            """)
    List<MemberPaymentCount> countByMemberForInstallment(
            @Param("poolId") UUID poolId,
            @Param("installment") int installment,
            @Param("status") PaymentStatus status
    );
}
