package com.poolmate.backend.modules.draw.application;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;
import com.poolmate.backend.modules.payment.application.PaymentLedger;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Decides who may compete in a round from the roster, the recorded winners and the
 * validated payments of the round's installment. Reads only; never writes.
 */
@Component
public class EligibilityEvaluator {

    static final Comparator<PoolMember> ROSTER_ORDER = Comparator
            .comparing(PoolMember::getJoinedAt)
            .thenComparing(PoolMember::getId);

    private final PaymentLedger paymentLedger;
    private final EligibilityPolicy policy;

    public EligibilityEvaluator(PaymentLedger paymentLedger, DrawProperties drawProperties) {
        this.paymentLedger = paymentLedger;
        this.policy = drawProperties.eligibilityPolicy();
    }

    public EligibilityPolicy getPolicy() {
        return policy;
    }

    /**
     * @param recordedWinnerIds winners of non-cancelled draw records, excluded even when the roster flag lags behind
     * @throws InsufficientPaymentsException when the payment requirement of the active policy is unmet
     * @throws ProblemException {@code NO_ELIGIBLE_MEMBERS} when every member has already won
     */
    public EligibilityResult evaluate(Pool pool, int roundNumber, Collection<UUID> recordedWinnerIds) {
        Set<UUID> recorded = Set.copyOf(recordedWinnerIds);
        List<PoolMember> nonWinners = pool.getMembers().stream()
                .filter(member -> !member.hasWon())
                .filter(member -> !recorded.contains(member.getId()))
                .sorted(ROSTER_ORDER)
                .toList();
        if (nonWinners.isEmpty()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "NO_ELIGIBLE_MEMBERS",
                    "every member of the pool has already won");
        }

        Map<UUID, Long> validatedCounts = paymentLedger.countValidatedForInstallment(pool.getId(), roundNumber);
        List<PoolMember> paid = nonWinners.stream()
                .filter(member -> validatedCounts.getOrDefault(member.getId(), 0L) > 0)
                .toList();
        List<UUID> unpaid = nonWinners.stream()
                .filter(member -> !paid.contains(member))
                .map(PoolMember::getId)
                .toList();

        return switch (policy) {
            case STRICT -> {
                if (!unpaid.isEmpty()) {
                    throw new InsufficientPaymentsException(roundNumber, paid.size(), nonWinners.size(), unpaid);
                }
                yield new EligibilityResult(roundNumber, policy, nonWinners, nonWinners.size(), paid.size(), List.of());
            }
            case RELAXED -> {
                if (paid.isEmpty()) {
                    throw new InsufficientPaymentsException(roundNumber, 0, nonWinners.size(), unpaid);
                }
                yield new EligibilityResult(roundNumber, policy, paid, nonWinners.size(), paid.size(), unpaid);
            }
        };
    }
}
