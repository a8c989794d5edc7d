package com.poolmate.backend.modules.draw.application;

import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;
import com.poolmate.backend.modules.pool.domain.PoolMember;

/**
 * @param candidates members allowed to compete, ordered by join time then id
 * @param unpaidMemberIds non-winners left out for lack of payment (always empty under {@code STRICT})
 */
public record EligibilityResult(
        int roundNumber,
        EligibilityPolicy policy,
        List<PoolMember> candidates,
        int nonWinnerCount,
        int validatedCount,
        List<UUID> unpaidMemberIds
) {

    public EligibilityResult {
        candidates = List.copyOf(candidates);
        unpaidMemberIds = List.copyOf(unpaidMemberIds);
    }
}
