package com.poolmate.backend.modules.draw.application;

import java.util.List;
import java.util.UUID;

import com.poolmate.backend.modules.draw.domain.DrawCandidate;
import com.poolmate.backend.modules.draw.domain.WindowCloseReason;
import com.poolmate.backend.modules.pool.domain.PoolMember;

/**
 * Frozen outcome of a closed consensus window. {@code optedIn} and {@code auditCandidates} share the same order.
 */
public record FinalizedCandidates(
        UUID roundId,
        WindowCloseReason closeReason,
        List<PoolMember> optedIn,
        List<DrawCandidate> auditCandidates,
        List<UUID> declinedMemberIds
) {

    public FinalizedCandidates {
        optedIn = List.copyOf(optedIn);
        auditCandidates = List.copyOf(auditCandidates);
        declinedMemberIds = List.copyOf(declinedMemberIds);
    }

    public boolean isEmpty() {
        return optedIn.isEmpty();
    }
}
