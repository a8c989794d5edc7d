package com.poolmate.backend.modules.draw.domain;

import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Replay payload stored with every draw record. {@code candidates} is the exact list the
 * selection ran over, in selection order; {@code randomValue} and {@code selectedIndex}
 * are absent for manual draws.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DrawAudit(
        List<DrawCandidate> candidates,
        List<UUID> declinedMemberIds,
        Double randomValue,
        Integer selectedIndex,
        EligibilityPolicy policy,
        WindowCloseReason closeReason,
        String manualReason
) {

    public DrawAudit {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
        declinedMemberIds = declinedMemberIds == null ? List.of() : List.copyOf(declinedMemberIds);
    }

    public static DrawAudit manual(DrawCandidate beneficiary, String reason) {
        return new DrawAudit(List.of(beneficiary), List.of(), null, null, null, null, reason);
    }
}
