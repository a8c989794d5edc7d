package com.poolmate.backend.modules.pool.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.modules.pool.domain.Pool;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PoolResponse(
        UUID poolId,
        String name,
        String status,
        String frequency,
        long contributionAmount,
        int optInWindowMinutes,
        int memberCount,
        long remainingNonWinners,
        OffsetDateTime activatedAt,
        OffsetDateTime closedAt
) {

    public static PoolResponse from(Pool pool) {
        return new PoolResponse(
                pool.getId(),
                pool.getName(),
                pool.getStatus().name(),
                pool.getFrequency().name(),
                pool.getContributionAmount(),
                pool.getOptInWindowMinutes(),
                pool.getMembers().size(),
                pool.remainingNonWinners(),
                pool.getActivatedAt(),
                pool.getClosedAt()
        );
    }
}
