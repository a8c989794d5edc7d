package com.poolmate.backend.modules.pool.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.audit.application.AuditLogService;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolStatus;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;
import com.poolmate.backend.modules.pool.presentation.dto.PoolResponse;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class PoolLifecycleService {

    // Administrator and treasurer seats come on top of the configured minimum.
    private static final int MANAGEMENT_SEATS = 2;

    private final PoolRepository poolRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public PoolLifecycleService(PoolRepository poolRepository, AuditLogService auditLogService, Clock clock) {
        this.poolRepository = poolRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PoolResponse getPool(UUID poolId) {
        return PoolResponse.from(loadPool(poolId));
    }

    public PoolResponse activate(UUID poolId, UUID actorId) {
        Pool pool = loadPool(poolId);
        if (pool.getStatus() != PoolStatus.PENDING) {
            throw new ProblemException(HttpStatus.CONFLICT, "POOL_NOT_PENDING",
                    "pool is " + pool.getStatus().name().toLowerCase());
        }
        if (pool.getTreasurerUserId() == null) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TREASURER_REQUIRED",
                    "a treasurer must be assigned before activation");
        }
        int required = pool.getMinMembers() + MANAGEMENT_SEATS;
        int current = pool.getMembers().size();
        if (current < required) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "ROSTER_TOO_SMALL",
                    "at least " + required + " members required, " + current + " present",
                    Map.of("required", required, "current", current));
        }
        pool.setStatus(PoolStatus.ACTIVE);
        pool.setActivatedAt(OffsetDateTime.now(clock));
        return transitioned(pool, "POOL_ACTIVATE", actorId);
    }

    public PoolResponse suspend(UUID poolId, UUID actorId) {
        Pool pool = loadPool(poolId);
        if (pool.getStatus() != PoolStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.CONFLICT, "POOL_NOT_ACTIVE");
        }
        pool.setStatus(PoolStatus.SUSPENDED);
        return transitioned(pool, "POOL_SUSPEND", actorId);
    }

    public PoolResponse resume(UUID poolId, UUID actorId) {
        Pool pool = loadPool(poolId);
        if (pool.getStatus() != PoolStatus.SUSPENDED) {
            throw new ProblemException(HttpStatus.CONFLICT, "POOL_NOT_SUSPENDED");
        }
        pool.setStatus(PoolStatus.ACTIVE);
        return transitioned(pool, "POOL_RESUME", actorId);
    }

    public PoolResponse close(UUID poolId, UUID actorId) {
        Pool pool = loadPool(poolId);
        if (pool.getStatus() != PoolStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.CONFLICT, "POOL_NOT_ACTIVE");
        }
        long waiting = pool.remainingNonWinners();
        if (waiting > 0) {
            throw new ProblemException(HttpStatus.CONFLICT, "MEMBERS_STILL_WAITING",
                    waiting + " member(s) have not received the pot yet",
                    Map.of("waiting", waiting));
        }
        pool.setStatus(PoolStatus.CLOSED);
        pool.setClosedAt(OffsetDateTime.now(clock));
        return transitioned(pool, "POOL_CLOSE", actorId);
    }

    private PoolResponse transitioned(Pool pool, String actionType, UUID actorId) {
        Pool saved = poolRepository.save(pool);
        auditLogService.record(new AuditLogService.AuditLogCommand(
                actionType,
                "POOL",
                saved.getId().toString(),
                actorId,
                null,
                Map.of("status", saved.getStatus().name())
        ));
        return PoolResponse.from(saved);
    }

    private Pool loadPool(UUID poolId) {
        return poolRepository.findWithMembersById(poolId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "POOL_NOT_FOUND"));
    }
}
