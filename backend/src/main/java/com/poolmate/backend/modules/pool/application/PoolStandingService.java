package com.poolmate.backend.modules.pool.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.domain.PoolStatus;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies the roster side effects of committed and cancelled draws.
 */
@Service
@Transactional
public class PoolStandingService {

    private static final Logger log = LoggerFactory.getLogger(PoolStandingService.class);

    private final PoolRepository poolRepository;

    public PoolStandingService(PoolRepository poolRepository) {
        this.poolRepository = poolRepository;
    }

    /**
     * Flags the winner on the roster and closes the pool once every member has received the pot.
     *
     * @return {@code true} when this win closed the pool
     */
    public boolean markWinner(UUID poolId, UUID memberId, OffsetDateTime wonAt, long amount) {
        Pool pool = loadPool(poolId);
        PoolMember winner = findMember(pool, memberId);
        winner.markWon(wonAt, amount);
        boolean closing = pool.getStatus() == PoolStatus.ACTIVE && pool.remainingNonWinners() == 0;
        if (closing) {
            pool.setStatus(PoolStatus.CLOSED);
            pool.setClosedAt(wonAt);
            log.info("Pool {} closed: every member has received the pot", pool.getId());
        }
        poolRepository.save(pool);
        return closing;
    }

    /**
     * Reverts the roster flag of a cancelled draw's winner; a pool closed by that draw is reopened.
     */
    public void clearWinner(UUID poolId, UUID memberId) {
        Pool pool = loadPool(poolId);
        PoolMember member = findMember(pool, memberId);
        member.clearWin();
        if (pool.getStatus() == PoolStatus.CLOSED) {
            pool.setStatus(PoolStatus.ACTIVE);
            pool.setClosedAt(null);
            log.info("Pool {} reopened after draw cancellation", pool.getId());
        }
        poolRepository.save(pool);
    }

    private Pool loadPool(UUID poolId) {
        return poolRepository.findWithMembersById(poolId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "POOL_NOT_FOUND"));
    }

    private PoolMember findMember(Pool pool, UUID memberId) {
        return pool.getMembers().stream()
                .filter(member -> member.getId().equals(memberId))
                .findFirst()
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
    }
}
