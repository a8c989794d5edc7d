package com.poolmate.backend.modules.draw.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.domain.DrawStatus;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRecordRepository;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolMemberRepository;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Append-only ledger of draw records. {@link #commit(DrawDraft)} is the only pool-exclusive
 * section of the engine: it holds the pool row lock for the length of its transaction, with the
 * unique indexes on {@code draw_record} as the backstop.
 */
@Service
public class RoundLedger {

    private static final Logger log = LoggerFactory.getLogger(RoundLedger.class);

    private final DrawRecordRepository drawRecordRepository;
    private final PoolRepository poolRepository;
    private final PoolMemberRepository poolMemberRepository;
    private final TransactionOperations transactionOperations;
    private final DrawProperties drawProperties;
    private final Clock clock;
    private final Counter committedCounter;
    private final Counter rejectedCounter;

    public RoundLedger(
            DrawRecordRepository drawRecordRepository,
            PoolRepository poolRepository,
            PoolMemberRepository poolMemberRepository,
            TransactionOperations transactionOperations,
            DrawProperties drawProperties,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.drawRecordRepository = drawRecordRepository;
        this.poolRepository = poolRepository;
        this.poolMemberRepository = poolMemberRepository;
        this.transactionOperations = transactionOperations;
        this.drawProperties = drawProperties;
        this.clock = clock;
        this.committedCounter = Counter.builder("poolmate.draws.committed").register(meterRegistry);
        this.rejectedCounter = Counter.builder("poolmate.draws.rejected").register(meterRegistry);
    }

    /**
     * Next round number of the pool. Cancelled records keep their number.
     */
    public int nextRoundNumber(UUID poolId) {
        return drawRecordRepository.findMaxRoundNumber(poolId) + 1;
    }

    /**
     * Writes the draw record, or rejects it without any side effect.
     *
     * @throws RoundCommitRejectedException when the round number is stale or the winner already won in this pool
     */
    public DrawRecord commit(DrawDraft draft) {
        try {
            DrawRecord committed = transactionOperations.execute(status -> insert(draft));
            committedCounter.increment();
            log.info("Committed draw pool={} round={} winner={} method={}",
                    draft.poolId(), draft.roundNumber(), draft.winnerMemberId(), draft.method());
            return committed;
        } catch (DataIntegrityViolationException ex) {
            throw reject(draft, "ledger constraint rejected round " + draft.roundNumber());
        }
    }

    /**
     * Flags a committed draw as cancelled. The record and its round number stay in the ledger.
     */
    public DrawRecord cancel(UUID drawId, String reason, UUID actorId) {
        return cancel(drawId, reason, actorId, record -> { });
    }

    /**
     * Flags a committed draw as cancelled after {@code restore} has undone its roster effects.
     * Both run in one transaction: a failing restore leaves the record {@code COMPLETED}.
     */
    public DrawRecord cancel(UUID drawId, String reason, UUID actorId, Consumer<DrawRecord> restore) {
        String trimmed = reason == null ? "" : reason.trim();
        if (trimmed.length() < drawProperties.minCancelReasonLength()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "CANCEL_REASON_TOO_SHORT",
                    "cancellation reason needs at least " + drawProperties.minCancelReasonLength() + " characters",
                    Map.of("minLength", drawProperties.minCancelReasonLength()));
        }
        return transactionOperations.execute(status -> {
            DrawRecord record = drawRecordRepository.findDetailedById(drawId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DRAW_NOT_FOUND"));
            if (record.isCancelled()) {
                throw new ProblemException(HttpStatus.CONFLICT, "DRAW_ALREADY_CANCELLED", "already cancelled");
            }
            restore.accept(record);
            int updated = drawRecordRepository.markCancelled(drawId, trimmed, actorId, OffsetDateTime.now(clock));
            if (updated == 0) {
                throw new ProblemException(HttpStatus.CONFLICT, "DRAW_ALREADY_CANCELLED", "already cancelled");
            }
            log.info("Cancelled draw {} of pool={} round={}", drawId, record.getPool().getId(), record.getRoundNumber());
            return drawRecordRepository.findDetailedById(drawId).orElseThrow();
        });
    }

    private DrawRecord insert(DrawDraft draft) {
        Pool pool = poolRepository.findByIdForUpdate(draft.poolId())
                .orElseThrow(() -> reject(draft, "pool " + draft.poolId() + " does not exist"));
        int expected = nextRoundNumber(draft.poolId());
        if (draft.roundNumber() != expected) {
            throw reject(draft, "round " + draft.roundNumber() + " is no longer next, expected " + expected);
        }
        if (drawRecordRepository.existsByPoolIdAndWinnerIdAndStatus(
                draft.poolId(), draft.winnerMemberId(), DrawStatus.COMPLETED)) {
            throw reject(draft, "member " + draft.winnerMemberId() + " already won in this pool");
        }

        PoolMember winner = poolMemberRepository.findById(draft.winnerMemberId())
                .filter(member -> member.getPool().getId().equals(draft.poolId()))
                .orElseThrow(() -> reject(draft, "member " + draft.winnerMemberId() + " is not on the roster"));

        DrawRecord record = new DrawRecord();
        record.setPool(pool);
        record.setRoundNumber(draft.roundNumber());
        record.setWinner(winner);
        record.setAmount(draft.amount());
        record.setMethod(draft.method());
        record.setStatus(DrawStatus.COMPLETED);
        record.setDrawnAt(draft.drawnAt());
        record.setAudit(draft.audit());
        record.setCreatedBy(draft.createdBy());
        return drawRecordRepository.saveAndFlush(record);
    }

    private RoundCommitRejectedException reject(DrawDraft draft, String detail) {
        rejectedCounter.increment();
        log.warn("Rejected draw commit pool={} round={} winner={}: {}",
                draft.poolId(), draft.roundNumber(), draft.winnerMemberId(), detail);
        return new RoundCommitRejectedException(detail,
                Map.of("poolId", draft.poolId().toString(), "roundNumber", draft.roundNumber()),
                drawProperties.retryAfterSeconds());
    }
}
