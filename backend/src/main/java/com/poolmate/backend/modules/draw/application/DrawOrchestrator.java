package com.poolmate.backend.modules.draw.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.audit.application.AuditLogService;
import com.poolmate.backend.modules.draw.domain.DrawAudit;
import com.poolmate.backend.modules.draw.domain.DrawCandidate;
import com.poolmate.backend.modules.draw.domain.DrawMethod;
import com.poolmate.backend.modules.draw.domain.DrawRecord;
import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.DrawStatus;
import com.poolmate.backend.modules.draw.domain.ParticipationDecision;
import com.poolmate.backend.modules.draw.domain.RoundOutcome;
import com.poolmate.backend.modules.draw.domain.WindowCloseReason;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRecordRepository;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRoundRepository;
import com.poolmate.backend.modules.notification.application.NotificationDispatcher;
import com.poolmate.backend.modules.notification.application.NotificationService;
import com.poolmate.backend.modules.notification.domain.NotificationKind;
import com.poolmate.backend.modules.pool.application.PoolStandingService;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.domain.PoolStatus;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Drives a round from eligibility to the committed draw. The waiting step is event driven:
 * a timer bound to the deadline, a poll ticker, and an immediate check after every member answer.
 */
@Service
public class DrawOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DrawOrchestrator.class);

    private static final String RESOURCE_ROUND = "DRAW_ROUND";
    private static final String RESOURCE_DRAW = "DRAW_RECORD";

    private final PoolRepository poolRepository;
    private final DrawRoundRepository drawRoundRepository;
    private final DrawRecordRepository drawRecordRepository;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final ConsensusWindowTracker consensusWindowTracker;
    private final SelectionAlgorithm selectionAlgorithm;
    private final RoundLedger roundLedger;
    private final PoolStandingService poolStandingService;
    private final NotificationDispatcher notificationDispatcher;
    private final AuditLogService auditLogService;
    private final ThreadPoolTaskScheduler drawTaskScheduler;
    private final DrawProperties drawProperties;
    private final Clock clock;

    private final Map<UUID, RoundHandle> inFlight = new ConcurrentHashMap<>();
    private final Set<UUID> reservations = ConcurrentHashMap.newKeySet();

    public DrawOrchestrator(
            PoolRepository poolRepository,
            DrawRoundRepository drawRoundRepository,
            DrawRecordRepository drawRecordRepository,
            EligibilityEvaluator eligibilityEvaluator,
            ConsensusWindowTracker consensusWindowTracker,
            SelectionAlgorithm selectionAlgorithm,
            RoundLedger roundLedger,
            PoolStandingService poolStandingService,
            NotificationDispatcher notificationDispatcher,
            AuditLogService auditLogService,
            @Qualifier("drawTaskScheduler") ThreadPoolTaskScheduler drawTaskScheduler,
            DrawProperties drawProperties,
            Clock clock
    ) {
        this.poolRepository = poolRepository;
        this.drawRoundRepository = drawRoundRepository;
        this.drawRecordRepository = drawRecordRepository;
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.consensusWindowTracker = consensusWindowTracker;
        this.selectionAlgorithm = selectionAlgorithm;
        this.roundLedger = roundLedger;
        this.poolStandingService = poolStandingService;
        this.notificationDispatcher = notificationDispatcher;
        this.auditLogService = auditLogService;
        this.drawTaskScheduler = drawTaskScheduler;
        this.drawProperties = drawProperties;
        this.clock = clock;
    }

    /**
     * Validates the pool, evaluates eligibility, opens the consensus window and sends the opt-in requests.
     * Selection and commit happen later on the scheduler once the window closes.
     */
    public RoundHandle startRound(UUID poolId, UUID actorId) {
        reserve(poolId);
        try {
            Pool pool = loadActivePool(poolId);
            ensureNoRoundInFlight(poolId);

            int roundNumber = roundLedger.nextRoundNumber(poolId);
            EligibilityResult eligibility = eligibilityEvaluator.evaluate(pool, roundNumber,
                    drawRecordRepository.findWinnerMemberIds(poolId, DrawStatus.COMPLETED));
            DrawRound round = consensusWindowTracker.open(pool, roundNumber, eligibility.candidates(),
                    eligibility.policy(), actorId);

            RoundHandle handle = new RoundHandle(round.getId(), poolId, roundNumber, round.getDeadlineAt(),
                    eligibility.policy(), actorId);
            inFlight.put(poolId, handle);
            armTimers(handle);

            for (PoolMember candidate : eligibility.candidates()) {
                Map<String, Object> payload = roundPayload(handle);
                payload.put("deadlineAt", round.getDeadlineAt().toString());
                payload.put("memberId", candidate.getId());
                dispatchSafely(candidate.getUserId(), NotificationKind.DRAW_OPT_IN_REQUEST, payload);
            }
            consensusWindowTracker.markAwaitingResponses(round.getId());

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("poolId", poolId.toString());
            detail.put("roundNumber", roundNumber);
            detail.put("candidates", eligibility.candidates().size());
            detail.put("policy", eligibility.policy().name());
            recordAudit("ROUND_START", RESOURCE_ROUND, round.getId(), actorId, detail);
            log.info("Round {} of pool {} started with {} candidates, deadline {}",
                    roundNumber, poolId, eligibility.candidates().size(), round.getDeadlineAt());
            return handle;
        } finally {
            reservations.remove(poolId);
        }
    }

    /**
     * Applies a member answer and, when it was the last one missing, completes the round without waiting
     * for the next tick.
     */
    public RoundAck respond(UUID poolId, UUID userId, boolean participate) {
        UUID roundId = consensusWindowTracker.respond(poolId, userId, participate);
        boolean closed = consensusWindowTracker.closeIfComplete(roundId);
        if (closed) {
            RoundHandle handle = inFlight.get(poolId);
            if (handle != null && handle.getRoundId().equals(roundId)) {
                drawTaskScheduler.execute(() -> completeRound(handle));
            }
        }
        return new RoundAck(roundId, ParticipationDecision.of(participate), closed);
    }

    /**
     * Stops a round before its commit. No draw record is written and no result is announced.
     */
    public RoundResult abortRound(UUID poolId, UUID actorId, String reason) {
        String detail = reason == null || reason.isBlank() ? "aborted by operator" : reason.trim();
        RoundHandle handle = inFlight.get(poolId);
        if (handle == null) {
            DrawRound orphan = consensusWindowTracker.currentRound(poolId)
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "NO_ROUND_IN_PROGRESS"));
            consensusWindowTracker.abort(orphan.getId());
            consensusWindowTracker.recordOutcome(orphan.getId(), RoundOutcome.ABORTED, detail, null);
            recordAudit("ROUND_ABORT", RESOURCE_ROUND, orphan.getId(), actorId, Map.of("reason", detail));
            return new RoundResult(orphan.getId(), orphan.getRoundNumber(), RoundOutcome.ABORTED, null, null, detail);
        }
        if (!handle.abort()) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROUND_ALREADY_COMMITTING",
                    "round " + handle.getRoundNumber() + " is already being committed");
        }
        handle.cancelTimers();
        consensusWindowTracker.abort(handle.getRoundId());
        RoundResult result = finish(handle, RoundOutcome.ABORTED, detail, null, null);
        recordAudit("ROUND_ABORT", RESOURCE_ROUND, handle.getRoundId(), actorId, Map.of("reason", detail));
        log.info("Round {} of pool {} aborted by {}", handle.getRoundNumber(), poolId, actorId);
        return result;
    }

    /**
     * Commits a draw for a beneficiary chosen by an administrator, through the same ledger as random draws.
     */
    public DrawRecord manualDraw(UUID poolId, UUID actorId, UUID memberId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "MANUAL_REASON_REQUIRED",
                    "a manual draw needs a reason");
        }
        reserve(poolId);
        try {
            Pool pool = loadActivePool(poolId);
            ensureNoRoundInFlight(poolId);

            PoolMember beneficiary = pool.getMembers().stream()
                    .filter(member -> member.getId().equals(memberId))
                    .findFirst()
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
            List<UUID> recordedWinners = drawRecordRepository.findWinnerMemberIds(poolId, DrawStatus.COMPLETED);
            if (beneficiary.hasWon() || recordedWinners.contains(beneficiary.getId())) {
                throw new ProblemException(HttpStatus.CONFLICT, "MEMBER_ALREADY_WON",
                        "member " + memberId + " already received the pot");
            }

            DrawCandidate candidate = new DrawCandidate(beneficiary.getId(), beneficiary.getUserId(),
                    beneficiary.getDisplayName(), ParticipationDecision.OPTED_IN, false);
            DrawRecord record = roundLedger.commit(new DrawDraft(
                    poolId,
                    roundLedger.nextRoundNumber(poolId),
                    beneficiary.getId(),
                    pool.potAmount(),
                    DrawMethod.MANUAL,
                    DrawAudit.manual(candidate, reason),
                    actorId,
                    OffsetDateTime.now(clock)
            ));

            List<PoolMember> others = pool.getMembers().stream()
                    .filter(member -> !member.hasWon())
                    .filter(member -> !member.getId().equals(beneficiary.getId()))
                    .toList();
            applyCommittedDraw(record, beneficiary, others);
            recordAudit("DRAW_MANUAL", RESOURCE_DRAW, record.getId(), actorId,
                    Map.of("poolId", poolId.toString(), "roundNumber", record.getRoundNumber(), "reason", reason));
            return record;
        } finally {
            reservations.remove(poolId);
        }
    }

    /**
     * Re-attaches timers to rounds still in progress that this process does not drive, e.g. after a restart.
     *
     * @return number of rounds resumed
     */
    public int resumeOrphanedRounds() {
        int resumed = 0;
        for (DrawRound round : drawRoundRepository.findByOutcome(RoundOutcome.IN_PROGRESS)) {
            UUID poolId = round.getPool().getId();
            if (reservations.contains(poolId) || round.getDeadlineAt() == null) {
                continue;
            }
            RoundHandle handle = new RoundHandle(round.getId(), poolId, round.getRoundNumber(),
                    round.getDeadlineAt(), round.getEligibilityPolicy(), round.getStartedBy());
            if (inFlight.putIfAbsent(poolId, handle) != null) {
                continue;
            }
            boolean stillOpen = drawRoundRepository.findById(round.getId())
                    .map(current -> current.getOutcome() == RoundOutcome.IN_PROGRESS)
                    .orElse(false);
            if (!stillOpen) {
                inFlight.remove(poolId, handle);
                continue;
            }
            consensusWindowTracker.markAwaitingResponses(round.getId());
            armTimers(handle);
            resumed++;
            log.info("Resumed round {} of pool {} (window {})", round.getRoundNumber(), poolId, round.getWindowState());
        }
        return resumed;
    }

    public Optional<RoundHandle> findHandle(UUID poolId) {
        return Optional.ofNullable(inFlight.get(poolId));
    }

    void tick(RoundHandle handle) {
        if (handle.getPhase() != RoundHandle.Phase.WAITING) {
            return;
        }
        UUID roundId = handle.getRoundId();
        boolean closed;
        try {
            closed = consensusWindowTracker.closeIfComplete(roundId)
                    || consensusWindowTracker.closeIfDue(roundId)
                    || consensusWindowTracker.isClosed(roundId);
        } catch (RuntimeException ex) {
            log.warn("Consensus window check failed for round {}, retrying on next tick: {}", roundId, ex.getMessage());
            return;
        }
        if (closed) {
            completeRound(handle);
        }
    }

    private void completeRound(RoundHandle handle) {
        if (!handle.advance(RoundHandle.Phase.WAITING, RoundHandle.Phase.SELECTING)) {
            return;
        }
        handle.cancelTimers();
        try {
            selectAndCommit(handle);
        } catch (DrawIntegrityException ex) {
            log.error("[ALERT][Draw] integrity violation in round {} of pool {}: {}",
                    handle.getRoundNumber(), handle.getPoolId(), ex.getDetailMessage());
            failRound(handle, ex.getDetailMessage());
        } catch (RuntimeException ex) {
            log.error("Round {} of pool {} failed", handle.getRoundNumber(), handle.getPoolId(), ex);
            failRound(handle, ex.getMessage());
        }
    }

    private void selectAndCommit(RoundHandle handle) {
        FinalizedCandidates finalized = consensusWindowTracker.finalizeCandidates(handle.getRoundId());
        if (finalized.closeReason() == WindowCloseReason.ABORTED) {
            if (handle.advance(RoundHandle.Phase.SELECTING, RoundHandle.Phase.ABORTED)) {
                finish(handle, RoundOutcome.ABORTED, "consensus window aborted", null, null);
            }
            return;
        }
        if (finalized.isEmpty()) {
            if (handle.advance(RoundHandle.Phase.SELECTING, RoundHandle.Phase.FINISHED)) {
                finish(handle, RoundOutcome.NO_PARTICIPANTS, "no participants", null, null);
                recordAudit("ROUND_NO_PARTICIPANTS", RESOURCE_ROUND, handle.getRoundId(), handle.getStartedBy(),
                        Map.of("declined", finalized.declinedMemberIds().size()));
            }
            return;
        }

        Selection<PoolMember> selection = selectionAlgorithm.select(finalized.optedIn());
        Pool pool = poolRepository.findWithMembersById(handle.getPoolId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "POOL_NOT_FOUND"));
        DrawAudit audit = new DrawAudit(
                finalized.auditCandidates(),
                finalized.declinedMemberIds(),
                selection.randomValue(),
                selection.index(),
                handle.getPolicy(),
                finalized.closeReason(),
                null
        );

        if (!handle.advance(RoundHandle.Phase.SELECTING, RoundHandle.Phase.COMMITTING)) {
            return;
        }
        PoolMember winner = selection.winner();
        DrawRecord record;
        try {
            record = roundLedger.commit(new DrawDraft(
                    handle.getPoolId(),
                    handle.getRoundNumber(),
                    winner.getId(),
                    pool.potAmount(),
                    DrawMethod.RANDOM,
                    audit,
                    handle.getStartedBy(),
                    OffsetDateTime.now(clock)
            ));
        } catch (RoundCommitRejectedException ex) {
            handle.advance(RoundHandle.Phase.COMMITTING, RoundHandle.Phase.FINISHED);
            finish(handle, RoundOutcome.REJECTED, ex.getDetailMessage(), null, null);
            return;
        }

        handle.advance(RoundHandle.Phase.COMMITTING, RoundHandle.Phase.FINISHED);
        consensusWindowTracker.recordOutcome(handle.getRoundId(), RoundOutcome.COMMITTED, null, record.getId());
        List<PoolMember> losers = finalized.optedIn().stream()
                .filter(member -> !member.getId().equals(winner.getId()))
                .toList();
        applyCommittedDraw(record, winner, losers);
        recordAudit("DRAW_COMMIT", RESOURCE_DRAW, record.getId(), handle.getStartedBy(),
                Map.of("roundId", handle.getRoundId().toString(), "roundNumber", record.getRoundNumber(),
                        "candidates", finalized.optedIn().size()));
        finish(handle, RoundOutcome.COMMITTED, null, record.getId(), winner.getId());
    }

    /**
     * Post-commit side effects. Failures are logged; the committed record stays.
     */
    private void applyCommittedDraw(DrawRecord record, PoolMember winner, List<PoolMember> losers) {
        UUID poolId = record.getPool().getId();
        try {
            poolStandingService.markWinner(poolId, winner.getId(), record.getDrawnAt(), record.getAmount());
        } catch (RuntimeException ex) {
            log.error("[ALERT][Draw] roster update failed after commit draw={} member={}", record.getId(), winner.getId(), ex);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NotificationService.PAYLOAD_CORRELATION_ID, record.getId());
        payload.put("poolId", poolId);
        payload.put("roundNumber", record.getRoundNumber());
        payload.put("amount", record.getAmount());
        payload.put("method", record.getMethod().name());
        dispatchSafely(winner.getUserId(), NotificationKind.DRAW_WINNER, payload);
        for (PoolMember loser : losers) {
            dispatchSafely(loser.getUserId(), NotificationKind.DRAW_RESULT, payload);
        }
    }

    private void failRound(RoundHandle handle, String detail) {
        handle.advance(RoundHandle.Phase.SELECTING, RoundHandle.Phase.FINISHED);
        try {
            consensusWindowTracker.abort(handle.getRoundId());
        } catch (RuntimeException ex) {
            log.warn("Could not close window of failed round {}: {}", handle.getRoundId(), ex.getMessage());
        }
        finish(handle, RoundOutcome.FAILED, detail, null, null);
    }

    private RoundResult finish(RoundHandle handle, RoundOutcome outcome, String detail, UUID drawRecordId, UUID winnerId) {
        if (outcome != RoundOutcome.COMMITTED) {
            try {
                consensusWindowTracker.recordOutcome(handle.getRoundId(), outcome, detail, drawRecordId);
            } catch (RuntimeException ex) {
                log.error("Could not record outcome {} of round {}", outcome, handle.getRoundId(), ex);
            }
        }
        inFlight.remove(handle.getPoolId(), handle);
        RoundResult result = new RoundResult(handle.getRoundId(), handle.getRoundNumber(), outcome, drawRecordId,
                winnerId, detail);
        handle.complete(result);
        log.info("Round {} of pool {} finished: {}{}", handle.getRoundNumber(), handle.getPoolId(), outcome,
                detail == null ? "" : " (" + detail + ")");
        return result;
    }

    private void armTimers(RoundHandle handle) {
        handle.attachTimer(drawTaskScheduler.schedule(() -> tick(handle), handle.getDeadlineAt().toInstant()));
        handle.attachTimer(drawTaskScheduler.scheduleWithFixedDelay(() -> tick(handle), drawProperties.pollInterval()));
    }

    private void dispatchSafely(UUID userId, NotificationKind kind, Map<String, Object> payload) {
        try {
            notificationDispatcher.notify(userId, kind, payload);
        } catch (RuntimeException ex) {
            log.warn("[ALERT][Draw][{}] notification dispatch failed user={} detail={}", kind, userId, ex.getMessage());
        }
    }

    private void recordAudit(String action, String resourceType, UUID resourceId, UUID actorId, Map<String, Object> detail) {
        try {
            auditLogService.record(new AuditLogService.AuditLogCommand(
                    action, resourceType, resourceId.toString(), actorId, resourceId, detail));
        } catch (RuntimeException ex) {
            log.warn("Audit entry {} for {} could not be written: {}", action, resourceId, ex.getMessage());
        }
    }

    private Map<String, Object> roundPayload(RoundHandle handle) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(NotificationService.PAYLOAD_CORRELATION_ID, handle.getRoundId());
        payload.put("poolId", handle.getPoolId());
        payload.put("roundNumber", handle.getRoundNumber());
        return payload;
    }

    private Pool loadActivePool(UUID poolId) {
        Pool pool = poolRepository.findWithMembersById(poolId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "POOL_NOT_FOUND"));
        if (pool.getStatus() != PoolStatus.ACTIVE) {
            throw new ProblemException(HttpStatus.CONFLICT, "POOL_NOT_ACTIVE",
                    "pool not active (" + pool.getStatus().name().toLowerCase() + ")");
        }
        return pool;
    }

    private void ensureNoRoundInFlight(UUID poolId) {
        if (inFlight.containsKey(poolId)
                || drawRoundRepository.findFirstByPoolIdAndOutcome(poolId, RoundOutcome.IN_PROGRESS).isPresent()) {
            throw roundInProgress();
        }
    }

    private void reserve(UUID poolId) {
        if (!reservations.add(poolId)) {
            throw roundInProgress();
        }
    }

    private ProblemException roundInProgress() {
        return new ProblemException(HttpStatus.CONFLICT, "ROUND_ALREADY_IN_PROGRESS",
                "a round of this pool is already in progress");
    }
}
