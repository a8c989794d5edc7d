package com.poolmate.backend.modules.draw.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;

/**
 * In-memory handle of a running round: its phase, its timers and the eventual result.
 * Phase changes are compare-and-set so exactly one thread drives selection and commit.
 */
public class RoundHandle {

    public enum Phase {
        WAITING,
        SELECTING,
        COMMITTING,
        FINISHED,
        ABORTED
    }

    private final UUID roundId;
    private final UUID poolId;
    private final int roundNumber;
    private final OffsetDateTime deadlineAt;
    private final EligibilityPolicy policy;
    private final UUID startedBy;
    private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.WAITING);
    private final CompletableFuture<RoundResult> result = new CompletableFuture<>();
    private final List<ScheduledFuture<?>> timers = new CopyOnWriteArrayList<>();

    public RoundHandle(
            UUID roundId,
            UUID poolId,
            int roundNumber,
            OffsetDateTime deadlineAt,
            EligibilityPolicy policy,
            UUID startedBy
    ) {
        this.roundId = roundId;
        this.poolId = poolId;
        this.roundNumber = roundNumber;
        this.deadlineAt = deadlineAt;
        this.policy = policy;
        this.startedBy = startedBy;
    }

    public UUID getRoundId() {
        return roundId;
    }

    public UUID getPoolId() {
        return poolId;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public OffsetDateTime getDeadlineAt() {
        return deadlineAt;
    }

    public EligibilityPolicy getPolicy() {
        return policy;
    }

    public UUID getStartedBy() {
        return startedBy;
    }

    public Phase getPhase() {
        return phase.get();
    }

    public CompletableFuture<RoundResult> result() {
        return result;
    }

    boolean advance(Phase expected, Phase next) {
        return phase.compareAndSet(expected, next);
    }

    /**
     * Succeeds only before the commit has started.
     */
    boolean abort() {
        return phase.compareAndSet(Phase.WAITING, Phase.ABORTED)
                || phase.compareAndSet(Phase.SELECTING, Phase.ABORTED);
    }

    void attachTimer(ScheduledFuture<?> timer) {
        timers.add(timer);
        if (phase.get() != Phase.WAITING) {
            timer.cancel(false);
        }
    }

    void cancelTimers() {
        timers.forEach(timer -> timer.cancel(false));
    }

    void complete(RoundResult roundResult) {
        cancelTimers();
        result.complete(roundResult);
    }
}
