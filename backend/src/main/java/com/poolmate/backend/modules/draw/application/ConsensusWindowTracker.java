package com.poolmate.backend.modules.draw.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.poolmate.backend.global.error.ProblemException;
import com.poolmate.backend.modules.draw.domain.DrawCandidate;
import com.poolmate.backend.modules.draw.domain.DrawRound;
import com.poolmate.backend.modules.draw.domain.EligibilityPolicy;
import com.poolmate.backend.modules.draw.domain.ParticipationDecision;
import com.poolmate.backend.modules.draw.domain.RoundOutcome;
import com.poolmate.backend.modules.draw.domain.RoundParticipation;
import com.poolmate.backend.modules.draw.domain.WindowCloseReason;
import com.poolmate.backend.modules.draw.domain.WindowState;
import com.poolmate.backend.modules.draw.infrastructure.persistence.DrawRoundRepository;
import com.poolmate.backend.modules.draw.infrastructure.persistence.RoundParticipationRepository;
import com.poolmate.backend.modules.pool.domain.Pool;
import com.poolmate.backend.modules.pool.domain.PoolMember;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolMemberRepository;
import com.poolmate.backend.modules.pool.infrastructure.persistence.PoolRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the opt-in window of a round. Every state change is a conditional write, so member
 * answers, poll ticks and operator aborts may race without a shared lock.
 */
@Service
public class ConsensusWindowTracker {

    private static final Logger log = LoggerFactory.getLogger(ConsensusWindowTracker.class);

    private final DrawRoundRepository drawRoundRepository;
    private final RoundParticipationRepository roundParticipationRepository;
    private final PoolRepository poolRepository;
    private final PoolMemberRepository poolMemberRepository;
    private final Clock clock;

    public ConsensusWindowTracker(
            DrawRoundRepository drawRoundRepository,
            RoundParticipationRepository roundParticipationRepository,
            PoolRepository poolRepository,
            PoolMemberRepository poolMemberRepository,
            Clock clock
    ) {
        this.drawRoundRepository = drawRoundRepository;
        this.roundParticipationRepository = roundParticipationRepository;
        this.poolRepository = poolRepository;
        this.poolMemberRepository = poolMemberRepository;
        this.clock = clock;
    }

    /**
     * Creates the round, stamps every candidate as notified and unanswered, and starts the deadline.
     *
     * @throws ProblemException {@code ROUND_ALREADY_IN_PROGRESS} when another round of the pool is still running
     */
    @Transactional
    public DrawRound open(Pool pool, int roundNumber, List<PoolMember> candidates, EligibilityPolicy policy, UUID startedBy) {
        int windowMinutes = pool.getOptInWindowMinutes();
        if (windowMinutes < Pool.MIN_OPT_IN_WINDOW_MINUTES || windowMinutes > Pool.MAX_OPT_IN_WINDOW_MINUTES) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_OPT_IN_WINDOW",
                    "opt-in window must be between " + Pool.MIN_OPT_IN_WINDOW_MINUTES + " and "
                            + Pool.MAX_OPT_IN_WINDOW_MINUTES + " minutes",
                    Map.of("optInWindowMinutes", windowMinutes));
        }

        DrawRound round = new DrawRound();
        round.setPool(poolRepository.getReferenceById(pool.getId()));
        round.setRoundNumber(roundNumber);
        round.setEligibilityPolicy(policy);
        round.setStartedBy(startedBy);
        try {
            round = drawRoundRepository.saveAndFlush(round);
        } catch (DataIntegrityViolationException ex) {
            throw new ProblemException(HttpStatus.CONFLICT, "ROUND_ALREADY_IN_PROGRESS",
                    "another round of this pool is still in progress");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<RoundParticipation> participations = new ArrayList<>(candidates.size());
        for (PoolMember candidate : candidates) {
            RoundParticipation participation = new RoundParticipation();
            participation.setDrawRound(round);
            participation.setMember(poolMemberRepository.getReferenceById(candidate.getId()));
            participation.setDecision(ParticipationDecision.UNANSWERED);
            participation.setNotifiedAt(now);
            participations.add(participation);
        }
        roundParticipationRepository.saveAll(participations);

        round.setWindowState(WindowState.NOTIFIED);
        round.setNotifiedAt(now);
        round.setDeadlineAt(now.plusMinutes(windowMinutes));
        DrawRound saved = drawRoundRepository.save(round);
        log.info("Opened consensus window for pool={} round={} candidates={} deadline={}",
                pool.getId(), roundNumber, candidates.size(), saved.getDeadlineAt());
        return saved;
    }

    @Transactional
    public void markAwaitingResponses(UUID roundId) {
        drawRoundRepository.markAwaitingResponses(roundId);
    }

    /**
     * Records one member's answer for the pool's current round. Later answers overwrite earlier ones.
     *
     * @return id of the round the answer was applied to
     */
    @Transactional
    public UUID respond(UUID poolId, UUID userId, boolean participate) {
        DrawRound round = drawRoundRepository.findFirstByPoolIdAndOutcome(poolId, RoundOutcome.IN_PROGRESS)
                .orElseThrow(this::windowClosed);
        PoolMember member = poolMemberRepository.findByPoolIdAndUserId(poolId, userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "MEMBER_NOT_FOUND"));
        if (roundParticipationRepository.findByDrawRoundIdAndMemberId(round.getId(), member.getId()).isEmpty()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_A_CANDIDATE",
                    "member is not a candidate of round " + round.getRoundNumber());
        }
        int updated = roundParticipationRepository.recordDecision(
                round.getId(),
                member.getId(),
                ParticipationDecision.of(participate),
                OffsetDateTime.now(clock)
        );
        if (updated == 0) {
            throw windowClosed();
        }
        return round.getId();
    }

    /**
     * Closes the window with {@code ALL_RESPONDED} once no candidate is left unanswered.
     *
     * @return {@code true} when this call closed the window
     */
    @Transactional
    public boolean closeIfComplete(UUID roundId) {
        if (roundParticipationRepository.countByDrawRoundIdAndDecision(roundId, ParticipationDecision.UNANSWERED) > 0) {
            return false;
        }
        boolean closed = drawRoundRepository.closeWindow(roundId, WindowCloseReason.ALL_RESPONDED,
                OffsetDateTime.now(clock)) == 1;
        if (closed) {
            log.info("Consensus window closed early, every candidate answered: round={}", roundId);
        }
        return closed;
    }

    /**
     * Closes the window once its deadline has passed and auto-enrolls every candidate who never answered.
     * Explicit opt-outs are kept.
     *
     * @return {@code true} when this call closed the window
     */
    @Transactional
    public boolean closeIfDue(UUID roundId) {
        if (drawRoundRepository.closeWindowIfDue(roundId, OffsetDateTime.now(clock)) == 0) {
            return false;
        }
        int enrolled = roundParticipationRepository.autoEnrollUnanswered(roundId);
        log.info("Consensus window deadline elapsed: round={} autoEnrolled={}", roundId, enrolled);
        return true;
    }

    @Transactional
    public boolean abort(UUID roundId) {
        return drawRoundRepository.closeWindow(roundId, WindowCloseReason.ABORTED, OffsetDateTime.now(clock)) == 1;
    }

    @Transactional(readOnly = true)
    public boolean isClosed(UUID roundId) {
        return drawRoundRepository.findById(roundId)
                .map(round -> round.getWindowState() == WindowState.CLOSED)
                .orElse(false);
    }

    /**
     * Returns the frozen list of opted-in candidates in roster order.
     *
     * @throws IllegalStateException when the window is not closed yet
     * @throws DrawIntegrityException when a member appears more than once
     */
    @Transactional(readOnly = true)
    public FinalizedCandidates finalizeCandidates(UUID roundId) {
        DrawRound round = drawRoundRepository.findById(roundId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "ROUND_NOT_FOUND"));
        if (round.getWindowState() != WindowState.CLOSED) {
            throw new IllegalStateException("consensus window of round " + roundId + " is " + round.getWindowState());
        }

        List<PoolMember> optedIn = new ArrayList<>();
        List<DrawCandidate> auditCandidates = new ArrayList<>();
        List<UUID> declined = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        for (RoundParticipation participation : roundParticipationRepository.findByRoundIdOrdered(roundId)) {
            PoolMember member = participation.getMember();
            if (!seen.add(member.getId())) {
                throw new DrawIntegrityException("member " + member.getId() + " appears twice in round " + roundId,
                        Map.of("roundId", roundId.toString(), "memberId", member.getId().toString()));
            }
            if (participation.wantsToParticipate()) {
                optedIn.add(member);
                auditCandidates.add(participation.toCandidate());
            } else {
                declined.add(member.getId());
            }
        }
        return new FinalizedCandidates(roundId, round.getCloseReason(), optedIn, auditCandidates, declined);
    }

    @Transactional
    public void recordOutcome(UUID roundId, RoundOutcome outcome, String detail, UUID drawRecordId) {
        drawRoundRepository.recordOutcome(roundId, outcome, detail, drawRecordId);
    }

    @Transactional(readOnly = true)
    public Optional<DrawRound> currentRound(UUID poolId) {
        return drawRoundRepository.findFirstByPoolIdAndOutcome(poolId, RoundOutcome.IN_PROGRESS);
    }

    private ProblemException windowClosed() {
        return new ProblemException(HttpStatus.CONFLICT, "WINDOW_CLOSED", "window closed");
    }
}
