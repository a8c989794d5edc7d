package com.poolmate.backend.modules.draw.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.global.jpa.AbstractTimestampedEntity;
import com.poolmate.backend.modules.pool.domain.Pool;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Persisted handle of one round and of its consensus window. A pool has at most one round
 * whose outcome is still {@link RoundOutcome#IN_PROGRESS}.
 */
@Entity
@Table(name = "draw_round")
public class DrawRound extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private Pool pool;

    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "window_state", nullable = false, length = 24)
    private WindowState windowState = WindowState.NOT_STARTED;

    @Column(name = "notified_at")
    private OffsetDateTime notifiedAt;

    @Column(name = "deadline_at")
    private OffsetDateTime deadlineAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "close_reason", length = 24)
    private WindowCloseReason closeReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 24)
    private RoundOutcome outcome = RoundOutcome.IN_PROGRESS;

    @Column(name = "outcome_detail", length = 500)
    private String outcomeDetail;

    @Column(name = "draw_record_id", columnDefinition = "uuid")
    private UUID drawRecordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "eligibility_policy", nullable = false, length = 16)
    private EligibilityPolicy eligibilityPolicy = EligibilityPolicy.STRICT;

    @Column(name = "started_by", columnDefinition = "uuid")
    private UUID startedBy;

    public UUID getId() {
        return id;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public void setRoundNumber(int roundNumber) {
        this.roundNumber = roundNumber;
    }

    public WindowState getWindowState() {
        return windowState;
    }

    public void setWindowState(WindowState windowState) {
        this.windowState = windowState;
    }

    public OffsetDateTime getNotifiedAt() {
        return notifiedAt;
    }

    public void setNotifiedAt(OffsetDateTime notifiedAt) {
        this.notifiedAt = notifiedAt;
    }

    public OffsetDateTime getDeadlineAt() {
        return deadlineAt;
    }

    public void setDeadlineAt(OffsetDateTime deadlineAt) {
        this.deadlineAt = deadlineAt;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(OffsetDateTime closedAt) {
        this.closedAt = closedAt;
    }

    public WindowCloseReason getCloseReason() {
        return closeReason;
    }

    public void setCloseReason(WindowCloseReason closeReason) {
        this.closeReason = closeReason;
    }

    public RoundOutcome getOutcome() {
        return outcome;
    }

    public void setOutcome(RoundOutcome outcome) {
        this.outcome = outcome;
    }

    public String getOutcomeDetail() {
        return outcomeDetail;
    }

    public void setOutcomeDetail(String outcomeDetail) {
        this.outcomeDetail = outcomeDetail;
    }

    public UUID getDrawRecordId() {
        return drawRecordId;
    }

    public void setDrawRecordId(UUID drawRecordId) {
        this.drawRecordId = drawRecordId;
    }

    public EligibilityPolicy getEligibilityPolicy() {
        return eligibilityPolicy;
    }

    public void setEligibilityPolicy(EligibilityPolicy eligibilityPolicy) {
        this.eligibilityPolicy = eligibilityPolicy;
    }

    public UUID getStartedBy() {
        return startedBy;
    }

    public void setStartedBy(UUID startedBy) {
        this.startedBy = startedBy;
    }
}
