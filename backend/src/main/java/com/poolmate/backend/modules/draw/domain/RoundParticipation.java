package com.poolmate.backend.modules.draw.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.global.jpa.AbstractTimestampedEntity;
import com.poolmate.backend.modules.pool.domain.PoolMember;

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
 * Opt-in record of one candidate for one round. Written independently per member.
 */
@Entity
@Table(name = "round_participation")
public class RoundParticipation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "draw_round_id", nullable = false)
    private DrawRound drawRound;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_member_id", nullable = false)
    private PoolMember member;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 16)
    private ParticipationDecision decision = ParticipationDecision.UNANSWERED;

    @Column(name = "notified_at", nullable = false)
    private OffsetDateTime notifiedAt;

    @Column(name = "responded_at")
    private OffsetDateTime respondedAt;

    @Column(name = "auto_enrolled", nullable = false)
    private boolean autoEnrolled;

    public UUID getId() {
        return id;
    }

    public DrawRound getDrawRound() {
        return drawRound;
    }

    public void setDrawRound(DrawRound drawRound) {
        this.drawRound = drawRound;
    }

    public PoolMember getMember() {
        return member;
    }

    public void setMember(PoolMember member) {
        this.member = member;
    }

    public ParticipationDecision getDecision() {
        return decision;
    }

    public void setDecision(ParticipationDecision decision) {
        this.decision = decision;
    }

    public OffsetDateTime getNotifiedAt() {
        return notifiedAt;
    }

    public void setNotifiedAt(OffsetDateTime notifiedAt) {
        this.notifiedAt = notifiedAt;
    }

    public OffsetDateTime getRespondedAt() {
        return respondedAt;
    }

    public void setRespondedAt(OffsetDateTime respondedAt) {
        this.respondedAt = respondedAt;
    }

    public boolean isAutoEnrolled() {
        return autoEnrolled;
    }

    public void setAutoEnrolled(boolean autoEnrolled) {
        this.autoEnrolled = autoEnrolled;
    }

    public boolean wantsToParticipate() {
        return decision == ParticipationDecision.OPTED_IN;
    }

    public DrawCandidate toCandidate() {
        return new DrawCandidate(member.getId(), member.getUserId(), member.getDisplayName(), decision, autoEnrolled);
    }
}
