package com.poolmate.backend.modules.pool.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Roster entry of a pool. Per-round opt-in state lives in
 * {@code RoundParticipation}; only the "has won" fields are kept here.
 */
@Entity
@Table(name = "pool_member")
public class PoolMember extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private Pool pool;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "display_name", nullable = false, length = 120)
    private String displayName;

    @Column(name = "joined_at", nullable = false)
    private OffsetDateTime joinedAt;

    @Column(name = "has_won", nullable = false)
    private boolean won;

    @Column(name = "won_at")
    private OffsetDateTime wonAt;

    @Column(name = "won_amount")
    private Long wonAmount;

    public UUID getId() {
        return id;
    }

    public Pool getPool() {
        return pool;
    }

    public void setPool(Pool pool) {
        this.pool = pool;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(OffsetDateTime joinedAt) {
        this.joinedAt = joinedAt;
    }

    public boolean hasWon() {
        return won;
    }

    public OffsetDateTime getWonAt() {
        return wonAt;
    }

    public Long getWonAmount() {
        return wonAmount;
    }

    public void markWon(OffsetDateTime at, long amount) {
        this.won = true;
        this.wonAt = at;
        this.wonAmount = amount;
    }

    public void clearWin() {
        this.won = false;
        this.wonAt = null;
        this.wonAmount = null;
    }
}
