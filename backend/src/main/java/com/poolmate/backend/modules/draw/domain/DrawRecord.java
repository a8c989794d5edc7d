package com.poolmate.backend.modules.draw.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.poolmate.backend.global.jpa.AbstractTimestampedEntity;
import com.poolmate.backend.modules.pool.domain.Pool;
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

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Ledger entry of one committed round. Only the cancellation fields change after insert.
 */
@Entity
@Table(name = "draw_record")
public class DrawRecord extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false, updatable = false)
    private Pool pool;

    @Column(name = "round_number", nullable = false, updatable = false)
    private int roundNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "winner_member_id", nullable = false, updatable = false)
    private PoolMember winner;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 16, updatable = false)
    private DrawMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DrawStatus status = DrawStatus.COMPLETED;

    @Column(name = "drawn_at", nullable = false, updatable = false)
    private OffsetDateTime drawnAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "audit", columnDefinition = "jsonb", nullable = false, updatable = false)
    private DrawAudit audit;

    @Column(name = "created_by", columnDefinition = "uuid", updatable = false)
    private UUID createdBy;

    @Column(name = "cancel_reason", length = 500)
    private String cancelReason;

    @Column(name = "cancelled_by", columnDefinition = "uuid")
    private UUID cancelledBy;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

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

    public PoolMember getWinner() {
        return winner;
    }

    public void setWinner(PoolMember winner) {
        this.winner = winner;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public DrawMethod getMethod() {
        return method;
    }

    public void setMethod(DrawMethod method) {
        this.method = method;
    }

    public DrawStatus getStatus() {
        return status;
    }

    public void setStatus(DrawStatus status) {
        this.status = status;
    }

    public OffsetDateTime getDrawnAt() {
        return drawnAt;
    }

    public void setDrawnAt(OffsetDateTime drawnAt) {
        this.drawnAt = drawnAt;
    }

    public DrawAudit getAudit() {
        return audit;
    }

    public void setAudit(DrawAudit audit) {
        this.audit = audit;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(UUID createdBy) {
        this.createdBy = createdBy;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public UUID getCancelledBy() {
        return cancelledBy;
    }

    public boolean isCancelled() {
        return status == DrawStatus.CANCELLED;
    }

    public void markCancelled(String reason, UUID actorId, OffsetDateTime at) {
        this.status = DrawStatus.CANCELLED;
        this.cancelReason = reason;
        this.cancelledBy = actorId;
        this.cancelledAt = at;
    }
}
