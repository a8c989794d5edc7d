package com.poolmate.backend.modules.pool.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.poolmate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;

/**
 * A rotating savings group. The draw engine reads the pool and only ever writes
 * the per-member draw fields of its roster and the lifecycle status.
 */
@Entity
@Table(name = "pool")
public class Pool extends AbstractTimestampedEntity {

    public static final int MIN_OPT_IN_WINDOW_MINUTES = 5;
    public static final int MAX_OPT_IN_WINDOW_MINUTES = 1440;
    public static final int DEFAULT_OPT_IN_WINDOW_MINUTES = 15;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "contribution_amount", nullable = false)
    private long contributionAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "frequency", nullable = false, length = 16)
    private PoolFrequency frequency = PoolFrequency.MONTHLY;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PoolStatus status = PoolStatus.PENDING;

    @Column(name = "opt_in_window_minutes", nullable = false)
    private int optInWindowMinutes = DEFAULT_OPT_IN_WINDOW_MINUTES;

    @Column(name = "min_members", nullable = false)
    private int minMembers = 1;

    @Column(name = "max_members", nullable = false)
    private int maxMembers = 50;

    @Column(name = "treasurer_user_id", columnDefinition = "uuid")
    private UUID treasurerUserId;

    @Column(name = "penalty_rate_percent", nullable = false)
    private int penaltyRatePercent;

    @Column(name = "grace_period_days", nullable = false)
    private int gracePeriodDays;

    @Column(name = "activated_at")
    private OffsetDateTime activatedAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @OneToMany(mappedBy = "pool", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("joinedAt ASC")
    private List<PoolMember> members = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getContributionAmount() {
        return contributionAmount;
    }

    public void setContributionAmount(long contributionAmount) {
        this.contributionAmount = contributionAmount;
    }

    public PoolFrequency getFrequency() {
        return frequency;
    }

    public void setFrequency(PoolFrequency frequency) {
        this.frequency = frequency;
    }

    public PoolStatus getStatus() {
        return status;
    }

    public void setStatus(PoolStatus status) {
        this.status = status;
    }

    public int getOptInWindowMinutes() {
        return optInWindowMinutes;
    }

    public void setOptInWindowMinutes(int optInWindowMinutes) {
        this.optInWindowMinutes = optInWindowMinutes;
    }

    public int getMinMembers() {
        return minMembers;
    }

    public void setMinMembers(int minMembers) {
        this.minMembers = minMembers;
    }

    public int getMaxMembers() {
        return maxMembers;
    }

    public void setMaxMembers(int maxMembers) {
        this.maxMembers = maxMembers;
    }

    public UUID getTreasurerUserId() {
        return treasurerUserId;
    }

    public void setTreasurerUserId(UUID treasurerUserId) {
        this.treasurerUserId = treasurerUserId;
    }

    public int getPenaltyRatePercent() {
        return penaltyRatePercent;
    }

    public void setPenaltyRatePercent(int penaltyRatePercent) {
        this.penaltyRatePercent = penaltyRatePercent;
    }

    public int getGracePeriodDays() {
        return gracePeriodDays;
    }

    public void setGracePeriodDays(int gracePeriodDays) {
        this.gracePeriodDays = gracePeriodDays;
    }

    public OffsetDateTime getActivatedAt() {
        return activatedAt;
    }

    public void setActivatedAt(OffsetDateTime activatedAt) {
        this.activatedAt = activatedAt;
    }

    public OffsetDateTime getClosedAt() {
        return closedAt;
    }

    public void setClosedAt(OffsetDateTime closedAt) {
        this.closedAt = closedAt;
    }

    public long getVersion() {
        return version;
    }

    public List<PoolMember> getMembers() {
        return members;
    }

    /**
     * Amount handed to the beneficiary of one round: every roster seat contributes once.
     */
    public long potAmount() {
        return Math.multiplyExact(contributionAmount, (long) members.size());
    }

    public long remainingNonWinners() {
        return members.stream().filter(member -> !member.hasWon()).count();
    }
}
