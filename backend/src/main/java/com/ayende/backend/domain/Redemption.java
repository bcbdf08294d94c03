package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.RedemptionStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "redemptions", indexes = {
        @Index(name = "idx_redemptions_tenant_status", columnList = "tenant_id, status"),
        @Index(name = "idx_redemptions_membership_reward", columnList = "membership_id, reward_id"),
        @Index(name = "idx_redemptions_status_valid_until", columnList = "status, valid_until")
})
public class Redemption extends BaseEntity {

    @Column(name = "redemption_code", nullable = false, unique = true, updatable = false, length = 20)
    private String redemptionCode;

    @ManyToOne(optional = false)
    @JoinColumn(name = "reward_id", nullable = false, updatable = false)
    private Reward reward;

    @ManyToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, updatable = false)
    private Tenant tenant;

    @ManyToOne(optional = false)
    @JoinColumn(name = "membership_id", nullable = false, updatable = false)
    private Membership membership;

    @Column(name = "points_spent", nullable = false, updatable = false)
    private int pointsSpent;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RedemptionStatus status = RedemptionStatus.PENDING;

    @Column(name = "valid_from", nullable = false)
    private LocalDateTime validFrom;

    @Column(name = "valid_until")
    private LocalDateTime validUntil;

    @Column(name = "used_at")
    private LocalDateTime usedAt;

    @ManyToOne
    @JoinColumn(name = "processed_by_id")
    private Customer processedBy;

    // Purchase the reward was applied to
    @ManyToOne
    @JoinColumn(name = "transaction_id")
    private LedgerTransaction transaction;

    @Column(name = "customer_note", columnDefinition = "TEXT")
    private String customerNote;

    @Column(name = "staff_note", columnDefinition = "TEXT")
    private String staffNote;

    @Column(name = "rejection_reason", columnDefinition = "TEXT")
    private String rejectionReason;

    /**
     * Usable right now: still open and inside {@code [validFrom, validUntil]}.
     * A missing {@code validUntil} means the window never closes.
     */
    public boolean isValid(LocalDateTime now) {
        if (status == null || !status.isOpen()) {
            return false;
        }
        if (now.isBefore(validFrom)) {
            return false;
        }
        return validUntil == null || !now.isAfter(validUntil);
    }

    public boolean isExpired(LocalDateTime now) {
        return validUntil != null && now.isAfter(validUntil);
    }

    public Long getDaysUntilExpiry(LocalDateTime now) {
        if (validUntil == null) {
            return null;
        }
        return Math.max(0, Duration.between(now, validUntil).toDays());
    }
}
