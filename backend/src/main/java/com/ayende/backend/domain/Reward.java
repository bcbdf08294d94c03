package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.DiscountType;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.domain.enums.RewardType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "rewards", indexes = {
        @Index(name = "idx_rewards_tenant_status", columnList = "tenant_id, status"),
        @Index(name = "idx_rewards_tenant_featured", columnList = "tenant_id, is_featured")
})
public class Reward extends BaseEntity {

    @ManyToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, updatable = false)
    private Tenant tenant;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", nullable = false, length = 20)
    private RewardType type = RewardType.DISCOUNT;

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "points_required", nullable = false)
    private int pointsRequired;

    // --- Discount (only for DISCOUNT rewards) ---

    @Enumerated(EnumType.STRING)
    @Column(name = "discount_type", length = 20)
    private DiscountType discountType;

    @Column(name = "discount_value", nullable = false, precision = 10, scale = 2)
    private BigDecimal discountValue = BigDecimal.ZERO;

    @Column(name = "minimum_purchase", nullable = false, precision = 10, scale = 2)
    private BigDecimal minimumPurchase = BigDecimal.ZERO;

    // --- Stock ---

    @Column(name = "has_stock_limit", nullable = false)
    private boolean hasStockLimit = false;

    @Column(name = "total_stock", nullable = false)
    private int totalStock = 0;

    // Moved only by RewardRepository's guarded updates
    @Column(name = "redeemed_count", nullable = false, updatable = false)
    private int redeemedCount = 0;

    // --- Expiration ---

    @Column(name = "has_expiration", nullable = false)
    private boolean hasExpiration = false;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    // 0 = unlimited
    @Column(name = "limit_per_customer", nullable = false)
    private int limitPerCustomer = 0;

    // Days a redemption stays usable; 0 = forever
    @Column(name = "validity_days", nullable = false)
    private int validityDays = 30;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RewardStatus status = RewardStatus.ACTIVE;

    @Column(name = "is_featured", nullable = false)
    private boolean featured = false;

    @Column(name = "terms_conditions", columnDefinition = "TEXT")
    private String termsConditions;

    @Column(name = "display_order", nullable = false)
    private int displayOrder = 0;

    @ManyToOne
    @JoinColumn(name = "created_by_id")
    private Customer createdBy;

    public boolean isExpired(LocalDateTime now) {
        return hasExpiration && expiresAt != null && now.isAfter(expiresAt);
    }

    public boolean isStockExhausted() {
        return hasStockLimit && redeemedCount >= totalStock;
    }

    /** Remaining stock, or {@code null} when the reward is not stock limited. */
    public Integer getStockRemaining() {
        if (!hasStockLimit) {
            return null;
        }
        return Math.max(0, totalStock - redeemedCount);
    }

    public boolean isLowStock() {
        Integer remaining = getStockRemaining();
        return remaining != null && remaining <= totalStock * 0.1;
    }

    public boolean isAvailable(LocalDateTime now) {
        return status == RewardStatus.ACTIVE && !isExpired(now) && !isStockExhausted();
    }
}
