package com.ayende.backend.dto;

import com.ayende.backend.domain.Redemption;
import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.enums.DiscountType;
import com.ayende.backend.domain.enums.RedemptionStatus;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.domain.enums.RewardType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public class RewardDTOs {

    public record RewardRequest(
        String name,
        String description,
        RewardType type,
        String imageUrl,
        Integer pointsRequired,
        DiscountType discountType,
        BigDecimal discountValue,
        BigDecimal minimumPurchase,
        Boolean hasStockLimit,
        Integer totalStock,
        Boolean hasExpiration,
        LocalDateTime expiresAt,
        Integer limitPerCustomer,
        Integer validityDays,
        Boolean featured,
        String termsConditions,
        Integer displayOrder
    ) {}

    public record StatusRequest(RewardStatus status) {}

    public record RewardResponse(
        UUID id,
        String name,
        String description,
        RewardType type,
        String imageUrl,
        int pointsRequired,
        DiscountType discountType,
        BigDecimal discountValue,
        BigDecimal minimumPurchase,
        boolean hasStockLimit,
        int totalStock,
        int redeemedCount,
        Integer stockRemaining,
        boolean hasExpiration,
        LocalDateTime expiresAt,
        int limitPerCustomer,
        int validityDays,
        RewardStatus status,
        boolean featured,
        String termsConditions,
        int displayOrder
    ) {
        public static RewardResponse from(Reward r) {
            return new RewardResponse(r.getId(), r.getName(), r.getDescription(), r.getType(), r.getImageUrl(),
                    r.getPointsRequired(), r.getDiscountType(), r.getDiscountValue(), r.getMinimumPurchase(),
                    r.isHasStockLimit(), r.getTotalStock(), r.getRedeemedCount(), r.getStockRemaining(),
                    r.isHasExpiration(), r.getExpiresAt(), r.getLimitPerCustomer(), r.getValidityDays(),
                    r.getStatus(), r.isFeatured(), r.getTermsConditions(), r.getDisplayOrder());
        }
    }

    public record RewardRemovalResponse(UUID rewardId, boolean deleted) {}

    public record RedeemRequest(UUID rewardId, String customerNote) {}

    public record UseRequest(String transactionCode, String staffNote) {}

    public record CancelRequest(Boolean refundPoints) {}

    public record RejectRequest(String reason, Boolean refundPoints) {}

    public record RedemptionResponse(
        UUID id,
        String redemptionCode,
        UUID rewardId,
        String rewardName,
        UUID membershipId,
        String customerName,
        int pointsSpent,
        RedemptionStatus status,
        LocalDateTime validFrom,
        LocalDateTime validUntil,
        LocalDateTime usedAt,
        String transactionCode,
        String rejectionReason,
        LocalDateTime redeemedAt
    ) {
        public static RedemptionResponse from(Redemption r) {
            return new RedemptionResponse(r.getId(), r.getRedemptionCode(), r.getReward().getId(),
                    r.getReward().getName(), r.getMembership().getId(),
                    r.getMembership().getCustomer().getFullName(), r.getPointsSpent(), r.getStatus(),
                    r.getValidFrom(), r.getValidUntil(), r.getUsedAt(),
                    r.getTransaction() != null ? r.getTransaction().getTransactionCode() : null,
                    r.getRejectionReason(), r.getCreatedAt());
        }
    }
}
