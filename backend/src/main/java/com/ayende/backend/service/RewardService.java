package com.ayende.backend.service;

import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.domain.enums.RewardType;
import com.ayende.backend.dto.RewardDTOs.RewardRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.RedemptionRepository;
import com.ayende.backend.repository.RewardRepository;
import com.ayende.backend.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * The reward catalog. The redeemed count is never written from here; see {@link RedemptionService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardService {

    private final RewardRepository rewardRepository;
    private final TenantRepository tenantRepository;
    private final CustomerRepository customerRepository;
    private final RedemptionRepository redemptionRepository;

    @Transactional
    public Reward create(UUID tenantId, RewardRequest request, UUID createdById) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Reward name is required.");
        }
        if (request.pointsRequired() == null) {
            throw new IllegalArgumentException("Points required must be at least 1.");
        }
        Reward reward = new Reward();
        reward.setTenant(tenantRepository.findById(tenantId).orElseThrow());
        reward.setType(RewardType.DISCOUNT);
        apply(reward, request);
        if (createdById != null) {
            Customer creator = customerRepository.findById(createdById).orElse(null);
            reward.setCreatedBy(creator);
        }
        if (reward.isStockExhausted()) {
            reward.setStatus(RewardStatus.OUT_OF_STOCK);
        }
        reward = rewardRepository.save(reward);
        log.info("Reward '{}' created for business {} ({} points)", reward.getName(), tenantId, reward.getPointsRequired());
        return get(tenantId, reward.getId());
    }

    @Transactional
    public Reward update(UUID tenantId, UUID rewardId, RewardRequest request) {
        Reward reward = get(tenantId, rewardId);
        apply(reward, request);

        // Stock may have been raised or lowered below what was already handed out
        if (reward.getStatus() == RewardStatus.ACTIVE && reward.isStockExhausted()) {
            reward.setStatus(RewardStatus.OUT_OF_STOCK);
        } else if (reward.getStatus() == RewardStatus.OUT_OF_STOCK && !reward.isStockExhausted()) {
            reward.setStatus(RewardStatus.ACTIVE);
        }
        return rewardRepository.save(reward);
    }

    @Transactional
    public Reward changeStatus(UUID tenantId, UUID rewardId, RewardStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Status is required.");
        }
        Reward reward = get(tenantId, rewardId);
        if (status == RewardStatus.ACTIVE && reward.isStockExhausted()) {
            throw new IllegalStateException("Reward '" + reward.getName() + "' has no stock left.");
        }
        reward.setStatus(status);
        log.info("Reward {} is now {}", rewardId, status);
        return rewardRepository.save(reward);
    }

    /**
     * Deletes a reward nobody has redeemed. A reward with redemptions is set INACTIVE instead,
     * so existing redemptions keep pointing at it.
     *
     * @return {@code true} when the row was deleted
     */
    @Transactional
    public boolean delete(UUID tenantId, UUID rewardId) {
        Reward reward = get(tenantId, rewardId);
        long redemptions = redemptionRepository.countByRewardId(rewardId);
        if (redemptions > 0) {
            reward.setStatus(RewardStatus.INACTIVE);
            rewardRepository.save(reward);
            log.info("Reward {} deactivated instead of deleted ({} redemptions)", rewardId, redemptions);
            return false;
        }
        rewardRepository.delete(reward);
        log.info("Reward {} deleted", rewardId);
        return true;
    }

    @Transactional(readOnly = true)
    public Reward get(UUID tenantId, UUID rewardId) {
        return rewardRepository.findByIdAndTenantId(rewardId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Reward not found."));
    }

    @Transactional(readOnly = true)
    public List<Reward> listAll(UUID tenantId) {
        return rewardRepository.findByTenantIdOrderByDisplayOrderAscCreatedAtDesc(tenantId);
    }

    /** What a customer can redeem right now: active, not past its end date, in stock. */
    @Transactional(readOnly = true)
    public List<Reward> listAvailable(UUID tenantId, LocalDateTime now) {
        return rewardRepository.findByTenantIdAndStatusOrderByDisplayOrderAscCreatedAtDesc(tenantId, RewardStatus.ACTIVE)
                .stream()
                .filter(r -> r.isAvailable(now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Reward> listFeatured(UUID tenantId, LocalDateTime now) {
        return rewardRepository.findByTenantIdAndStatusAndFeaturedTrueOrderByDisplayOrderAsc(tenantId, RewardStatus.ACTIVE)
                .stream()
                .filter(r -> r.isAvailable(now))
                .toList();
    }

    private void apply(Reward reward, RewardRequest request) {
        if (request.name() != null && !request.name().isBlank()) reward.setName(request.name().trim());
        if (request.description() != null) reward.setDescription(request.description());
        if (request.type() != null) reward.setType(request.type());
        if (request.imageUrl() != null) reward.setImageUrl(request.imageUrl());
        if (request.pointsRequired() != null) {
            if (request.pointsRequired() < 1) {
                throw new IllegalArgumentException("Points required must be at least 1.");
            }
            reward.setPointsRequired(request.pointsRequired());
        }
        if (request.discountType() != null) reward.setDiscountType(request.discountType());
        if (request.discountValue() != null) reward.setDiscountValue(nonNegative(request.discountValue(), "Discount value"));
        if (request.minimumPurchase() != null) reward.setMinimumPurchase(nonNegative(request.minimumPurchase(), "Minimum purchase"));
        if (request.hasStockLimit() != null) reward.setHasStockLimit(request.hasStockLimit());
        if (request.totalStock() != null) {
            if (request.totalStock() < 0) {
                throw new IllegalArgumentException("Total stock cannot be negative.");
            }
            reward.setTotalStock(request.totalStock());
        }
        if (reward.isHasStockLimit() && reward.getTotalStock() < reward.getRedeemedCount()) {
            throw new IllegalArgumentException("Total stock cannot be lower than the " + reward.getRedeemedCount() + " already redeemed.");
        }
        if (request.hasExpiration() != null) reward.setHasExpiration(request.hasExpiration());
        if (request.expiresAt() != null) reward.setExpiresAt(request.expiresAt());
        if (reward.isHasExpiration() && reward.getExpiresAt() == null) {
            throw new IllegalArgumentException("An expiring reward needs an expiry date.");
        }
        if (request.limitPerCustomer() != null) {
            if (request.limitPerCustomer() < 0) {
                throw new IllegalArgumentException("Limit per customer cannot be negative.");
            }
            reward.setLimitPerCustomer(request.limitPerCustomer());
        }
        if (request.validityDays() != null) {
            if (request.validityDays() < 0) {
                throw new IllegalArgumentException("Validity days cannot be negative.");
            }
            reward.setValidityDays(request.validityDays());
        }
        if (request.featured() != null) reward.setFeatured(request.featured());
        if (request.termsConditions() != null) reward.setTermsConditions(request.termsConditions());
        if (request.displayOrder() != null) reward.setDisplayOrder(request.displayOrder());
    }

    private static BigDecimal nonNegative(BigDecimal value, String field) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " cannot be negative.");
        }
        return value;
    }
}
