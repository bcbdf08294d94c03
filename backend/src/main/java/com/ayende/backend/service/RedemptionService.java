package com.ayende.backend.service;

import com.ayende.backend.core.result.OperationResult;
import com.ayende.backend.core.result.ValidationError;
import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Redemption;
import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.enums.RedemptionStatus;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.LedgerTransactionRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.RedemptionRepository;
import com.ayende.backend.repository.RewardRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Redemption state machine:
 * <pre>
 *   PENDING -> APPROVED -> USED
 *   PENDING | APPROVED -> CANCELLED   (refund)
 *   PENDING -> REJECTED               (refund, reason required)
 *   PENDING | APPROVED -> EXPIRED     (validity elapsed, no refund)
 * </pre>
 * Points and stock always move together with the status, in one transaction.
 */
@Slf4j
@Service
public class RedemptionService {

    private final RedemptionRepository redemptionRepository;
    private final RewardRepository rewardRepository;
    private final MembershipRepository membershipRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final CustomerRepository customerRepository;
    private final RedemptionCodeGenerator codeGenerator;
    private final boolean autoApprove;

    public RedemptionService(RedemptionRepository redemptionRepository,
                             RewardRepository rewardRepository,
                             MembershipRepository membershipRepository,
                             LedgerTransactionRepository transactionRepository,
                             CustomerRepository customerRepository,
                             RedemptionCodeGenerator codeGenerator,
                             @Value("${ayende.rewards.auto-approve:true}") boolean autoApprove) {
        this.redemptionRepository = redemptionRepository;
        this.rewardRepository = rewardRepository;
        this.membershipRepository = membershipRepository;
        this.transactionRepository = transactionRepository;
        this.customerRepository = customerRepository;
        this.codeGenerator = codeGenerator;
        this.autoApprove = autoApprove;
    }

    /**
     * Spends a member's points on a reward. The membership row stays locked from the balance
     * check to the debit, and stock is claimed with a guarded update, so neither the balance nor
     * the stock can be oversold by concurrent redemptions.
     */
    @Transactional
    public OperationResult<Redemption> redeem(UUID tenantId, UUID membershipId, UUID rewardId, String customerNote) {
        Membership membership = membershipRepository.findForUpdate(membershipId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));
        Reward reward = rewardRepository.findByIdAndTenantId(rewardId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Reward not found."));
        LocalDateTime now = LocalDateTime.now();

        if (!membership.isActive()) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "This membership is inactive.");
        }
        if (reward.getStatus() != RewardStatus.ACTIVE) {
            return unavailable(reward, "is not available");
        }
        if (reward.isExpired(now)) {
            return unavailable(reward, "has expired");
        }
        if (reward.isStockExhausted()) {
            return unavailable(reward, "is out of stock");
        }

        int required = reward.getPointsRequired();
        int available = membership.getLoyaltyPoints();
        if (available < required) {
            return OperationResult.denied(ValidationError.INSUFFICIENT_POINTS,
                    "You need " + (required - available) + " more points for this reward.",
                    Map.of("required", required, "available", available, "shortfall", required - available));
        }

        if (reward.getLimitPerCustomer() > 0) {
            long taken = redemptionRepository.countByRewardIdAndMembershipIdAndStatusIn(rewardId, membershipId, RedemptionStatus.COUNTED);
            if (taken >= reward.getLimitPerCustomer()) {
                return OperationResult.denied(ValidationError.REDEMPTION_LIMIT_REACHED,
                        "You have already redeemed '" + reward.getName() + "' the maximum number of times ("
                                + reward.getLimitPerCustomer() + ").");
            }
        }

        if (membershipRepository.debitPoints(membershipId, required, now) == 0) {
            return OperationResult.denied(ValidationError.INSUFFICIENT_POINTS,
                    "Not enough points for this reward.", Map.of("required", required));
        }
        if (rewardRepository.claimStock(rewardId, RewardStatus.ACTIVE, now) == 0) {
            // Someone else took the last unit after our check
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return unavailable(reward, "is out of stock");
        }
        rewardRepository.markOutOfStockIfExhausted(rewardId, RewardStatus.OUT_OF_STOCK);

        Redemption redemption = new Redemption();
        redemption.setRedemptionCode(uniqueCode());
        redemption.setReward(rewardRepository.findById(rewardId).orElseThrow());
        redemption.setMembership(membershipRepository.findById(membershipId).orElseThrow());
        redemption.setTenant(redemption.getMembership().getTenant());
        redemption.setPointsSpent(required);
        redemption.setStatus(autoApprove ? RedemptionStatus.APPROVED : RedemptionStatus.PENDING);
        redemption.setValidFrom(now);
        if (reward.getValidityDays() > 0) {
            redemption.setValidUntil(now.plusDays(reward.getValidityDays()));
        }
        redemption.setCustomerNote(customerNote);
        redemption = redemptionRepository.save(redemption);

        log.info("Membership {} redeemed '{}' for {} points ({})", membershipId, reward.getName(), required, redemption.getRedemptionCode());
        return OperationResult.ok(redemption);
    }

    @Transactional
    public OperationResult<Redemption> approve(UUID tenantId, UUID redemptionId, UUID staffId) {
        Redemption redemption = get(tenantId, redemptionId);
        if (!transition(redemption, EnumSet.of(RedemptionStatus.PENDING), RedemptionStatus.APPROVED)) {
            return invalidState(redemption, "approved");
        }
        Redemption approved = get(tenantId, redemptionId);
        approved.setProcessedBy(staffId != null ? customerRepository.findById(staffId).orElse(null) : null);
        return OperationResult.ok(redemptionRepository.save(approved));
    }

    /**
     * Staff hand over the reward. Allowed only while the redemption is open and inside its
     * validity window.
     *
     * @param transactionCode purchase the reward was applied to, optional
     */
    @Transactional
    public OperationResult<Redemption> use(UUID tenantId, UUID redemptionId, UUID staffId, String transactionCode, String staffNote) {
        Redemption redemption = get(tenantId, redemptionId);
        LocalDateTime now = LocalDateTime.now();

        if (!redemption.getStatus().isOpen()) {
            return invalidState(redemption, "used");
        }
        if (!redemption.isValid(now)) {
            return OperationResult.denied(ValidationError.REDEMPTION_NOT_VALID,
                    "Redemption " + redemption.getRedemptionCode() + " is outside its validity period.");
        }

        LedgerTransaction transaction = null;
        if (transactionCode != null && !transactionCode.isBlank()) {
            transaction = transactionRepository.findByTransactionCodeAndTenantId(transactionCode.trim(), tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("Transaction " + transactionCode + " not found."));
            if (!transaction.getMembership().getId().equals(redemption.getMembership().getId())) {
                throw new IllegalArgumentException("Transaction " + transactionCode + " belongs to another customer.");
            }
        }

        if (!transition(redemption, RedemptionStatus.OPEN, RedemptionStatus.USED)) {
            return invalidState(redemption, "used");
        }
        Redemption used = get(tenantId, redemptionId);
        used.setUsedAt(now);
        used.setProcessedBy(staffId != null ? customerRepository.findById(staffId).orElse(null) : null);
        used.setTransaction(transaction != null ? transactionRepository.findById(transaction.getId()).orElseThrow() : null);
        if (staffNote != null) {
            used.setStaffNote(staffNote);
        }
        log.info("Redemption {} used", used.getRedemptionCode());
        return OperationResult.ok(redemptionRepository.save(used));
    }

    @Transactional
    public OperationResult<Redemption> cancel(UUID tenantId, UUID redemptionId, boolean refundPoints) {
        Redemption redemption = get(tenantId, redemptionId);
        if (!transition(redemption, RedemptionStatus.OPEN, RedemptionStatus.CANCELLED)) {
            return invalidState(redemption, "cancelled");
        }
        if (refundPoints) {
            refund(redemption);
        }
        log.info("Redemption {} cancelled (refund: {})", redemption.getRedemptionCode(), refundPoints);
        return OperationResult.ok(get(tenantId, redemptionId));
    }

    @Transactional
    public OperationResult<Redemption> reject(UUID tenantId, UUID redemptionId, String reason, boolean refundPoints, UUID staffId) {
        if (reason == null || reason.isBlank()) {
            return OperationResult.denied(ValidationError.REASON_REQUIRED, "A reason is required to reject a redemption.");
        }
        Redemption redemption = get(tenantId, redemptionId);
        if (!transition(redemption, EnumSet.of(RedemptionStatus.PENDING), RedemptionStatus.REJECTED)) {
            return invalidState(redemption, "rejected");
        }
        if (refundPoints) {
            refund(redemption);
        }
        Redemption rejected = get(tenantId, redemptionId);
        rejected.setRejectionReason(reason.trim());
        rejected.setProcessedBy(staffId != null ? customerRepository.findById(staffId).orElse(null) : null);
        log.info("Redemption {} rejected: {}", rejected.getRedemptionCode(), reason);
        return OperationResult.ok(redemptionRepository.save(rejected));
    }

    /**
     * Moves open redemptions whose validity ended before {@code now} to EXPIRED.
     * Points are not returned.
     */
    @Transactional
    public int expireElapsed(LocalDateTime now) {
        List<Redemption> elapsed = redemptionRepository.findByStatusInAndValidUntilBefore(RedemptionStatus.OPEN, now);
        int expired = 0;
        for (Redemption redemption : elapsed) {
            expired += redemptionRepository.transition(redemption.getId(), RedemptionStatus.OPEN, RedemptionStatus.EXPIRED, now);
        }
        if (expired > 0) {
            log.info("Expired {} redemptions", expired);
        }
        return expired;
    }

    @Transactional(readOnly = true)
    public Redemption get(UUID tenantId, UUID redemptionId) {
        return redemptionRepository.findByIdAndTenantId(redemptionId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Redemption not found."));
    }

    /** Staff look-up by the code the customer shows at the counter. */
    @Transactional(readOnly = true)
    public Redemption findByCode(UUID tenantId, String code) {
        return redemptionRepository.findByRedemptionCodeAndTenantId(code.trim().toUpperCase(Locale.ROOT), tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Redemption " + code + " not found."));
    }

    @Transactional(readOnly = true)
    public List<Redemption> listForTenant(UUID tenantId, RedemptionStatus status) {
        if (status == null) {
            return redemptionRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        }
        return redemptionRepository.findByTenantIdAndStatusOrderByCreatedAtDesc(tenantId, status);
    }

    @Transactional(readOnly = true)
    public List<Redemption> listForMembership(UUID tenantId, UUID membershipId) {
        membershipRepository.findByIdAndTenantId(membershipId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));
        return redemptionRepository.findByMembershipIdOrderByCreatedAtDesc(membershipId);
    }

    private boolean transition(Redemption redemption, Collection<RedemptionStatus> from, RedemptionStatus to) {
        return redemptionRepository.transition(redemption.getId(), from, to, LocalDateTime.now()) == 1;
    }

    // Points back to the member and the unit back to the shelf, always together
    private void refund(Redemption redemption) {
        LocalDateTime now = LocalDateTime.now();
        UUID rewardId = redemption.getReward().getId();
        membershipRepository.creditPoints(redemption.getMembership().getId(), redemption.getPointsSpent(), now);
        rewardRepository.releaseStock(rewardId, now);
        rewardRepository.restockIfAvailable(rewardId, RewardStatus.OUT_OF_STOCK, RewardStatus.ACTIVE);
    }

    private String uniqueCode() {
        String code;
        do {
            code = codeGenerator.next();
        } while (redemptionRepository.existsByRedemptionCode(code));
        return code;
    }

    private static <T> OperationResult<T> unavailable(Reward reward, String why) {
        return OperationResult.denied(ValidationError.REWARD_UNAVAILABLE, "Reward '" + reward.getName() + "' " + why + ".");
    }

    private static <T> OperationResult<T> invalidState(Redemption redemption, String action) {
        return OperationResult.denied(ValidationError.INVALID_STATE,
                "Redemption " + redemption.getRedemptionCode() + " is " + redemption.getStatus() + " and cannot be " + action + ".");
    }
}
