package com.ayende.backend.service;

import com.ayende.backend.core.result.OperationResult;
import com.ayende.backend.core.result.ValidationError;
import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.PaymentMethod;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;
import com.ayende.backend.dto.LedgerDTOs.TransactionRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.LedgerTransactionRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.TenantSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Purchases, refunds and point adjustments.
 *
 * <p>Every method that changes a membership's balance or totals writes the ledger row and the
 * membership aggregates in the same database transaction. The aggregates move through guarded
 * UPDATE statements, and {@code aggregatesApplied} on the row makes sure one entry is counted
 * at most once. When a refusal is detected after something was written, the transaction is
 * marked rollback-only and the refusal is returned instead of thrown.
 */
@Slf4j
@Service
public class LedgerService {

    private static final String CODE_PREFIX = "TXN-";
    // numeric(12,2)
    private static final int MONEY_INTEGER_DIGITS = 10;
    private static final int MONEY_SCALE = 2;

    private final LedgerTransactionRepository transactionRepository;
    private final MembershipRepository membershipRepository;
    private final TenantSettingsRepository settingsRepository;
    private final CustomerRepository customerRepository;
    private final boolean refundReversesPoints;

    public LedgerService(LedgerTransactionRepository transactionRepository,
                         MembershipRepository membershipRepository,
                         TenantSettingsRepository settingsRepository,
                         CustomerRepository customerRepository,
                         @Value("${ayende.ledger.refund-reverses-points:true}") boolean refundReversesPoints) {
        this.transactionRepository = transactionRepository;
        this.membershipRepository = membershipRepository;
        this.settingsRepository = settingsRepository;
        this.customerRepository = customerRepository;
        this.refundReversesPoints = refundReversesPoints;
    }

    public boolean isRefundReversingPoints() {
        return refundReversesPoints;
    }

    /**
     * Records one entry. Replaying a request with the same transaction code returns the row
     * written the first time and leaves the membership untouched.
     *
     * @param processedById staff member entering the transaction, may be {@code null}
     */
    @Transactional
    public OperationResult<LedgerTransaction> recordTransaction(UUID tenantId, TransactionRequest request, UUID processedById) {
        Optional<String> invalid = validateAmounts(request);
        if (invalid.isPresent()) {
            return OperationResult.denied(ValidationError.INVALID_AMOUNT, invalid.get());
        }

        // Lock first: a replay racing the original waits here and then sees its committed row
        Membership membership = membershipRepository.findForUpdate(request.membershipId(), tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));

        String code = request.transactionCode() != null && !request.transactionCode().isBlank()
                ? request.transactionCode().trim()
                : null;
        if (code != null) {
            Optional<LedgerTransaction> existing = transactionRepository.findByTransactionCode(code);
            if (existing.isPresent()) {
                LedgerTransaction previous = existing.get();
                if (previous.getTenant().getId().equals(tenantId)
                        && previous.getMembership().getId().equals(membership.getId())) {
                    log.info("Transaction {} replayed, returning the recorded entry", code);
                    return OperationResult.ok(previous);
                }
                return OperationResult.denied(ValidationError.DUPLICATE_TRANSACTION,
                        "Transaction code " + code + " is already in use.");
            }
        } else {
            code = generateCode();
        }

        TransactionType type = request.type() != null ? request.type() : TransactionType.PURCHASE;
        TransactionStatus status = request.status() != null ? request.status() : TransactionStatus.COMPLETED;
        if (status == TransactionStatus.REFUNDED) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "Use the refund operation to refund a purchase.");
        }
        BigDecimal tax = request.tax() != null ? request.tax() : BigDecimal.ZERO;
        BigDecimal total = request.total() != null ? request.total() : request.amount().add(tax);
        if (!fitsMoneyColumn(total)) {
            return OperationResult.denied(ValidationError.INVALID_AMOUNT, "Total is out of range.");
        }
        int pointsEarned;
        if (request.pointsEarned() != null) {
            pointsEarned = request.pointsEarned();
        } else if (type == TransactionType.PURCHASE) {
            long computed = pointsFor(tenantId, total);
            if (computed > Integer.MAX_VALUE) {
                return OperationResult.denied(ValidationError.INVALID_AMOUNT, "Total earns more points than a balance can hold.");
            }
            pointsEarned = (int) computed;
        } else {
            pointsEarned = 0;
        }

        LedgerTransaction txn = new LedgerTransaction();
        txn.setTenant(membership.getTenant());
        txn.setMembership(membership);
        txn.setTransactionCode(code);
        txn.setType(type);
        txn.setStatus(status);
        txn.setAmount(request.amount());
        txn.setTax(tax);
        txn.setTotal(total);
        txn.setPaymentMethod(request.paymentMethod() != null ? request.paymentMethod() : PaymentMethod.CASH);
        txn.setPointsEarned(pointsEarned);
        txn.setPointsRedeemed(request.pointsRedeemed() != null ? request.pointsRedeemed() : 0);
        txn.setReceiptNumber(request.receiptNumber());
        txn.setItemsDescription(request.itemsDescription());
        txn.setNotes(request.notes());
        txn.setProcessedBy(actor(processedById));
        txn.setTransactionDate(LocalDateTime.now());
        txn.setAggregatesApplied(status == TransactionStatus.COMPLETED);

        try {
            txn = transactionRepository.saveAndFlush(txn);
        } catch (DataIntegrityViolationException e) {
            if (!isDuplicateCode(e)) {
                throw e;
            }
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            log.warn("Concurrent insert of transaction code {}", code);
            return OperationResult.denied(ValidationError.DUPLICATE_TRANSACTION,
                    "Transaction code " + code + " is already in use.");
        }

        if (status == TransactionStatus.COMPLETED && !applyAggregates(txn, membership.getId())) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return insufficientPoints(membership, txn);
        }

        log.info("Recorded {} {} for membership {}: total {}, points +{} -{}",
                type, code, membership.getId(), total, txn.getPointsEarned(), txn.getPointsRedeemed());
        return OperationResult.ok(reload(txn.getId()));
    }

    /** PENDING to COMPLETED; the aggregates are applied at this point. */
    @Transactional
    public OperationResult<LedgerTransaction> completeTransaction(UUID tenantId, String code) {
        LedgerTransaction txn = find(tenantId, code);
        LocalDateTime now = LocalDateTime.now();

        if (transactionRepository.transitionStatus(txn.getId(), TransactionStatus.PENDING, TransactionStatus.COMPLETED, now) == 0) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "Only pending transactions can be completed.");
        }
        if (transactionRepository.markAggregatesApplied(txn.getId()) == 1 && !applyAggregates(txn, txn.getMembership().getId())) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return insufficientPoints(txn.getMembership(), txn);
        }
        log.info("Transaction {} completed", code);
        return OperationResult.ok(reload(txn.getId()));
    }

    @Transactional
    public OperationResult<LedgerTransaction> cancelTransaction(UUID tenantId, String code) {
        LedgerTransaction txn = find(tenantId, code);
        if (transactionRepository.transitionStatus(txn.getId(), TransactionStatus.PENDING, TransactionStatus.CANCELLED, LocalDateTime.now()) == 0) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "Only pending transactions can be cancelled.");
        }
        log.info("Transaction {} cancelled", code);
        return OperationResult.ok(reload(txn.getId()));
    }

    /**
     * Marks a completed purchase refunded and writes a REFUND row pointing at it. With
     * {@code ayende.ledger.refund-reverses-points} on, the purchase is also taken out of the
     * membership totals and its net points are debited, never below zero.
     */
    @Transactional
    public OperationResult<LedgerTransaction> refundTransaction(UUID tenantId, String code, String reason, UUID processedById) {
        LedgerTransaction original = find(tenantId, code);
        if (!original.isRefundable()) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "Only completed purchases can be refunded.");
        }

        Membership membership = membershipRepository.findForUpdate(original.getMembership().getId(), tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));
        LocalDateTime now = LocalDateTime.now();

        if (transactionRepository.transitionStatus(original.getId(), TransactionStatus.COMPLETED, TransactionStatus.REFUNDED, now) == 0) {
            return OperationResult.denied(ValidationError.INVALID_STATE, "Transaction " + code + " was already refunded.");
        }

        int reversedPoints = 0;
        boolean reverse = refundReversesPoints && original.isAggregatesApplied();
        if (reverse) {
            reversedPoints = Math.max(0, Math.min(original.netPoints(), membership.getLoyaltyPoints()));
            if (membershipRepository.reversePurchase(membership.getId(), reversedPoints, original.getTotal(), now) == 0) {
                TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
                return OperationResult.denied(ValidationError.INVALID_STATE,
                        "Membership totals do not include transaction " + code + ".");
            }
        }

        LedgerTransaction refund = new LedgerTransaction();
        refund.setTenant(membership.getTenant());
        refund.setMembership(membership);
        refund.setTransactionCode(generateCode());
        refund.setType(TransactionType.REFUND);
        refund.setStatus(TransactionStatus.COMPLETED);
        refund.setAmount(original.getAmount());
        refund.setTax(original.getTax());
        refund.setTotal(original.getTotal());
        refund.setPaymentMethod(original.getPaymentMethod());
        refund.setPointsRedeemed(reversedPoints);
        refund.setOriginalTransaction(transactionRepository.findById(original.getId()).orElseThrow());
        refund.setNotes(reason);
        refund.setProcessedBy(actor(processedById));
        refund.setTransactionDate(now);
        refund.setAggregatesApplied(reverse);
        refund = transactionRepository.saveAndFlush(refund);

        log.info("Transaction {} refunded by {} ({} points reversed)", code, refund.getTransactionCode(), reversedPoints);
        return OperationResult.ok(reload(refund.getId()));
    }

    @Transactional(readOnly = true)
    public LedgerTransaction find(UUID tenantId, String code) {
        return transactionRepository.findByTransactionCodeAndTenantId(code, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Transaction " + code + " not found."));
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> listForTenant(UUID tenantId) {
        return transactionRepository.findByTenantIdOrderByTransactionDateDesc(tenantId);
    }

    @Transactional(readOnly = true)
    public List<LedgerTransaction> listForMembership(UUID tenantId, UUID membershipId) {
        membershipRepository.findByIdAndTenantId(membershipId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));
        return transactionRepository.findByMembershipIdOrderByTransactionDateDesc(membershipId);
    }

    /** floor(total x points-per-unit), or 0 when the business has loyalty switched off. */
    long pointsFor(UUID tenantId, BigDecimal total) {
        TenantSettings settings = settingsRepository.findByTenantId(tenantId).orElse(null);
        if (settings == null) {
            return total.setScale(0, RoundingMode.FLOOR).longValueExact();
        }
        if (!settings.isLoyaltyEnabled()) {
            return 0;
        }
        BigDecimal points = total.multiply(settings.getPointsPerCurrencyUnit()).setScale(0, RoundingMode.FLOOR);
        return points.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0 ? Long.MAX_VALUE : points.longValueExact();
    }

    private static boolean fitsMoneyColumn(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() <= MONEY_SCALE && stripped.precision() - stripped.scale() <= MONEY_INTEGER_DIGITS;
    }

    private static boolean isDuplicateCode(DataIntegrityViolationException e) {
        Throwable cause = e.getMostSpecificCause();
        String message = cause.getMessage() != null ? cause.getMessage().toLowerCase(Locale.ROOT) : "";
        return message.contains("transaction_code");
    }

    private boolean applyAggregates(LedgerTransaction txn, UUID membershipId) {
        LocalDateTime now = LocalDateTime.now();
        if (txn.getType() == TransactionType.PURCHASE) {
            return membershipRepository.applyPurchase(membershipId, txn.netPoints(), txn.getTotal(), now) == 1;
        }
        if (txn.netPoints() == 0) {
            return true;
        }
        return membershipRepository.applyPointsDelta(membershipId, txn.netPoints(), now) == 1;
    }

    private Optional<String> validateAmounts(TransactionRequest request) {
        if (request.membershipId() == null) {
            throw new IllegalArgumentException("membershipId is required.");
        }
        if (request.amount() == null) {
            return Optional.of("Amount is required.");
        }
        if (request.amount().signum() < 0) {
            return Optional.of("Amount cannot be negative.");
        }
        if (request.tax() != null && request.tax().signum() < 0) {
            return Optional.of("Tax cannot be negative.");
        }
        if (request.total() != null && request.total().signum() < 0) {
            return Optional.of("Total cannot be negative.");
        }
        if (!fitsMoneyColumn(request.amount())
                || (request.tax() != null && !fitsMoneyColumn(request.tax()))
                || (request.total() != null && !fitsMoneyColumn(request.total()))) {
            return Optional.of("Amounts are limited to 10 integer digits and 2 decimals.");
        }
        if ((request.pointsEarned() != null && request.pointsEarned() < 0)
                || (request.pointsRedeemed() != null && request.pointsRedeemed() < 0)) {
            return Optional.of("Points cannot be negative.");
        }
        return Optional.empty();
    }

    private OperationResult<LedgerTransaction> insufficientPoints(Membership membership, LedgerTransaction txn) {
        int available = membership.getLoyaltyPoints();
        int needed = -txn.netPoints();
        return OperationResult.denied(ValidationError.INSUFFICIENT_POINTS,
                "Not enough points: " + needed + " needed, " + available + " available.",
                Map.of("required", needed, "available", available, "shortfall", Math.max(0, needed - available)));
    }

    private LedgerTransaction reload(UUID id) {
        return transactionRepository.findById(id).orElseThrow();
    }

    private Customer actor(UUID customerId) {
        return customerId != null ? customerRepository.findById(customerId).orElse(null) : null;
    }

    private String generateCode() {
        String code;
        do {
            code = CODE_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT);
        } while (transactionRepository.existsByTransactionCode(code));
        return code;
    }
}
