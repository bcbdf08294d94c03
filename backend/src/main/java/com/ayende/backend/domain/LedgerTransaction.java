package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.PaymentMethod;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One ledger entry (purchase, refund or points adjustment) against a membership.
 * Entries are never deleted; only the status moves.
 */
@Getter
@Setter
@Entity
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_tenant_date", columnList = "tenant_id, transaction_date"),
        @Index(name = "idx_transactions_membership_date", columnList = "membership_id, transaction_date"),
        @Index(name = "idx_transactions_status", columnList = "status")
})
public class LedgerTransaction extends BaseEntity {

    @ManyToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, updatable = false)
    private Tenant tenant;

    @ManyToOne(optional = false)
    @JoinColumn(name = "membership_id", nullable = false, updatable = false)
    private Membership membership;

    @Column(name = "transaction_code", nullable = false, unique = true, updatable = false, length = 100)
    private String transactionCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private TransactionType type = TransactionType.PURCHASE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status = TransactionStatus.COMPLETED;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal tax = BigDecimal.ZERO;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod = PaymentMethod.CASH;

    @Column(name = "points_earned", nullable = false)
    private int pointsEarned = 0;

    @Column(name = "points_redeemed", nullable = false)
    private int pointsRedeemed = 0;

    // Set once the membership totals include this entry
    @Column(name = "aggregates_applied", nullable = false)
    private boolean aggregatesApplied = false;

    @Column(name = "receipt_number", length = 50)
    private String receiptNumber;

    @Column(name = "items_description", columnDefinition = "TEXT")
    private String itemsDescription;

    @Column(columnDefinition = "TEXT")
    private String notes;

    // Refund rows point at the purchase they reverse
    @ManyToOne
    @JoinColumn(name = "original_transaction_id")
    private LedgerTransaction originalTransaction;

    @ManyToOne
    @JoinColumn(name = "processed_by_id")
    private Customer processedBy;

    @Column(name = "transaction_date", nullable = false)
    private LocalDateTime transactionDate;

    public boolean isRefundable() {
        return status == TransactionStatus.COMPLETED && type == TransactionType.PURCHASE;
    }

    /** Points this entry moves on the membership balance. */
    public int netPoints() {
        return pointsEarned - pointsRedeemed;
    }
}
