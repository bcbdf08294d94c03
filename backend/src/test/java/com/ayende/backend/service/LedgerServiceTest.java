package com.ayende.backend.service;

import com.ayende.backend.core.result.OperationResult;
import com.ayende.backend.core.result.ValidationError;
import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.PaymentMethod;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;
import com.ayende.backend.dto.LedgerDTOs.TransactionRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.LedgerTransactionRepository;
import com.ayende.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerServiceTest extends BaseSpringTest {

    @Autowired LedgerService ledgerService;
    @Autowired StatsRecalculationService statsRecalculationService;
    @Autowired LedgerTransactionRepository transactionRepository;
    @Autowired PlatformTransactionManager transactionManager;

    private Tenant tenant;
    private Membership member;

    @BeforeEach
    void setUp() {
        tenant = newBusiness("ledger").tenant();
        member = newMember(tenant, 0);
    }

    @Test
    void purchase_earns_floor_points_and_updates_totals() {
        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("49.99"), new BigDecimal("5.00")), null);

        assertThat(result.isOk()).isTrue();
        LedgerTransaction txn = result.value();
        assertThat(txn.getTotal()).isEqualByComparingTo("54.99");
        assertThat(txn.getPointsEarned()).isEqualTo(54);
        assertThat(txn.getTransactionCode()).startsWith("TXN-");

        Membership after = membershipRepository.findById(member.getId()).orElseThrow();
        assertThat(after.getTotalPurchases()).isEqualByComparingTo("54.99");
        assertThat(after.getPurchaseCount()).isEqualTo(1);
        assertThat(after.getLoyaltyPoints()).isEqualTo(54);
        assertThat(after.getLastPurchaseAt()).isNotNull();
    }

    @Test
    void replaying_a_code_returns_the_first_entry() {
        TransactionRequest request = withCode(member, "POS-" + unique("r"), "20.00");

        OperationResult<LedgerTransaction> first = ledgerService.recordTransaction(tenant.getId(), request, null);
        OperationResult<LedgerTransaction> replay = ledgerService.recordTransaction(tenant.getId(), request, null);

        assertThat(replay.isOk()).isTrue();
        assertThat(replay.value().getId()).isEqualTo(first.value().getId());
        Membership after = membershipRepository.findById(member.getId()).orElseThrow();
        assertThat(after.getPurchaseCount()).isEqualTo(1);
        assertThat(after.getLoyaltyPoints()).isEqualTo(20);
    }

    @Test
    void code_owned_by_another_customer_is_a_duplicate() {
        String code = "POS-" + unique("d");
        ledgerService.recordTransaction(tenant.getId(), withCode(member, code, "10.00"), null);
        Membership other = newMember(tenant, 0);

        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(), withCode(other, code, "10.00"), null);

        assertThat(result.error()).isEqualTo(ValidationError.DUPLICATE_TRANSACTION);
        assertThat(pointsOf(other)).isZero();
    }

    @Test
    void negative_amounts_are_rejected() {
        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("-1.00"), null), null);

        assertThat(result.isOk()).isFalse();
        assertThat(result.error()).isEqualTo(ValidationError.INVALID_AMOUNT);
        assertThat(transactionRepository.existsByMembershipId(member.getId())).isFalse();
    }

    @Test
    void amounts_beyond_the_money_column_are_rejected() {
        OperationResult<LedgerTransaction> tooManyDigits = ledgerService.recordTransaction(tenant.getId(),
                new TransactionRequest(member.getId(), null, TransactionType.PURCHASE, TransactionStatus.COMPLETED,
                        new BigDecimal("20000000000.00"), null, null, PaymentMethod.CASH, 10, null, null, null, null), null);
        OperationResult<LedgerTransaction> tooManyDecimals = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("10.005"), null), null);
        OperationResult<LedgerTransaction> totalOverflows = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("9999999999.99"), new BigDecimal("1.00")), null);

        assertThat(tooManyDigits.error()).isEqualTo(ValidationError.INVALID_AMOUNT);
        assertThat(tooManyDecimals.error()).isEqualTo(ValidationError.INVALID_AMOUNT);
        assertThat(totalOverflows.error()).isEqualTo(ValidationError.INVALID_AMOUNT);
        assertThat(transactionRepository.existsByMembershipId(member.getId())).isFalse();
    }

    @Test
    void purchase_earning_more_points_than_a_balance_holds_is_rejected() {
        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("3000000000.00"), null), null);

        assertThat(result.isOk()).isFalse();
        assertThat(result.error()).isEqualTo(ValidationError.INVALID_AMOUNT);
        assertThat(pointsOf(member)).isZero();
    }

    @Test
    void trailing_zeros_do_not_count_against_the_money_scale() {
        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("12.5000"), null), null);

        assertThat(result.isOk()).isTrue();
        assertThat(result.value().getPointsEarned()).isEqualTo(12);
    }

    @Test
    void membership_of_another_business_is_not_found() {
        Tenant other = newBusiness("ledger-other").tenant();

        assertThatThrownBy(() -> ledgerService.recordTransaction(other.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("10.00"), null), null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void adjustment_never_drives_balance_negative() {
        Membership poor = newMember(tenant, 10);
        String code = "ADJ-" + unique("a");
        TransactionRequest debit = new TransactionRequest(poor.getId(), code, TransactionType.ADJUSTMENT,
                TransactionStatus.COMPLETED, BigDecimal.ZERO, null, null, PaymentMethod.OTHER,
                0, 500, null, null, "manual correction");

        OperationResult<LedgerTransaction> result = ledgerService.recordTransaction(tenant.getId(), debit, null);

        assertThat(result.error()).isEqualTo(ValidationError.INSUFFICIENT_POINTS);
        assertThat(result.details()).containsEntry("available", 10);
        assertThat(pointsOf(poor)).isEqualTo(10);
        assertThat(transactionRepository.existsByTransactionCode(code)).isFalse();
    }

    @Test
    void pending_purchase_counts_only_once_completed() {
        String code = "POS-" + unique("p");
        TransactionRequest pending = new TransactionRequest(member.getId(), code, TransactionType.PURCHASE,
                TransactionStatus.PENDING, new BigDecimal("30.00"), null, null, PaymentMethod.CARD,
                null, null, null, null, null);

        ledgerService.recordTransaction(tenant.getId(), pending, null);
        assertThat(pointsOf(member)).isZero();

        OperationResult<LedgerTransaction> completed = ledgerService.completeTransaction(tenant.getId(), code);
        assertThat(completed.value().getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(pointsOf(member)).isEqualTo(30);

        OperationResult<LedgerTransaction> again = ledgerService.completeTransaction(tenant.getId(), code);
        assertThat(again.error()).isEqualTo(ValidationError.INVALID_STATE);
        assertThat(pointsOf(member)).isEqualTo(30);
    }

    @Test
    void cancelled_pending_purchase_leaves_membership_untouched() {
        String code = "POS-" + unique("c");
        ledgerService.recordTransaction(tenant.getId(), new TransactionRequest(member.getId(), code, TransactionType.PURCHASE,
                TransactionStatus.PENDING, new BigDecimal("30.00"), null, null, null, null, null, null, null, null), null);

        assertThat(ledgerService.cancelTransaction(tenant.getId(), code).value().getStatus())
                .isEqualTo(TransactionStatus.CANCELLED);
        assertThat(ledgerService.completeTransaction(tenant.getId(), code).error())
                .isEqualTo(ValidationError.INVALID_STATE);
        assertThat(membershipRepository.findById(member.getId()).orElseThrow().getPurchaseCount()).isZero();
    }

    @Test
    void refund_reverses_points_and_totals_once() {
        LedgerTransaction purchase = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("49.99"), new BigDecimal("5.00")), null).value();

        OperationResult<LedgerTransaction> refund = ledgerService.refundTransaction(tenant.getId(),
                purchase.getTransactionCode(), "damaged item", null);

        assertThat(refund.isOk()).isTrue();
        assertThat(refund.value().getType()).isEqualTo(TransactionType.REFUND);
        assertThat(refund.value().getPointsRedeemed()).isEqualTo(54);
        assertThat(refund.value().getOriginalTransaction().getId()).isEqualTo(purchase.getId());
        assertThat(ledgerService.find(tenant.getId(), purchase.getTransactionCode()).getStatus())
                .isEqualTo(TransactionStatus.REFUNDED);

        Membership after = membershipRepository.findById(member.getId()).orElseThrow();
        assertThat(after.getLoyaltyPoints()).isZero();
        assertThat(after.getTotalPurchases()).isEqualByComparingTo("0.00");
        assertThat(after.getPurchaseCount()).isZero();

        assertThat(ledgerService.refundTransaction(tenant.getId(), purchase.getTransactionCode(), "again", null).error())
                .isEqualTo(ValidationError.INVALID_STATE);
    }

    @Test
    void refund_clamps_reversal_to_remaining_balance() {
        LedgerTransaction purchase = ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("40.00"), null), null).value();
        ledgerService.recordTransaction(tenant.getId(), new TransactionRequest(member.getId(), null, TransactionType.ADJUSTMENT,
                TransactionStatus.COMPLETED, BigDecimal.ZERO, null, null, null, 0, 30, null, null, null), null);

        OperationResult<LedgerTransaction> refund = ledgerService.refundTransaction(tenant.getId(),
                purchase.getTransactionCode(), "returned", null);

        assertThat(refund.value().getPointsRedeemed()).isEqualTo(10);
        assertThat(pointsOf(member)).isZero();
    }

    @Test
    void recalculation_rebuilds_purchase_totals() {
        ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("10.00"), null), null);
        ledgerService.recordTransaction(tenant.getId(),
                TransactionRequest.purchase(member.getId(), new BigDecimal("15.50"), null), null);
        new TransactionTemplate(transactionManager).executeWithoutResult(status ->
                membershipRepository.overwritePurchaseStats(member.getId(), new BigDecimal("999.00"), 42, null, LocalDateTime.now()));

        statsRecalculationService.recalculateStats(tenant.getId());

        Membership after = membershipRepository.findById(member.getId()).orElseThrow();
        assertThat(after.getTotalPurchases()).isEqualByComparingTo("25.50");
        assertThat(after.getPurchaseCount()).isEqualTo(2);
        assertThat(after.getLastPurchaseAt()).isNotNull();
        assertThat(after.getLoyaltyPoints()).isEqualTo(25);
    }

    private static TransactionRequest withCode(Membership membership, String code, String amount) {
        return new TransactionRequest(membership.getId(), code, TransactionType.PURCHASE, TransactionStatus.COMPLETED,
                new BigDecimal(amount), null, null, PaymentMethod.CASH, null, null, null, null, null);
    }
}
