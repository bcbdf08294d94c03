package com.ayende.backend.dto;

import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.enums.PaymentMethod;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public class LedgerDTOs {

    /**
     * Staff input for a ledger entry. Only {@code membershipId} and {@code amount} are required;
     * a caller supplying its own {@code transactionCode} can safely replay the request.
     */
    public record TransactionRequest(
        UUID membershipId,
        String transactionCode,
        TransactionType type,
        TransactionStatus status,
        BigDecimal amount,
        BigDecimal tax,
        BigDecimal total,
        PaymentMethod paymentMethod,
        Integer pointsEarned,
        Integer pointsRedeemed,
        String receiptNumber,
        String itemsDescription,
        String notes
    ) {
        public static TransactionRequest purchase(UUID membershipId, BigDecimal amount, BigDecimal tax) {
            return new TransactionRequest(membershipId, null, TransactionType.PURCHASE, TransactionStatus.COMPLETED,
                    amount, tax, null, PaymentMethod.CASH, null, null, null, null, null);
        }
    }

    public record RefundRequest(String reason) {}

    public record TransactionResponse(
        UUID id,
        String transactionCode,
        UUID membershipId,
        String customerName,
        TransactionType type,
        TransactionStatus status,
        BigDecimal amount,
        BigDecimal tax,
        BigDecimal total,
        String formattedTotal,
        PaymentMethod paymentMethod,
        int pointsEarned,
        int pointsRedeemed,
        String receiptNumber,
        String originalTransactionCode,
        LocalDateTime transactionDate
    ) {
        public static TransactionResponse from(LedgerTransaction t, String formattedTotal) {
            return new TransactionResponse(t.getId(), t.getTransactionCode(), t.getMembership().getId(),
                    t.getMembership().getCustomer().getFullName(), t.getType(), t.getStatus(), t.getAmount(),
                    t.getTax(), t.getTotal(), formattedTotal, t.getPaymentMethod(), t.getPointsEarned(),
                    t.getPointsRedeemed(), t.getReceiptNumber(),
                    t.getOriginalTransaction() != null ? t.getOriginalTransaction().getTransactionCode() : null,
                    t.getTransactionDate());
        }
    }

    public record RecalculationResponse(int membershipsUpdated) {}
}
