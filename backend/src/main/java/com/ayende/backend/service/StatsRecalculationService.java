package com.ayende.backend.service;

import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;
import com.ayende.backend.repository.LedgerTransactionRepository;
import com.ayende.backend.repository.MembershipRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Maintenance job that rebuilds purchase totals, purchase count and last purchase date from
 * the ledger. The points balance is left alone: redemptions and adjustments move it too, so
 * purchases alone cannot reproduce it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatsRecalculationService {

    private final MembershipRepository membershipRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final LedgerService ledgerService;

    @Transactional
    public int recalculateStats(UUID tenantId) {
        // Refunded purchases stay in the totals unless refunds reverse them
        Set<TransactionStatus> counted = ledgerService.isRefundReversingPoints()
                ? EnumSet.of(TransactionStatus.COMPLETED)
                : EnumSet.of(TransactionStatus.COMPLETED, TransactionStatus.REFUNDED);

        List<UUID> membershipIds = membershipRepository.findByTenantIdOrderByCreatedAtDesc(tenantId).stream()
                .map(Membership::getId)
                .toList();

        LocalDateTime now = LocalDateTime.now();
        int updated = 0;
        for (UUID membershipId : membershipIds) {
            membershipRepository.findForUpdate(membershipId, tenantId);

            List<LedgerTransaction> purchases = transactionRepository
                    .findByMembershipIdAndTypeAndStatusInOrderByTransactionDateAsc(membershipId, TransactionType.PURCHASE, counted)
                    .stream()
                    .filter(LedgerTransaction::isAggregatesApplied)
                    .toList();

            BigDecimal total = purchases.stream()
                    .map(LedgerTransaction::getTotal)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            LocalDateTime lastPurchase = purchases.isEmpty() ? null : purchases.get(purchases.size() - 1).getTransactionDate();

            updated += membershipRepository.overwritePurchaseStats(membershipId, total, purchases.size(), lastPurchase, now);
        }
        log.info("Recalculated purchase stats for {} memberships of business {}", updated, tenantId);
        return updated;
    }
}
