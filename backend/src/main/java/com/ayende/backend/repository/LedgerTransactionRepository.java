package com.ayende.backend.repository;

import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.enums.TransactionStatus;
import com.ayende.backend.domain.enums.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    Optional<LedgerTransaction> findByTransactionCode(String transactionCode);

    Optional<LedgerTransaction> findByTransactionCodeAndTenantId(String transactionCode, UUID tenantId);

    boolean existsByTransactionCode(String transactionCode);

    boolean existsByMembershipId(UUID membershipId);

    List<LedgerTransaction> findByTenantIdOrderByTransactionDateDesc(UUID tenantId);

    List<LedgerTransaction> findByMembershipIdOrderByTransactionDateDesc(UUID membershipId);

    List<LedgerTransaction> findByMembershipIdAndTypeAndStatusInOrderByTransactionDateAsc(
            UUID membershipId, TransactionType type, Collection<TransactionStatus> statuses);

    /** Moves the status only when it still is {@code from}; returns 0 for the losing writer. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LedgerTransaction t SET t.status = :to, t.updatedAt = :now WHERE t.id = :id AND t.status = :from")
    int transitionStatus(@Param("id") UUID id,
                         @Param("from") TransactionStatus from,
                         @Param("to") TransactionStatus to,
                         @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE LedgerTransaction t SET t.aggregatesApplied = true WHERE t.id = :id AND t.aggregatesApplied = false")
    int markAggregatesApplied(@Param("id") UUID id);
}
