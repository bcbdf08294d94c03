package com.ayende.backend.repository;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.enums.MembershipRole;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Point and purchase aggregates are changed with single guarded UPDATE statements so that
 * concurrent writers can never drive a balance below zero.
 */
@Repository
public interface MembershipRepository extends JpaRepository<Membership, UUID> {

    Optional<Membership> findByIdAndTenantId(UUID id, UUID tenantId);

    Optional<Membership> findByCustomerIdAndTenantId(UUID customerId, UUID tenantId);

    boolean existsByCustomerIdAndTenantId(UUID customerId, UUID tenantId);

    List<Membership> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

    List<Membership> findByTenantIdAndRoleOrderByCreatedAtDesc(UUID tenantId, MembershipRole role);

    List<Membership> findByTenantIdAndRoleAndActiveTrue(UUID tenantId, MembershipRole role);

    List<Membership> findByTenantIdAndIdIn(UUID tenantId, Collection<UUID> ids);

    long countByTenantIdAndRole(UUID tenantId, MembershipRole role);

    long countByTenantIdAndRoleIn(UUID tenantId, Collection<MembershipRole> roles);

    /**
     * Row lock held until the surrounding transaction ends. Serializes redemptions and
     * ledger writes for one member.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Membership m WHERE m.id = :id AND m.tenant.id = :tenantId")
    Optional<Membership> findForUpdate(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.loyaltyPoints = m.loyaltyPoints - :points, m.updatedAt = :now " +
           "WHERE m.id = :id AND m.loyaltyPoints >= :points")
    int debitPoints(@Param("id") UUID id, @Param("points") int points, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.loyaltyPoints = m.loyaltyPoints + :points, m.updatedAt = :now WHERE m.id = :id")
    int creditPoints(@Param("id") UUID id, @Param("points") int points, @Param("now") LocalDateTime now);

    /** Adds a signed delta to the balance unless the result would be negative. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.loyaltyPoints = m.loyaltyPoints + :delta, m.updatedAt = :now " +
           "WHERE m.id = :id AND m.loyaltyPoints + :delta >= 0")
    int applyPointsDelta(@Param("id") UUID id, @Param("delta") int delta, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.loyaltyPoints = m.loyaltyPoints + :delta, " +
           "m.totalPurchases = m.totalPurchases + :total, m.purchaseCount = m.purchaseCount + 1, " +
           "m.lastPurchaseAt = :now, m.updatedAt = :now " +
           "WHERE m.id = :id AND m.loyaltyPoints + :delta >= 0")
    int applyPurchase(@Param("id") UUID id,
                      @Param("delta") int delta,
                      @Param("total") BigDecimal total,
                      @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.loyaltyPoints = m.loyaltyPoints - :points, " +
           "m.totalPurchases = m.totalPurchases - :total, m.purchaseCount = m.purchaseCount - 1, m.updatedAt = :now " +
           "WHERE m.id = :id AND m.loyaltyPoints >= :points AND m.purchaseCount > 0")
    int reversePurchase(@Param("id") UUID id,
                        @Param("points") int points,
                        @Param("total") BigDecimal total,
                        @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Membership m SET m.totalPurchases = :total, m.purchaseCount = :count, " +
           "m.lastPurchaseAt = :lastPurchaseAt, m.updatedAt = :now WHERE m.id = :id")
    int overwritePurchaseStats(@Param("id") UUID id,
                               @Param("total") BigDecimal total,
                               @Param("count") int count,
                               @Param("lastPurchaseAt") LocalDateTime lastPurchaseAt,
                               @Param("now") LocalDateTime now);
}
