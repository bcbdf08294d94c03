package com.ayende.backend.repository;

import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.enums.RewardStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RewardRepository extends JpaRepository<Reward, UUID> {

    Optional<Reward> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Reward> findByTenantIdOrderByDisplayOrderAscCreatedAtDesc(UUID tenantId);

    List<Reward> findByTenantIdAndStatusOrderByDisplayOrderAscCreatedAtDesc(UUID tenantId, RewardStatus status);

    List<Reward> findByTenantIdAndStatusAndFeaturedTrueOrderByDisplayOrderAsc(UUID tenantId, RewardStatus status);

    /**
     * Takes one unit of stock. Returns 0 when the reward is no longer active or the cap was
     * reached by a concurrent redemption.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reward r SET r.redeemedCount = r.redeemedCount + 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.status = :active " +
           "AND (r.hasStockLimit = false OR r.redeemedCount < r.totalStock)")
    int claimStock(@Param("id") UUID id, @Param("active") RewardStatus active, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reward r SET r.status = :outOfStock " +
           "WHERE r.id = :id AND r.hasStockLimit = true AND r.redeemedCount >= r.totalStock")
    int markOutOfStockIfExhausted(@Param("id") UUID id, @Param("outOfStock") RewardStatus outOfStock);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reward r SET r.redeemedCount = r.redeemedCount - 1, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.redeemedCount > 0")
    int releaseStock(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reward r SET r.status = :active " +
           "WHERE r.id = :id AND r.status = :outOfStock AND r.redeemedCount < r.totalStock")
    int restockIfAvailable(@Param("id") UUID id,
                           @Param("outOfStock") RewardStatus outOfStock,
                           @Param("active") RewardStatus active);
}
