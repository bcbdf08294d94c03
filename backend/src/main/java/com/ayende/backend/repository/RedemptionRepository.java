package com.ayende.backend.repository;

import com.ayende.backend.domain.Redemption;
import com.ayende.backend.domain.enums.RedemptionStatus;
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
public interface RedemptionRepository extends JpaRepository<Redemption, UUID> {

    boolean existsByRedemptionCode(String redemptionCode);

    boolean existsByMembershipId(UUID membershipId);

    long countByRewardId(UUID rewardId);

    Optional<Redemption> findByIdAndTenantId(UUID id, UUID tenantId);

    Optional<Redemption> findByRedemptionCodeAndTenantId(String redemptionCode, UUID tenantId);

    long countByRewardIdAndMembershipIdAndStatusIn(UUID rewardId, UUID membershipId, Collection<RedemptionStatus> statuses);

    List<Redemption> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

    List<Redemption> findByTenantIdAndStatusOrderByCreatedAtDesc(UUID tenantId, RedemptionStatus status);

    List<Redemption> findByMembershipIdOrderByCreatedAtDesc(UUID membershipId);

    List<Redemption> findByStatusInAndValidUntilBefore(Collection<RedemptionStatus> statuses, LocalDateTime cutoff);

    /**
     * State machine step. Only one of two racing callers (use vs. cancel, say) sees 1.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Redemption r SET r.status = :to, r.updatedAt = :now WHERE r.id = :id AND r.status IN :from")
    int transition(@Param("id") UUID id,
                   @Param("from") Collection<RedemptionStatus> from,
                   @Param("to") RedemptionStatus to,
                   @Param("now") LocalDateTime now);
}
