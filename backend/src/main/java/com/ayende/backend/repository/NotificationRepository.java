package com.ayende.backend.repository;

import com.ayende.backend.domain.Notification;
import com.ayende.backend.domain.enums.NotificationStatus;
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
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndTenantId(UUID id, UUID tenantId);

    List<Notification> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

    List<Notification> findByStatusAndScheduledForLessThanEqual(NotificationStatus status, LocalDateTime now);

    boolean existsByTargetMembershipsId(UUID membershipId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notification n SET n.totalRead = n.totalRead + 1 WHERE n.id = :id")
    int incrementRead(@Param("id") UUID id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notification n SET n.totalRead = n.totalRead - 1 WHERE n.id = :id AND n.totalRead > 0")
    int decrementRead(@Param("id") UUID id);
}
