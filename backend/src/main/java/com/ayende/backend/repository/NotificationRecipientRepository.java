package com.ayende.backend.repository;

import com.ayende.backend.domain.NotificationRecipient;
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
public interface NotificationRecipientRepository extends JpaRepository<NotificationRecipient, UUID> {

    Optional<NotificationRecipient> findByNotificationIdAndMembershipId(UUID notificationId, UUID membershipId);

    Optional<NotificationRecipient> findByIdAndMembershipId(UUID id, UUID membershipId);

    long countByNotificationId(UUID notificationId);

    long countByNotificationIdAndReadTrue(UUID notificationId);

    List<NotificationRecipient> findByMembershipIdOrderByCreatedAtDesc(UUID membershipId);

    long countByMembershipIdAndReadFalse(UUID membershipId);

    boolean existsByMembershipId(UUID membershipId);

    /** Flips unread to read; returns 0 when the row was already read. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE NotificationRecipient r SET r.read = true, r.readAt = :now, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.read = false")
    int markRead(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE NotificationRecipient r SET r.read = false, r.readAt = null, r.updatedAt = :now " +
           "WHERE r.id = :id AND r.read = true")
    int markUnread(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
