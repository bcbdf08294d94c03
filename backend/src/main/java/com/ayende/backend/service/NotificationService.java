package com.ayende.backend.service;

import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Notification;
import com.ayende.backend.domain.NotificationRecipient;
import com.ayende.backend.domain.enums.DeliveryStatus;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.domain.enums.NotificationCategory;
import com.ayende.backend.domain.enums.NotificationPriority;
import com.ayende.backend.domain.enums.NotificationStatus;
import com.ayende.backend.dto.NotificationDTOs.NotificationRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.NotificationRecipientRepository;
import com.ayende.backend.repository.NotificationRepository;
import com.ayende.backend.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Staff messages to customers. Sending materializes one recipient row per targeted membership;
 * read counters on the notification follow the recipients' read flags.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationRecipientRepository recipientRepository;
    private final MembershipRepository membershipRepository;
    private final TenantRepository tenantRepository;
    private final CustomerRepository customerRepository;
    private final TransactionTemplate transactionTemplate;

    @Transactional
    public Notification create(UUID tenantId, NotificationRequest request, UUID createdById) {
        if (request.title() == null || request.title().isBlank()) {
            throw new IllegalArgumentException("Title is required.");
        }
        if (request.message() == null || request.message().isBlank()) {
            throw new IllegalArgumentException("Message is required.");
        }
        if (request.targetMinPoints() != null && request.targetMaxPoints() != null
                && request.targetMinPoints() > request.targetMaxPoints()) {
            throw new IllegalArgumentException("Minimum points cannot be greater than maximum points.");
        }

        Notification notification = new Notification();
        notification.setTenant(tenantRepository.findById(tenantId).orElseThrow());
        notification.setTitle(request.title().trim());
        notification.setMessage(request.message());
        notification.setCategory(request.category() != null ? request.category() : NotificationCategory.ANNOUNCEMENT);
        notification.setPriority(request.priority() != null ? request.priority() : NotificationPriority.NORMAL);
        notification.setTargetAllCustomers(request.targetAllCustomers() == null || request.targetAllCustomers());
        notification.setTargetVipOnly(Boolean.TRUE.equals(request.targetVipOnly()));
        notification.setTargetMinPoints(request.targetMinPoints());
        notification.setTargetMaxPoints(request.targetMaxPoints());
        notification.setTargetMemberships(targets(tenantId, request.targetMembershipIds()));
        notification.setNotes(request.notes());
        if (createdById != null) {
            Customer creator = customerRepository.findById(createdById).orElse(null);
            notification.setCreatedBy(creator);
        }

        notification = notificationRepository.save(notification);
        return get(tenantId, notification.getId());
    }

    /**
     * Who receives the notification, evaluated now:
     * active customers of the business, or the explicit target list when not sent to everyone
     * (an empty list means nobody), then narrowed by the VIP and points filters.
     */
    @Transactional(readOnly = true)
    public Set<Membership> computeAudience(Notification notification) {
        Collection<Membership> base = notification.isTargetAllCustomers()
                ? membershipRepository.findByTenantIdAndRoleAndActiveTrue(notification.getTenant().getId(), MembershipRole.CUSTOMER)
                : notification.getTargetMemberships();

        return base.stream()
                .filter(m -> !notification.isTargetVipOnly() || m.isVip())
                .filter(m -> notification.getTargetMinPoints() == null || m.getLoyaltyPoints() >= notification.getTargetMinPoints())
                .filter(m -> notification.getTargetMaxPoints() == null || m.getLoyaltyPoints() <= notification.getTargetMaxPoints())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Delivers to the current audience. Safe to call again: members who already have the
     * notification are not given a second copy, and the totals are recounted from the rows.
     */
    @Transactional
    public Notification send(UUID tenantId, UUID notificationId) {
        Notification notification = get(tenantId, notificationId);
        LocalDateTime now = LocalDateTime.now();

        Set<Membership> audience = computeAudience(notification);
        if (audience.isEmpty() && recipientRepository.countByNotificationId(notificationId) == 0) {
            notification.setStatus(NotificationStatus.FAILED);
            log.warn("Notification {} has no recipients", notificationId);
            return notificationRepository.save(notification);
        }

        int created = 0;
        for (Membership membership : audience) {
            if (recipientRepository.findByNotificationIdAndMembershipId(notificationId, membership.getId()).isEmpty()) {
                NotificationRecipient recipient = new NotificationRecipient();
                recipient.setNotification(notification);
                recipient.setMembership(membership);
                recipient.setDeliveryStatus(DeliveryStatus.DELIVERED);
                recipient.setDeliveredAt(now);
                recipientRepository.save(recipient);
                created++;
            }
        }

        int total = (int) recipientRepository.countByNotificationId(notificationId);
        notification.setTotalRecipients(total);
        notification.setTotalDelivered(total);
        notification.setTotalFailed(0);
        notification.setStatus(NotificationStatus.SENT);
        if (notification.getSentAt() == null) {
            notification.setSentAt(now);
        }
        log.info("Notification {} sent: {} new recipients, {} total", notificationId, created, total);
        return notificationRepository.save(notification);
    }

    @Transactional
    public Notification schedule(UUID tenantId, UUID notificationId, LocalDateTime at) {
        if (at == null || !at.isAfter(LocalDateTime.now())) {
            throw new IllegalArgumentException("Scheduled time must be in the future.");
        }
        Notification notification = get(tenantId, notificationId);
        if (notification.getStatus() == NotificationStatus.SENT || notification.getStatus() == NotificationStatus.SENDING) {
            throw new IllegalStateException("Notification has already been sent.");
        }
        notification.setStatus(NotificationStatus.SCHEDULED);
        notification.setScheduledFor(at);
        return notificationRepository.save(notification);
    }

    /**
     * Sends every scheduled notification whose time has come. Each one is sent in its own
     * transaction; one that throws is marked FAILED and the others still go out.
     *
     * @return how many were dispatched without error
     */
    public int dispatchDue(LocalDateTime now) {
        List<Notification> due = transactionTemplate.execute(status ->
                notificationRepository.findByStatusAndScheduledForLessThanEqual(NotificationStatus.SCHEDULED, now));
        if (due == null) {
            return 0;
        }
        int dispatched = 0;
        for (Notification notification : due) {
            UUID notificationId = notification.getId();
            UUID tenantId = notification.getTenant().getId();
            try {
                transactionTemplate.executeWithoutResult(status -> send(tenantId, notificationId));
                dispatched++;
            } catch (RuntimeException e) {
                log.error("Scheduled notification {} could not be sent", notificationId, e);
                transactionTemplate.executeWithoutResult(status -> markFailed(notificationId));
            }
        }
        return dispatched;
    }

    private void markFailed(UUID notificationId) {
        notificationRepository.findById(notificationId).ifPresent(notification -> {
            notification.setStatus(NotificationStatus.FAILED);
            notificationRepository.save(notification);
        });
    }

    /** @return {@code false} when the recipient had already read it */
    @Transactional
    public boolean markRead(UUID membershipId, UUID recipientId) {
        NotificationRecipient recipient = recipient(membershipId, recipientId);
        if (recipientRepository.markRead(recipientId, LocalDateTime.now()) == 0) {
            return false;
        }
        notificationRepository.incrementRead(recipient.getNotification().getId());
        return true;
    }

    @Transactional
    public boolean markUnread(UUID membershipId, UUID recipientId) {
        NotificationRecipient recipient = recipient(membershipId, recipientId);
        if (recipientRepository.markUnread(recipientId, LocalDateTime.now()) == 0) {
            return false;
        }
        notificationRepository.decrementRead(recipient.getNotification().getId());
        return true;
    }

    @Transactional(readOnly = true)
    public List<NotificationRecipient> inbox(UUID membershipId) {
        return recipientRepository.findByMembershipIdOrderByCreatedAtDesc(membershipId);
    }

    @Transactional(readOnly = true)
    public long unreadCount(UUID membershipId) {
        return recipientRepository.countByMembershipIdAndReadFalse(membershipId);
    }

    @Transactional(readOnly = true)
    public Notification get(UUID tenantId, UUID notificationId) {
        return notificationRepository.findByIdAndTenantId(notificationId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification not found."));
    }

    @Transactional(readOnly = true)
    public List<Notification> list(UUID tenantId) {
        return notificationRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
    }

    private NotificationRecipient recipient(UUID membershipId, UUID recipientId) {
        return recipientRepository.findByIdAndMembershipId(recipientId, membershipId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification not found."));
    }

    private Set<Membership> targets(UUID tenantId, Set<UUID> ids) {
        if (ids == null || ids.isEmpty()) {
            return new HashSet<>();
        }
        List<Membership> found = membershipRepository.findByTenantIdAndIdIn(tenantId, ids);
        if (found.size() != ids.size()) {
            throw new IllegalArgumentException("Some target customers do not belong to this business.");
        }
        return new HashSet<>(found);
    }
}
