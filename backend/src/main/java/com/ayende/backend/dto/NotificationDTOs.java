package com.ayende.backend.dto;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Notification;
import com.ayende.backend.domain.NotificationRecipient;
import com.ayende.backend.domain.enums.NotificationCategory;
import com.ayende.backend.domain.enums.NotificationPriority;
import com.ayende.backend.domain.enums.NotificationStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

public class NotificationDTOs {

    public record NotificationRequest(
        String title,
        String message,
        NotificationCategory category,
        NotificationPriority priority,
        Boolean targetAllCustomers,
        Boolean targetVipOnly,
        Integer targetMinPoints,
        Integer targetMaxPoints,
        Set<UUID> targetMembershipIds,
        String notes
    ) {}

    public record ScheduleRequest(LocalDateTime scheduledFor) {}

    public record NotificationResponse(
        UUID id,
        String title,
        String message,
        NotificationCategory category,
        NotificationPriority priority,
        boolean targetAllCustomers,
        boolean targetVipOnly,
        Integer targetMinPoints,
        Integer targetMaxPoints,
        Set<UUID> targetMembershipIds,
        NotificationStatus status,
        LocalDateTime scheduledFor,
        LocalDateTime sentAt,
        int totalRecipients,
        int totalDelivered,
        int totalRead,
        int totalFailed,
        BigDecimal readRate
    ) {
        public static NotificationResponse from(Notification n) {
            return new NotificationResponse(n.getId(), n.getTitle(), n.getMessage(), n.getCategory(),
                    n.getPriority(), n.isTargetAllCustomers(), n.isTargetVipOnly(), n.getTargetMinPoints(),
                    n.getTargetMaxPoints(),
                    n.getTargetMemberships().stream().map(Membership::getId).collect(Collectors.toSet()),
                    n.getStatus(), n.getScheduledFor(), n.getSentAt(), n.getTotalRecipients(),
                    n.getTotalDelivered(), n.getTotalRead(), n.getTotalFailed(), n.getReadRate());
        }
    }

    /** One entry of a customer's inbox. */
    public record InboxItem(
        UUID recipientId,
        String title,
        String message,
        NotificationCategory category,
        NotificationPriority priority,
        boolean read,
        LocalDateTime deliveredAt,
        LocalDateTime readAt
    ) {
        public static InboxItem from(NotificationRecipient r) {
            Notification n = r.getNotification();
            return new InboxItem(r.getId(), n.getTitle(), n.getMessage(), n.getCategory(), n.getPriority(),
                    r.isRead(), r.getDeliveredAt(), r.getReadAt());
        }
    }

    public record InboxResponse(long unread, List<InboxItem> items) {}
}
