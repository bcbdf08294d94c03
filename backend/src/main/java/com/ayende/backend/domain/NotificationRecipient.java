package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.DeliveryStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "notification_recipients",
        uniqueConstraints = @UniqueConstraint(name = "uk_recipient_notification_membership", columnNames = {"notification_id", "membership_id"}),
        indexes = {
                @Index(name = "idx_recipients_membership_created", columnList = "membership_id, created_at"),
                @Index(name = "idx_recipients_notification_read", columnList = "notification_id, is_read")
        })
public class NotificationRecipient extends BaseEntity {

    @ManyToOne(optional = false)
    @JoinColumn(name = "notification_id", nullable = false, updatable = false)
    private Notification notification;

    @ManyToOne(optional = false)
    @JoinColumn(name = "membership_id", nullable = false, updatable = false)
    private Membership membership;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", nullable = false, length = 20)
    private DeliveryStatus deliveryStatus = DeliveryStatus.PENDING;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    @Column(name = "read_at")
    private LocalDateTime readAt;
}
