package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.NotificationCategory;
import com.ayende.backend.domain.enums.NotificationPriority;
import com.ayende.backend.domain.enums.NotificationStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

@Getter
@Setter
@Entity
@Table(name = "notifications", indexes = {
        @Index(name = "idx_notifications_tenant_created", columnList = "tenant_id, created_at"),
        @Index(name = "idx_notifications_status_scheduled", columnList = "status, scheduled_for")
})
public class Notification extends BaseEntity {

    @ManyToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, updatable = false)
    private Tenant tenant;

    @ManyToOne
    @JoinColumn(name = "created_by_id")
    private Customer createdBy;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NotificationCategory category = NotificationCategory.ANNOUNCEMENT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private NotificationPriority priority = NotificationPriority.NORMAL;

    // --- Targeting ---

    @Column(name = "target_all_customers", nullable = false)
    private boolean targetAllCustomers = true;

    @Column(name = "target_vip_only", nullable = false)
    private boolean targetVipOnly = false;

    @Column(name = "target_min_points")
    private Integer targetMinPoints;

    @Column(name = "target_max_points")
    private Integer targetMaxPoints;

    @ManyToMany(fetch = FetchType.EAGER)
    @JoinTable(name = "notification_targets",
            joinColumns = @JoinColumn(name = "notification_id"),
            inverseJoinColumns = @JoinColumn(name = "membership_id"))
    private Set<Membership> targetMemberships = new HashSet<>();

    // --- Status ---

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NotificationStatus status = NotificationStatus.DRAFT;

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    // --- Statistics ---

    @Column(name = "total_recipients", nullable = false)
    private int totalRecipients = 0;

    @Column(name = "total_delivered", nullable = false)
    private int totalDelivered = 0;

    @Column(name = "total_read", nullable = false, updatable = false)
    private int totalRead = 0;

    @Column(name = "total_failed", nullable = false)
    private int totalFailed = 0;

    @Column(columnDefinition = "TEXT")
    private String notes;

    public BigDecimal getReadRate() {
        if (totalDelivered == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(totalRead * 100L)
                .divide(BigDecimal.valueOf(totalDelivered), 1, RoundingMode.HALF_UP);
    }
}
