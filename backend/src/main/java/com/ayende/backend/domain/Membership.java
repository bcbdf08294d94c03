package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.MembershipRole;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The tenant-scoped side of a {@link Customer}: role, loyalty balance and purchase history
 * inside one business.
 *
 * <p>Points and purchase aggregates are only written through the ledger and redemption
 * services, which use guarded updates in {@code MembershipRepository}.
 */
@Getter
@Setter
@Entity
@Table(name = "memberships",
        uniqueConstraints = @UniqueConstraint(name = "uk_membership_customer_tenant", columnNames = {"customer_id", "tenant_id"}),
        indexes = {
                @Index(name = "idx_memberships_tenant_role", columnList = "tenant_id, role"),
                @Index(name = "idx_memberships_tenant_active", columnList = "tenant_id, is_active"),
                @Index(name = "idx_memberships_points", columnList = "loyalty_points")
        })
public class Membership extends BaseEntity {

    @ManyToOne(optional = false)
    @JoinColumn(name = "customer_id", nullable = false, updatable = false)
    private Customer customer;

    @ManyToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, updatable = false)
    private Tenant tenant;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MembershipRole role = MembershipRole.CUSTOMER;

    // Aggregates below are written by bulk updates only, never by an entity flush
    @Column(name = "loyalty_points", nullable = false, updatable = false)
    private int loyaltyPoints = 0;

    @Column(name = "total_purchases", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalPurchases = BigDecimal.ZERO;

    @Column(name = "purchase_count", nullable = false, updatable = false)
    private int purchaseCount = 0;

    @Column(name = "last_purchase_at", updatable = false)
    private LocalDateTime lastPurchaseAt;

    @Column(name = "is_vip", nullable = false)
    private boolean vip = false;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    // --- Preferences ---

    @Column(name = "email_notifications", nullable = false)
    private boolean emailNotifications = true;

    @Column(name = "sms_notifications", nullable = false)
    private boolean smsNotifications = false;

    @Column(name = "push_notifications", nullable = false)
    private boolean pushNotifications = true;

    // Visible to staff only
    @Column(columnDefinition = "TEXT")
    private String notes;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "membership_tags", joinColumns = @JoinColumn(name = "membership_id"))
    @Column(name = "tag", length = 50)
    private Set<String> tags = new LinkedHashSet<>();

    public boolean isStaffMember() {
        return role != null && role.isStaffMember();
    }

    public boolean isBusinessOwner() {
        return role == MembershipRole.OWNER;
    }
}
