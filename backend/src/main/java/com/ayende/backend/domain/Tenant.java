package com.ayende.backend.domain;

import com.ayende.backend.domain.enums.CurrencyPosition;
import com.ayende.backend.domain.enums.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "tenants", indexes = {
        @Index(name = "idx_tenants_subscription_status", columnList = "subscription_status"),
        @Index(name = "idx_tenants_active", columnList = "is_active")
})
public class Tenant extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String name;

    // Doubles as the subdomain; never changes once a domain points at it
    @Column(nullable = false, unique = true, updatable = false, length = 100)
    private String slug;

    @Column(name = "business_email")
    private String businessEmail;

    @Column(name = "business_phone", length = 20)
    private String businessPhone;

    @Column(name = "business_address", columnDefinition = "TEXT")
    private String businessAddress;

    private String website;

    @Column(columnDefinition = "TEXT")
    private String description;

    // --- Currency ---

    @Column(name = "currency_code", nullable = false, length = 3)
    private String currencyCode = "CAD";

    @Column(name = "currency_symbol", nullable = false, length = 5)
    private String currencySymbol = "$";

    @Enumerated(EnumType.STRING)
    @Column(name = "currency_position", nullable = false, length = 10)
    private CurrencyPosition currencyPosition = CurrencyPosition.BEFORE;

    @Column(name = "decimal_places", nullable = false)
    private int decimalPlaces = 2;

    // --- Branding ---

    @Column(name = "logo_url")
    private String logoUrl;

    @Column(name = "primary_color", length = 7)
    private String primaryColor = "#228B22";

    @Column(name = "secondary_color", length = 7)
    private String secondaryColor = "#FF8C00";

    // --- Subscription ---

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_status", nullable = false, length = 20)
    private SubscriptionStatus subscriptionStatus = SubscriptionStatus.TRIAL;

    @Column(name = "trial_ends_at")
    private LocalDateTime trialEndsAt;

    @Column(name = "subscription_starts_at")
    private LocalDateTime subscriptionStartsAt;

    @Column(name = "subscription_ends_at")
    private LocalDateTime subscriptionEndsAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    /**
     * Whether the tenant may currently serve requests: the status must be trial or active,
     * and a trial must not have run past its end date.
     */
    public boolean isSubscriptionActive(LocalDateTime now) {
        if (subscriptionStatus == null || !subscriptionStatus.allowsAccess()) {
            return false;
        }
        if (subscriptionStatus == SubscriptionStatus.TRIAL && trialEndsAt != null) {
            return !trialEndsAt.isBefore(now);
        }
        return true;
    }

    /**
     * Extends the paid period. An expired (or never started) subscription restarts from now,
     * a running one keeps its remaining days.
     */
    public void renewSubscription(int months, LocalDateTime now) {
        if (this.subscriptionEndsAt == null || this.subscriptionEndsAt.isBefore(now)) {
            this.subscriptionStartsAt = now;
            this.subscriptionEndsAt = now.plusMonths(months);
        } else {
            this.subscriptionEndsAt = this.subscriptionEndsAt.plusMonths(months);
        }
        this.subscriptionStatus = SubscriptionStatus.ACTIVE;
        this.active = true;
    }
}
