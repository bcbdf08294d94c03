package com.ayende.backend.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Entity
@Table(name = "tenant_settings")
public class TenantSettings extends BaseEntity {

    @OneToOne(optional = false)
    @JoinColumn(name = "tenant_id", nullable = false, unique = true, updatable = false)
    private Tenant tenant;

    // --- Customers ---

    @Column(name = "allow_customer_registration", nullable = false)
    private boolean allowCustomerRegistration = true;

    @Column(name = "require_email_verification", nullable = false)
    private boolean requireEmailVerification = false;

    @Column(name = "max_customers", nullable = false)
    private int maxCustomers = 100;

    @Column(name = "max_staff_users", nullable = false)
    private int maxStaffUsers = 3;

    // --- Loyalty ---

    @Column(name = "loyalty_enabled", nullable = false)
    private boolean loyaltyEnabled = true;

    @Column(name = "points_per_currency_unit", nullable = false, precision = 8, scale = 2)
    private BigDecimal pointsPerCurrencyUnit = BigDecimal.ONE;

    // --- Notifications ---

    @Column(name = "email_notifications", nullable = false)
    private boolean emailNotifications = true;

    @Column(name = "push_notifications", nullable = false)
    private boolean pushNotifications = true;

    @Column(name = "sms_notifications", nullable = false)
    private boolean smsNotifications = false;

    // JSON, e.g. {"mon": "09:00-17:00"}
    @Column(name = "business_hours", columnDefinition = "TEXT")
    private String businessHours;

    protected TenantSettings() {
    }

    public TenantSettings(Tenant tenant) {
        this.tenant = tenant;
    }
}
