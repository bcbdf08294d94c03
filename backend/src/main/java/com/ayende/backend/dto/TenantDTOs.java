package com.ayende.backend.dto;

import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.CurrencyPosition;
import com.ayende.backend.domain.enums.SubscriptionStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public class TenantDTOs {

    /** Self-service signup: the business and its owner account. */
    public record SignupRequest(
        String businessName,
        String slug,
        String businessEmail,
        String businessPhone,
        String ownerEmail,
        String ownerPassword,
        String ownerFirstName,
        String ownerLastName
    ) {}

    public record SignupResponse(TenantResponse tenant, UUID ownerCustomerId, UUID ownerMembershipId) {}

    public record TenantProfileRequest(
        String name,
        String businessEmail,
        String businessPhone,
        String businessAddress,
        String website,
        String description,
        String currencyCode,
        String currencySymbol,
        CurrencyPosition currencyPosition,
        Integer decimalPlaces,
        String logoUrl,
        String primaryColor,
        String secondaryColor
    ) {}

    public record SettingsRequest(
        Boolean allowCustomerRegistration,
        Boolean requireEmailVerification,
        Integer maxCustomers,
        Integer maxStaffUsers,
        Boolean loyaltyEnabled,
        BigDecimal pointsPerCurrencyUnit,
        Boolean emailNotifications,
        Boolean pushNotifications,
        Boolean smsNotifications,
        String businessHours
    ) {}

    public record SubscriptionRequest(SubscriptionStatus status, Integer months) {}

    public record TenantResponse(
        UUID id,
        String name,
        String slug,
        String businessEmail,
        String businessPhone,
        String website,
        String description,
        String currencyCode,
        String currencySymbol,
        CurrencyPosition currencyPosition,
        int decimalPlaces,
        String logoUrl,
        String primaryColor,
        String secondaryColor,
        SubscriptionStatus subscriptionStatus,
        LocalDateTime trialEndsAt,
        LocalDateTime subscriptionEndsAt,
        boolean active
    ) {
        public static TenantResponse from(Tenant t) {
            return new TenantResponse(t.getId(), t.getName(), t.getSlug(), t.getBusinessEmail(), t.getBusinessPhone(),
                    t.getWebsite(), t.getDescription(), t.getCurrencyCode(), t.getCurrencySymbol(),
                    t.getCurrencyPosition(), t.getDecimalPlaces(), t.getLogoUrl(), t.getPrimaryColor(),
                    t.getSecondaryColor(), t.getSubscriptionStatus(), t.getTrialEndsAt(), t.getSubscriptionEndsAt(),
                    t.isActive());
        }
    }

    public record SettingsResponse(
        boolean allowCustomerRegistration,
        boolean requireEmailVerification,
        int maxCustomers,
        int maxStaffUsers,
        boolean loyaltyEnabled,
        BigDecimal pointsPerCurrencyUnit,
        boolean emailNotifications,
        boolean pushNotifications,
        boolean smsNotifications,
        String businessHours
    ) {
        public static SettingsResponse from(TenantSettings s) {
            return new SettingsResponse(s.isAllowCustomerRegistration(), s.isRequireEmailVerification(),
                    s.getMaxCustomers(), s.getMaxStaffUsers(), s.isLoyaltyEnabled(), s.getPointsPerCurrencyUnit(),
                    s.isEmailNotifications(), s.isPushNotifications(), s.isSmsNotifications(), s.getBusinessHours());
        }
    }
}
