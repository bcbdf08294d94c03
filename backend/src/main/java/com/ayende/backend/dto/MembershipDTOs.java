package com.ayende.backend.dto;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.enums.MembershipRole;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public class MembershipDTOs {

    /** Staff adding a customer (or team member) to the business. */
    public record AddMemberRequest(
        String email,
        String firstName,
        String lastName,
        String phone,
        String password,
        MembershipRole role
    ) {}

    public record UpdateMemberRequest(
        Boolean vip,
        Boolean active,
        MembershipRole role,
        String notes,
        List<String> tags,
        Boolean emailNotifications,
        Boolean smsNotifications,
        Boolean pushNotifications
    ) {}

    public record MemberResponse(
        UUID id,
        UUID customerId,
        String email,
        String fullName,
        String phone,
        MembershipRole role,
        int loyaltyPoints,
        BigDecimal totalPurchases,
        int purchaseCount,
        LocalDateTime lastPurchaseAt,
        boolean vip,
        boolean active,
        List<String> tags,
        LocalDateTime joinedAt
    ) {
        public static MemberResponse from(Membership m) {
            return new MemberResponse(m.getId(), m.getCustomer().getId(), m.getCustomer().getEmail(),
                    m.getCustomer().getFullName(), m.getCustomer().getPhone(), m.getRole(), m.getLoyaltyPoints(),
                    m.getTotalPurchases(), m.getPurchaseCount(), m.getLastPurchaseAt(), m.isVip(), m.isActive(),
                    List.copyOf(m.getTags()), m.getCreatedAt());
        }
    }

    public record RemovalResponse(UUID membershipId, boolean deleted) {}

    // ===== Self-service profile =====

    public record ProfileRequest(
        String firstName,
        String lastName,
        String phone,
        LocalDate dateOfBirth,
        String address,
        String city,
        String postalCode,
        String country,
        String preferredLanguage
    ) {}

    public record PreferencesRequest(Boolean emailNotifications, Boolean smsNotifications, Boolean pushNotifications) {}

    public record ChangePasswordRequest(String currentPassword, String newPassword) {}

    public record ProfileResponse(
        UUID customerId,
        UUID membershipId,
        String email,
        String firstName,
        String lastName,
        String phone,
        LocalDate dateOfBirth,
        String address,
        String city,
        String postalCode,
        String country,
        String preferredLanguage,
        boolean emailNotifications,
        boolean smsNotifications,
        boolean pushNotifications,
        int loyaltyPoints
    ) {
        public static ProfileResponse from(Membership m) {
            var c = m.getCustomer();
            return new ProfileResponse(c.getId(), m.getId(), c.getEmail(), c.getFirstName(), c.getLastName(),
                    c.getPhone(), c.getDateOfBirth(), c.getAddress(), c.getCity(), c.getPostalCode(), c.getCountry(),
                    c.getPreferredLanguage(), m.isEmailNotifications(), m.isSmsNotifications(), m.isPushNotifications(),
                    m.getLoyaltyPoints());
        }
    }
}
