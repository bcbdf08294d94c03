package com.ayende.backend.service;

import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.dto.AuthDTOs.RegisterRequest;
import com.ayende.backend.dto.MembershipDTOs.AddMemberRequest;
import com.ayende.backend.dto.MembershipDTOs.PreferencesRequest;
import com.ayende.backend.dto.MembershipDTOs.ProfileRequest;
import com.ayende.backend.dto.MembershipDTOs.UpdateMemberRequest;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.LedgerTransactionRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.NotificationRecipientRepository;
import com.ayende.backend.repository.NotificationRepository;
import com.ayende.backend.repository.RedemptionRepository;
import com.ayende.backend.repository.TenantRepository;
import com.ayende.backend.repository.TenantSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Customers are global; memberships tie them to one business. Nothing here touches
 * points or purchase totals, those belong to the ledger and redemption services.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipService {

    private static final int MIN_PASSWORD_LENGTH = 8;
    private static final Set<MembershipRole> TEAM_ROLES = EnumSet.of(MembershipRole.ADMIN, MembershipRole.MANAGER, MembershipRole.STAFF);

    private final MembershipRepository membershipRepository;
    private final CustomerRepository customerRepository;
    private final TenantRepository tenantRepository;
    private final TenantSettingsRepository settingsRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final RedemptionRepository redemptionRepository;
    private final NotificationRecipientRepository recipientRepository;
    private final NotificationRepository notificationRepository;
    private final PasswordEncoder passwordEncoder;

    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    @Transactional(readOnly = true)
    public Membership get(UUID tenantId, UUID membershipId) {
        return membershipRepository.findByIdAndTenantId(membershipId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Customer not found in this business."));
    }

    @Transactional(readOnly = true)
    public List<Membership> list(UUID tenantId, MembershipRole role) {
        if (role == null) {
            return membershipRepository.findByTenantIdOrderByCreatedAtDesc(tenantId);
        }
        return membershipRepository.findByTenantIdAndRoleOrderByCreatedAtDesc(tenantId, role);
    }

    /**
     * Self-service signup on a business subdomain. An existing platform account joins the
     * business only when the supplied password matches it.
     */
    @Transactional
    public Membership registerCustomer(UUID tenantId, RegisterRequest request) {
        TenantSettings settings = settings(tenantId);
        if (!settings.isAllowCustomerRegistration()) {
            throw new ForbiddenOperationException("This business does not accept online registration.");
        }

        String email = normalizeEmail(request.email());
        if (email == null || request.password() == null || request.password().isBlank()) {
            throw new IllegalArgumentException("Email and password are required.");
        }

        Customer customer = customerRepository.findByEmail(email).orElse(null);
        if (customer != null) {
            if (!passwordEncoder.matches(request.password(), customer.getPassword())) {
                throw new IllegalArgumentException("An account with this email already exists. Sign in with its password to join.");
            }
            if (membershipRepository.existsByCustomerIdAndTenantId(customer.getId(), tenantId)) {
                throw new IllegalArgumentException("You are already registered with this business.");
            }
        } else {
            customer = new Customer();
            customer.setEmail(email);
            customer.setPassword(passwordEncoder.encode(request.password()));
            customer.setFirstName(orEmpty(request.firstName()));
            customer.setLastName(orEmpty(request.lastName()));
            customer.setPhone(request.phone());
            customer.setEmailVerified(!settings.isRequireEmailVerification());
            customer = customerRepository.save(customer);
        }

        checkLimit(tenantId, MembershipRole.CUSTOMER, settings);
        Membership membership = createMembership(tenantId, customer, MembershipRole.CUSTOMER);
        log.info("Customer {} registered with business {}", email, tenantId);
        return membership;
    }

    /**
     * Staff adding someone to the business. Team roles may only be handed out by owners and admins;
     * there is exactly one owner, created at signup.
     */
    @Transactional
    public Membership addMember(UUID tenantId, AddMemberRequest request, MembershipRole actorRole) {
        MembershipRole role = request.role() != null ? request.role() : MembershipRole.CUSTOMER;
        requireCanAssign(role, actorRole);

        String email = normalizeEmail(request.email());
        if (email == null) {
            throw new IllegalArgumentException("Email is required.");
        }

        Customer customer = customerRepository.findByEmail(email).orElse(null);
        if (customer == null) {
            customer = new Customer();
            customer.setEmail(email);
            String password = request.password() != null && !request.password().isBlank()
                    ? request.password()
                    : UUID.randomUUID().toString();
            customer.setPassword(passwordEncoder.encode(password));
            customer.setFirstName(orEmpty(request.firstName()));
            customer.setLastName(orEmpty(request.lastName()));
            customer.setPhone(request.phone());
            customer = customerRepository.save(customer);
        } else if (membershipRepository.existsByCustomerIdAndTenantId(customer.getId(), tenantId)) {
            throw new IllegalArgumentException(email + " is already a member of this business.");
        }

        checkLimit(tenantId, role, settings(tenantId));
        Membership membership = createMembership(tenantId, customer, role);
        log.info("{} added to business {} as {}", email, tenantId, role);
        return membership;
    }

    @Transactional
    public Membership update(UUID tenantId, UUID membershipId, UpdateMemberRequest request, MembershipRole actorRole) {
        Membership membership = get(tenantId, membershipId);
        if (actorRole == null || !actorRole.canManageCustomers()) {
            throw new ForbiddenOperationException("You are not allowed to manage customers.");
        }

        if (request.role() != null && request.role() != membership.getRole()) {
            if (membership.isBusinessOwner()) {
                throw new ForbiddenOperationException("The owner's role cannot be changed.");
            }
            // Moving anyone into or out of the team is a team change
            requireCanAssign(membership.isStaffMember() ? MembershipRole.STAFF : request.role(), actorRole);
            requireCanAssign(request.role(), actorRole);
            membership.setRole(request.role());
        }
        if (request.vip() != null) membership.setVip(request.vip());
        if (request.active() != null) {
            if (!request.active() && membership.isBusinessOwner()) {
                throw new ForbiddenOperationException("The owner cannot be deactivated.");
            }
            membership.setActive(request.active());
        }
        if (request.notes() != null) membership.setNotes(request.notes());
        if (request.tags() != null) membership.setTags(new LinkedHashSet<>(request.tags()));
        if (request.emailNotifications() != null) membership.setEmailNotifications(request.emailNotifications());
        if (request.smsNotifications() != null) membership.setSmsNotifications(request.smsNotifications());
        if (request.pushNotifications() != null) membership.setPushNotifications(request.pushNotifications());

        return membershipRepository.save(membership);
    }

    /**
     * Removes the customer from this business only; the platform account is kept.
     * A membership with ledger, redemption or notification history is deactivated instead
     * of deleted so that history keeps its owner.
     *
     * @return {@code true} when the row was deleted, {@code false} when it was deactivated
     */
    @Transactional
    public boolean remove(UUID tenantId, UUID membershipId) {
        Membership membership = get(tenantId, membershipId);
        if (membership.isBusinessOwner()) {
            throw new ForbiddenOperationException("The owner cannot be removed from the business.");
        }

        boolean hasHistory = transactionRepository.existsByMembershipId(membershipId)
                || redemptionRepository.existsByMembershipId(membershipId)
                || recipientRepository.existsByMembershipId(membershipId)
                || notificationRepository.existsByTargetMembershipsId(membershipId);

        if (hasHistory) {
            membership.setActive(false);
            membershipRepository.save(membership);
            log.info("Membership {} deactivated (has history)", membershipId);
            return false;
        }
        membershipRepository.delete(membership);
        log.info("Membership {} deleted", membershipId);
        return true;
    }

    @Transactional
    public Membership markEmailVerified(UUID tenantId, UUID membershipId) {
        Membership membership = get(tenantId, membershipId);
        Customer customer = membership.getCustomer();
        customer.setEmailVerified(true);
        customerRepository.save(customer);
        return membership;
    }

    // ===== Self-service =====

    /** The signed-in member editing their own account details. Null fields are left as they are. */
    @Transactional
    public Membership updateOwnProfile(UUID tenantId, UUID membershipId, ProfileRequest request) {
        Membership membership = get(tenantId, membershipId);
        Customer customer = membership.getCustomer();
        if (request.firstName() != null) customer.setFirstName(request.firstName().trim());
        if (request.lastName() != null) customer.setLastName(request.lastName().trim());
        if (request.phone() != null) customer.setPhone(request.phone());
        if (request.dateOfBirth() != null) customer.setDateOfBirth(request.dateOfBirth());
        if (request.address() != null) customer.setAddress(request.address());
        if (request.city() != null) customer.setCity(request.city());
        if (request.postalCode() != null) customer.setPostalCode(request.postalCode());
        if (request.country() != null) customer.setCountry(request.country());
        if (request.preferredLanguage() != null) customer.setPreferredLanguage(request.preferredLanguage());
        customerRepository.save(customer);
        return membership;
    }

    /** Notification channels are per business, so they live on the membership. */
    @Transactional
    public Membership updateOwnPreferences(UUID tenantId, UUID membershipId, PreferencesRequest request) {
        Membership membership = get(tenantId, membershipId);
        if (request.emailNotifications() != null) membership.setEmailNotifications(request.emailNotifications());
        if (request.smsNotifications() != null) membership.setSmsNotifications(request.smsNotifications());
        if (request.pushNotifications() != null) membership.setPushNotifications(request.pushNotifications());
        return membershipRepository.save(membership);
    }

    /**
     * Changes the platform password, which applies to every business the customer belongs to.
     *
     * @throws IllegalArgumentException when the current password does not match or the new one is too short
     */
    @Transactional
    public void changePassword(UUID customerId, String currentPassword, String newPassword) {
        Customer customer = customerRepository.findById(customerId)
                .orElseThrow(() -> new ResourceNotFoundException("Account not found."));
        if (currentPassword == null || !passwordEncoder.matches(currentPassword, customer.getPassword())) {
            throw new IllegalArgumentException("Current password is incorrect.");
        }
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("New password must have at least " + MIN_PASSWORD_LENGTH + " characters.");
        }
        customer.setPassword(passwordEncoder.encode(newPassword));
        customerRepository.save(customer);
        log.info("Password changed for {}", customer.getEmail());
    }

    private Membership createMembership(UUID tenantId, Customer customer, MembershipRole role) {
        Membership membership = new Membership();
        membership.setCustomer(customer);
        membership.setTenant(tenantRepository.findById(tenantId).orElseThrow());
        membership.setRole(role);
        return membershipRepository.save(membership);
    }

    private void checkLimit(UUID tenantId, MembershipRole role, TenantSettings settings) {
        if (role == MembershipRole.CUSTOMER) {
            long customers = membershipRepository.countByTenantIdAndRole(tenantId, MembershipRole.CUSTOMER);
            if (customers >= settings.getMaxCustomers()) {
                throw new IllegalStateException("Customer limit reached (" + settings.getMaxCustomers() + ") for this plan.");
            }
        } else if (TEAM_ROLES.contains(role)) {
            long staff = membershipRepository.countByTenantIdAndRoleIn(tenantId, TEAM_ROLES);
            if (staff >= settings.getMaxStaffUsers()) {
                throw new IllegalStateException("Staff limit reached (" + settings.getMaxStaffUsers() + ") for this plan.");
            }
        }
    }

    private void requireCanAssign(MembershipRole role, MembershipRole actorRole) {
        if (role == MembershipRole.OWNER) {
            throw new ForbiddenOperationException("A business has exactly one owner.");
        }
        if (actorRole == null || !actorRole.canManageCustomers()) {
            throw new ForbiddenOperationException("You are not allowed to manage customers.");
        }
        if (role.isStaffMember() && !actorRole.canManageTeam()) {
            throw new ForbiddenOperationException("Only owners and admins can manage the team.");
        }
    }

    private TenantSettings settings(UUID tenantId) {
        return settingsRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Settings not found for business."));
    }

    private static String orEmpty(String value) {
        return value != null ? value.trim() : "";
    }
}
