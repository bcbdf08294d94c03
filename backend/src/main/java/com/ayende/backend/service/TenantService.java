package com.ayende.backend.service;

import com.ayende.backend.core.tenant.SubdomainParser;
import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.domain.enums.SubscriptionStatus;
import com.ayende.backend.dto.TenantDTOs.SettingsRequest;
import com.ayende.backend.dto.TenantDTOs.SignupRequest;
import com.ayende.backend.dto.TenantDTOs.TenantProfileRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.TenantRepository;
import com.ayende.backend.repository.TenantSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {

    public static final int TRIAL_DAYS = 30;

    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9-]+$");

    private final TenantRepository tenantRepository;
    private final TenantSettingsRepository settingsRepository;
    private final CustomerRepository customerRepository;
    private final MembershipRepository membershipRepository;
    private final PasswordEncoder passwordEncoder;
    private final SubdomainParser subdomainParser;

    public record Signup(Tenant tenant, TenantSettings settings, Customer owner, Membership ownerMembership) {}

    /**
     * Creates the business, its settings row and the owner account in one transaction.
     * The business starts on a {@value #TRIAL_DAYS}-day trial.
     */
    @Transactional
    public Signup registerBusiness(SignupRequest request) {
        if (request.businessName() == null || request.businessName().isBlank()) {
            throw new IllegalArgumentException("Business name is required.");
        }
        String slug = request.slug() != null && !request.slug().isBlank()
                ? request.slug().trim().toLowerCase(Locale.ROOT)
                : slugify(request.businessName());

        if (!SLUG_PATTERN.matcher(slug).matches()) {
            throw new IllegalArgumentException("Subdomain may only contain lowercase letters, digits and hyphens.");
        }
        if (subdomainParser.isReserved(slug)) {
            throw new IllegalArgumentException("The subdomain '" + slug + "' is reserved.");
        }
        if (tenantRepository.existsBySlug(slug)) {
            throw new IllegalArgumentException("The subdomain '" + slug + "' is already taken.");
        }

        String ownerEmail = MembershipService.normalizeEmail(request.ownerEmail());
        if (ownerEmail == null || request.ownerPassword() == null || request.ownerPassword().isBlank()) {
            throw new IllegalArgumentException("Owner email and password are required.");
        }
        if (customerRepository.existsByEmail(ownerEmail)) {
            throw new IllegalArgumentException("An account with this email already exists.");
        }

        LocalDateTime now = LocalDateTime.now();
        Tenant tenant = new Tenant();
        tenant.setName(request.businessName().trim());
        tenant.setSlug(slug);
        tenant.setBusinessEmail(request.businessEmail() != null ? request.businessEmail() : ownerEmail);
        tenant.setBusinessPhone(request.businessPhone());
        tenant.setSubscriptionStatus(SubscriptionStatus.TRIAL);
        tenant.setTrialEndsAt(now.plusDays(TRIAL_DAYS));
        tenant.setActive(true);
        tenant = tenantRepository.save(tenant);

        TenantSettings settings = settingsRepository.save(new TenantSettings(tenant));

        Customer owner = new Customer();
        owner.setEmail(ownerEmail);
        owner.setPassword(passwordEncoder.encode(request.ownerPassword()));
        owner.setFirstName(request.ownerFirstName() != null ? request.ownerFirstName() : "");
        owner.setLastName(request.ownerLastName() != null ? request.ownerLastName() : "");
        owner.setEmailVerified(true);
        owner = customerRepository.save(owner);

        Membership membership = new Membership();
        membership.setCustomer(owner);
        membership.setTenant(tenant);
        membership.setRole(MembershipRole.OWNER);
        membership = membershipRepository.save(membership);

        log.info("Business '{}' registered at subdomain '{}' (trial until {})", tenant.getName(), slug, tenant.getTrialEndsAt());
        return new Signup(tenant, settings, owner, membership);
    }

    @Transactional(readOnly = true)
    public Tenant getTenant(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Business not found."));
    }

    @Transactional(readOnly = true)
    public TenantSettings getSettings(UUID tenantId) {
        return settingsRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Settings not found for business."));
    }

    @Transactional(readOnly = true)
    public List<Tenant> listActive() {
        return tenantRepository.findByActiveTrueOrderByNameAsc();
    }

    /** Profile, currency and branding. The slug is not editable. */
    @Transactional
    public Tenant updateProfile(UUID tenantId, TenantProfileRequest request) {
        Tenant tenant = getTenant(tenantId);

        if (request.name() != null && !request.name().isBlank()) tenant.setName(request.name().trim());
        if (request.businessEmail() != null) tenant.setBusinessEmail(request.businessEmail());
        if (request.businessPhone() != null) tenant.setBusinessPhone(request.businessPhone());
        if (request.businessAddress() != null) tenant.setBusinessAddress(request.businessAddress());
        if (request.website() != null) tenant.setWebsite(request.website());
        if (request.description() != null) tenant.setDescription(request.description());
        if (request.currencyCode() != null) tenant.setCurrencyCode(request.currencyCode().toUpperCase(Locale.ROOT));
        if (request.currencySymbol() != null) tenant.setCurrencySymbol(request.currencySymbol());
        if (request.currencyPosition() != null) tenant.setCurrencyPosition(request.currencyPosition());
        if (request.decimalPlaces() != null) {
            if (request.decimalPlaces() < 0 || request.decimalPlaces() > 4) {
                throw new IllegalArgumentException("Decimal places must be between 0 and 4.");
            }
            tenant.setDecimalPlaces(request.decimalPlaces());
        }
        if (request.logoUrl() != null) tenant.setLogoUrl(request.logoUrl());
        if (request.primaryColor() != null) tenant.setPrimaryColor(request.primaryColor());
        if (request.secondaryColor() != null) tenant.setSecondaryColor(request.secondaryColor());

        return tenantRepository.save(tenant);
    }

    @Transactional
    public TenantSettings updateSettings(UUID tenantId, SettingsRequest request) {
        TenantSettings settings = getSettings(tenantId);

        if (request.allowCustomerRegistration() != null) settings.setAllowCustomerRegistration(request.allowCustomerRegistration());
        if (request.requireEmailVerification() != null) settings.setRequireEmailVerification(request.requireEmailVerification());
        if (request.maxCustomers() != null) {
            if (request.maxCustomers() < 0) throw new IllegalArgumentException("Max customers cannot be negative.");
            settings.setMaxCustomers(request.maxCustomers());
        }
        if (request.maxStaffUsers() != null) {
            if (request.maxStaffUsers() < 0) throw new IllegalArgumentException("Max staff users cannot be negative.");
            settings.setMaxStaffUsers(request.maxStaffUsers());
        }
        if (request.loyaltyEnabled() != null) settings.setLoyaltyEnabled(request.loyaltyEnabled());
        if (request.pointsPerCurrencyUnit() != null) {
            if (request.pointsPerCurrencyUnit().compareTo(BigDecimal.ZERO) < 0) {
                throw new IllegalArgumentException("Points per currency unit cannot be negative.");
            }
            settings.setPointsPerCurrencyUnit(request.pointsPerCurrencyUnit());
        }
        if (request.emailNotifications() != null) settings.setEmailNotifications(request.emailNotifications());
        if (request.pushNotifications() != null) settings.setPushNotifications(request.pushNotifications());
        if (request.smsNotifications() != null) settings.setSmsNotifications(request.smsNotifications());
        if (request.businessHours() != null) settings.setBusinessHours(request.businessHours());

        return settingsRepository.save(settings);
    }

    // --- Platform operations ---

    @Transactional
    public Tenant changeSubscriptionStatus(UUID tenantId, SubscriptionStatus status) {
        Tenant tenant = getTenant(tenantId);
        log.info("Business '{}' subscription {} -> {}", tenant.getSlug(), tenant.getSubscriptionStatus(), status);
        tenant.setSubscriptionStatus(status);
        return tenantRepository.save(tenant);
    }

    @Transactional
    public Tenant activateSubscription(UUID tenantId, int months) {
        if (months < 1) {
            throw new IllegalArgumentException("Subscription must run for at least one month.");
        }
        Tenant tenant = getTenant(tenantId);
        tenant.renewSubscription(months, LocalDateTime.now());
        log.info("Business '{}' subscription active until {}", tenant.getSlug(), tenant.getSubscriptionEndsAt());
        return tenantRepository.save(tenant);
    }

    /** Businesses are never deleted; the resolver stops serving them. */
    @Transactional
    public Tenant deactivate(UUID tenantId) {
        Tenant tenant = getTenant(tenantId);
        tenant.setActive(false);
        log.info("Business '{}' deactivated", tenant.getSlug());
        return tenantRepository.save(tenant);
    }

    /** "Joe's Café & Bar" becomes "joes-cafe-bar". */
    public static String slugify(String name) {
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replace("'", "")
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a subdomain from '" + name + "'.");
        }
        return slug;
    }
}
