package com.ayende.backend.service;

import com.ayende.backend.core.security.AuthFailure;
import com.ayende.backend.core.security.AuthResult;
import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.TenantSettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Checks a global credential against the business the request was resolved to.
 *
 * <p>The failure reasons are checked in a fixed order: credentials, account state, then
 * access to the business. An unknown email and a wrong password produce the same answer, and
 * the unknown-email path still pays for one BCrypt comparison so response times do not reveal
 * which emails are registered.
 */
@Slf4j
@Service
public class TenantAwareAuthenticator {

    private final CustomerRepository customerRepository;
    private final MembershipRepository membershipRepository;
    private final TenantSettingsRepository settingsRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final String dummyHash;

    public TenantAwareAuthenticator(CustomerRepository customerRepository,
                                    MembershipRepository membershipRepository,
                                    TenantSettingsRepository settingsRepository,
                                    PasswordEncoder passwordEncoder,
                                    TokenService tokenService) {
        this.customerRepository = customerRepository;
        this.membershipRepository = membershipRepository;
        this.settingsRepository = settingsRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.dummyHash = passwordEncoder.encode("not-a-real-password");
    }

    /**
     * @param tenant business resolved for the request, or {@code null} on the platform host
     */
    @Transactional
    public AuthResult authenticate(Tenant tenant, String email, String password) {
        String normalized = MembershipService.normalizeEmail(email);
        String raw = password != null ? password : "";

        Optional<Customer> found = normalized != null ? customerRepository.findByEmail(normalized) : Optional.empty();
        if (found.isEmpty()) {
            passwordEncoder.matches(raw, dummyHash);
            log.debug("Login failed: unknown email");
            return AuthResult.failure(AuthFailure.INVALID_CREDENTIALS);
        }

        Customer customer = found.get();
        if (!passwordEncoder.matches(raw, customer.getPassword())) {
            log.debug("Login failed: wrong password for customer {}", customer.getId());
            return AuthResult.failure(AuthFailure.INVALID_CREDENTIALS);
        }
        if (!customer.isActive()) {
            return AuthResult.failure(AuthFailure.ACCOUNT_INACTIVE);
        }

        AuthenticatedMember member;
        if (tenant != null) {
            Optional<Membership> membership = membershipRepository.findByCustomerIdAndTenantId(customer.getId(), tenant.getId());
            if (membership.isEmpty() || !membership.get().isActive()) {
                log.warn("Customer {} has no active membership in business '{}'", customer.getId(), tenant.getSlug());
                return AuthResult.failure(AuthFailure.NO_TENANT_ACCESS);
            }
            boolean verificationRequired = settingsRepository.findByTenantId(tenant.getId())
                    .map(TenantSettings::isRequireEmailVerification)
                    .orElse(false);
            if (verificationRequired && !customer.isEmailVerified()) {
                return AuthResult.failure(AuthFailure.EMAIL_NOT_VERIFIED);
            }
            Membership m = membership.get();
            member = new AuthenticatedMember(customer.getId(), customer.getEmail(), customer.getFullName(),
                    tenant.getId(), m.getId(), m.getRole(), customer.isSuperuser());
        } else {
            if (!customer.isSuperuser()) {
                log.warn("Customer {} tried to sign in without a business subdomain", customer.getId());
                return AuthResult.failure(AuthFailure.NO_TENANT_CONTEXT);
            }
            member = new AuthenticatedMember(customer.getId(), customer.getEmail(), customer.getFullName(),
                    null, null, null, true);
        }

        customerRepository.updateLastLogin(customer.getId(), LocalDateTime.now());
        log.info("Customer {} signed in{}", customer.getId(), tenant != null ? " to '" + tenant.getSlug() + "'" : " to the platform");
        return AuthResult.success(member, tokenService.generateToken(member));
    }
}
