package com.ayende.backend.service;

import com.ayende.backend.core.security.AuthFailure;
import com.ayende.backend.core.security.AuthResult;
import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.TenantSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TenantAwareAuthenticatorTest {

    private static final String PASSWORD = "correct-horse";

    private final PasswordEncoder encoder = new BCryptPasswordEncoder(4);

    private CustomerRepository customerRepository;
    private MembershipRepository membershipRepository;
    private TenantSettingsRepository settingsRepository;
    private TokenService tokenService;
    private TenantAwareAuthenticator authenticator;

    private Tenant simifood;
    private Tenant othershop;
    private Customer alice;

    @BeforeEach
    void setUp() {
        customerRepository = Mockito.mock(CustomerRepository.class);
        membershipRepository = Mockito.mock(MembershipRepository.class);
        settingsRepository = Mockito.mock(TenantSettingsRepository.class);
        tokenService = Mockito.mock(TokenService.class);
        when(tokenService.generateToken(any())).thenReturn("signed-token");
        authenticator = new TenantAwareAuthenticator(customerRepository, membershipRepository, settingsRepository, encoder, tokenService);

        simifood = tenant("simifood");
        othershop = tenant("othershop");

        alice = new Customer();
        alice.setId(UUID.randomUUID());
        alice.setEmail("alice@example.com");
        alice.setPassword(encoder.encode(PASSWORD));
        alice.setFirstName("Alice");
        alice.setLastName("Martin");
        alice.setEmailVerified(true);
        when(customerRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice));

        when(settingsRepository.findByTenantId(any())).thenReturn(Optional.empty());
    }

    @Test
    void member_signs_in_to_own_business() {
        Membership membership = membership(alice, simifood, MembershipRole.CUSTOMER);
        when(membershipRepository.findByCustomerIdAndTenantId(alice.getId(), simifood.getId())).thenReturn(Optional.of(membership));

        AuthResult result = authenticator.authenticate(simifood, "  Alice@Example.com ", PASSWORD);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.token()).isEqualTo("signed-token");
        AuthenticatedMember member = result.member();
        assertThat(member.tenantId()).isEqualTo(simifood.getId());
        assertThat(member.membershipId()).isEqualTo(membership.getId());
        assertThat(member.role()).isEqualTo(MembershipRole.CUSTOMER);
        verify(customerRepository).updateLastLogin(eq(alice.getId()), any(LocalDateTime.class));
    }

    @Test
    void valid_credentials_without_membership_are_refused() {
        when(membershipRepository.findByCustomerIdAndTenantId(alice.getId(), othershop.getId())).thenReturn(Optional.empty());

        AuthResult result = authenticator.authenticate(othershop, "alice@example.com", PASSWORD);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.failure()).isEqualTo(AuthFailure.NO_TENANT_ACCESS);
        verify(tokenService, never()).generateToken(any());
        verify(customerRepository, never()).updateLastLogin(any(), any());
    }

    @Test
    void inactive_membership_is_refused() {
        Membership membership = membership(alice, simifood, MembershipRole.CUSTOMER);
        membership.setActive(false);
        when(membershipRepository.findByCustomerIdAndTenantId(alice.getId(), simifood.getId())).thenReturn(Optional.of(membership));

        assertThat(authenticator.authenticate(simifood, "alice@example.com", PASSWORD).failure())
                .isEqualTo(AuthFailure.NO_TENANT_ACCESS);
    }

    @Test
    void unknown_email_and_wrong_password_look_the_same() {
        AuthResult unknown = authenticator.authenticate(simifood, "nobody@example.com", PASSWORD);
        AuthResult wrong = authenticator.authenticate(simifood, "alice@example.com", "wrong-password");

        assertThat(unknown.failure()).isEqualTo(AuthFailure.INVALID_CREDENTIALS);
        assertThat(wrong.failure()).isEqualTo(AuthFailure.INVALID_CREDENTIALS);
        verify(membershipRepository, never()).findByCustomerIdAndTenantId(any(), any());
    }

    @Test
    void deactivated_account_is_refused_before_membership_check() {
        alice.setActive(false);

        assertThat(authenticator.authenticate(simifood, "alice@example.com", PASSWORD).failure())
                .isEqualTo(AuthFailure.ACCOUNT_INACTIVE);
        verify(membershipRepository, never()).findByCustomerIdAndTenantId(any(), any());
    }

    @Test
    void unverified_email_is_refused_when_business_requires_it() {
        alice.setEmailVerified(false);
        when(membershipRepository.findByCustomerIdAndTenantId(alice.getId(), simifood.getId()))
                .thenReturn(Optional.of(membership(alice, simifood, MembershipRole.CUSTOMER)));
        TenantSettings settings = new TenantSettings(simifood);
        settings.setRequireEmailVerification(true);
        when(settingsRepository.findByTenantId(simifood.getId())).thenReturn(Optional.of(settings));

        assertThat(authenticator.authenticate(simifood, "alice@example.com", PASSWORD).failure())
                .isEqualTo(AuthFailure.EMAIL_NOT_VERIFIED);
    }

    @Test
    void platform_host_admits_superusers_only() {
        assertThat(authenticator.authenticate(null, "alice@example.com", PASSWORD).failure())
                .isEqualTo(AuthFailure.NO_TENANT_CONTEXT);

        alice.setSuperuser(true);
        AuthResult result = authenticator.authenticate(null, "alice@example.com", PASSWORD);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.member().tenantId()).isNull();
        assertThat(result.member().superuser()).isTrue();
    }

    private static Tenant tenant(String slug) {
        Tenant tenant = new Tenant();
        tenant.setId(UUID.randomUUID());
        tenant.setName(slug);
        tenant.setSlug(slug);
        return tenant;
    }

    private static Membership membership(Customer customer, Tenant tenant, MembershipRole role) {
        Membership membership = new Membership();
        membership.setId(UUID.randomUUID());
        membership.setCustomer(customer);
        membership.setTenant(tenant);
        membership.setRole(role);
        return membership;
    }
}
