package com.ayende.backend.service;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.TenantSettings;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.dto.AuthDTOs.RegisterRequest;
import com.ayende.backend.dto.LedgerDTOs.TransactionRequest;
import com.ayende.backend.dto.MembershipDTOs.AddMemberRequest;
import com.ayende.backend.dto.MembershipDTOs.PreferencesRequest;
import com.ayende.backend.dto.MembershipDTOs.ProfileRequest;
import com.ayende.backend.dto.MembershipDTOs.UpdateMemberRequest;
import com.ayende.backend.dto.TenantDTOs.SignupRequest;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.repository.TenantSettingsRepository;
import com.ayende.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MembershipServiceTest extends BaseSpringTest {

    @Autowired MembershipService membershipService;
    @Autowired LedgerService ledgerService;
    @Autowired TenantSettingsRepository settingsRepository;

    private TenantService.Signup signup;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        signup = newBusiness("members");
        tenant = signup.tenant();
    }

    @Test
    void signup_creates_owner_on_trial() {
        assertThat(signup.ownerMembership().getRole()).isEqualTo(MembershipRole.OWNER);
        assertThat(signup.owner().isEmailVerified()).isTrue();
        assertThat(tenant.getTrialEndsAt()).isAfter(tenant.getCreatedAt().plusDays(TenantService.TRIAL_DAYS - 1));
        assertThat(signup.settings().isLoyaltyEnabled()).isTrue();
    }

    @Test
    void existing_account_joins_a_second_business_with_its_password() {
        String email = unique("shared") + "@example.com";
        membershipService.registerCustomer(tenant.getId(), new RegisterRequest(email, PASSWORD, "Sam", "Shared", null));
        Tenant second = newBusiness("members-two").tenant();

        assertThatThrownBy(() -> membershipService.registerCustomer(second.getId(),
                new RegisterRequest(email, "other-password", "Sam", "Shared", null)))
                .isInstanceOf(IllegalArgumentException.class);

        Membership joined = membershipService.registerCustomer(second.getId(), new RegisterRequest(email, PASSWORD, "Sam", "Shared", null));
        assertThat(joined.getTenant().getId()).isEqualTo(second.getId());
        assertThat(customerRepository.findByEmail(email)).isPresent();
    }

    @Test
    void registration_can_be_closed_by_the_business() {
        TenantSettings settings = settingsRepository.findByTenantId(tenant.getId()).orElseThrow();
        settings.setAllowCustomerRegistration(false);
        settingsRepository.save(settings);

        assertThatThrownBy(() -> membershipService.registerCustomer(tenant.getId(),
                new RegisterRequest(unique("closed") + "@example.com", PASSWORD, "No", "Entry", null)))
                .isInstanceOf(ForbiddenOperationException.class);
    }

    @Test
    void customer_limit_is_enforced() {
        TenantSettings settings = settingsRepository.findByTenantId(tenant.getId()).orElseThrow();
        settings.setMaxCustomers(1);
        settingsRepository.save(settings);
        membershipService.registerCustomer(tenant.getId(), new RegisterRequest(unique("first") + "@example.com", PASSWORD, "A", "B", null));

        assertThatThrownBy(() -> membershipService.registerCustomer(tenant.getId(),
                new RegisterRequest(unique("second") + "@example.com", PASSWORD, "C", "D", null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void only_owners_and_admins_add_team_members() {
        AddMemberRequest cashier = new AddMemberRequest(unique("cashier") + "@example.com", "Cash", "Ier", null, null, MembershipRole.STAFF);

        assertThatThrownBy(() -> membershipService.addMember(tenant.getId(), cashier, MembershipRole.MANAGER))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThat(membershipService.addMember(tenant.getId(), cashier, MembershipRole.OWNER).getRole())
                .isEqualTo(MembershipRole.STAFF);
        assertThatThrownBy(() -> membershipService.addMember(tenant.getId(),
                new AddMemberRequest(unique("boss") + "@example.com", null, null, null, null, MembershipRole.OWNER), MembershipRole.OWNER))
                .isInstanceOf(ForbiddenOperationException.class);
    }

    @Test
    void owner_cannot_be_demoted_or_removed() {
        Membership owner = signup.ownerMembership();

        assertThatThrownBy(() -> membershipService.update(tenant.getId(), owner.getId(),
                new UpdateMemberRequest(null, null, MembershipRole.CUSTOMER, null, null, null, null, null), MembershipRole.OWNER))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThatThrownBy(() -> membershipService.remove(tenant.getId(), owner.getId()))
                .isInstanceOf(ForbiddenOperationException.class);
    }

    @Test
    void removal_keeps_members_with_history() {
        Membership quiet = newMember(tenant, 0);
        Membership buyer = newMember(tenant, 0);
        ledgerService.recordTransaction(tenant.getId(), TransactionRequest.purchase(buyer.getId(), new BigDecimal("12.00"), null), null);

        assertThat(membershipService.remove(tenant.getId(), quiet.getId())).isTrue();
        assertThat(membershipRepository.findById(quiet.getId())).isEmpty();
        assertThat(customerRepository.findById(quiet.getCustomer().getId())).isPresent();

        assertThat(membershipService.remove(tenant.getId(), buyer.getId())).isFalse();
        assertThat(membershipRepository.findById(buyer.getId()).orElseThrow().isActive()).isFalse();
    }

    @Test
    void staff_updates_do_not_touch_loyalty_aggregates() {
        Membership member = newMember(tenant, 80);

        membershipService.update(tenant.getId(), member.getId(),
                new UpdateMemberRequest(true, null, null, "likes espresso", List.of("regular"), null, null, null),
                MembershipRole.MANAGER);

        Membership after = membershipRepository.findById(member.getId()).orElseThrow();
        assertThat(after.isVip()).isTrue();
        assertThat(after.getTags()).containsExactly("regular");
        assertThat(after.getLoyaltyPoints()).isEqualTo(80);
    }

    @Test
    void member_edits_own_profile_without_touching_points() {
        Membership member = newMember(tenant, 40);

        membershipService.updateOwnProfile(tenant.getId(), member.getId(), new ProfileRequest(
                " Robin ", null, "555-0101", LocalDate.of(1990, 4, 2), null, "Montreal", null, null, "fr"));

        var customer = customerRepository.findById(member.getCustomer().getId()).orElseThrow();
        assertThat(customer.getFirstName()).isEqualTo("Robin");
        assertThat(customer.getLastName()).isEqualTo("Tester");
        assertThat(customer.getPhone()).isEqualTo("555-0101");
        assertThat(customer.getCity()).isEqualTo("Montreal");
        assertThat(customer.getPreferredLanguage()).isEqualTo("fr");
        assertThat(pointsOf(member)).isEqualTo(40);
    }

    @Test
    void preferences_are_kept_per_business() {
        Membership here = newMember(tenant, 0);
        Tenant other = newBusiness("members-prefs").tenant();
        Membership there = join(here.getCustomer(), other, 0, false);

        membershipService.updateOwnPreferences(tenant.getId(), here.getId(), new PreferencesRequest(false, true, null));

        Membership updated = membershipRepository.findById(here.getId()).orElseThrow();
        assertThat(updated.isEmailNotifications()).isFalse();
        assertThat(updated.isSmsNotifications()).isTrue();
        assertThat(updated.isPushNotifications()).isTrue();
        assertThat(membershipRepository.findById(there.getId()).orElseThrow().isEmailNotifications()).isTrue();
    }

    @Test
    void password_change_requires_the_current_password() {
        Membership member = newMember(tenant, 0);
        var customerId = member.getCustomer().getId();

        assertThatThrownBy(() -> membershipService.changePassword(customerId, "not-my-password", "brand-new-pass"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("incorrect");
        assertThatThrownBy(() -> membershipService.changePassword(customerId, PASSWORD, "short"))
                .isInstanceOf(IllegalArgumentException.class);

        membershipService.changePassword(customerId, PASSWORD, "brand-new-pass");

        String stored = customerRepository.findById(customerId).orElseThrow().getPassword();
        assertThat(passwordEncoder.matches("brand-new-pass", stored)).isTrue();
        assertThat(passwordEncoder.matches(PASSWORD, stored)).isFalse();
    }

    @Test
    void signup_refuses_subdomains_that_cannot_be_served() {
        for (String slug : List.of("www", "localhost", "2024")) {
            assertThatThrownBy(() -> tenantService.registerBusiness(new SignupRequest(
                    "Reserved", slug, null, null, unique("owner") + "@example.com", PASSWORD, "Owner", "Reserved")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("reserved");
        }
    }
}
