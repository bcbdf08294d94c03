package com.ayende.backend.testsupport;

import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Reward;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.domain.enums.RewardStatus;
import com.ayende.backend.dto.TenantDTOs.SignupRequest;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.RewardRepository;
import com.ayende.backend.service.TenantService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

import java.util.UUID;

/**
 * Shared base for Spring tests: one cached context on the test profile (H2 plus MockMvc) and fixture helpers.
 * Every fixture gets unique slugs and emails, so classes can share the cached context.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class BaseSpringTest {

    protected static final String PASSWORD = "secret-pass-123";

    @Autowired protected TenantService tenantService;
    @Autowired protected CustomerRepository customerRepository;
    @Autowired protected MembershipRepository membershipRepository;
    @Autowired protected RewardRepository rewardRepository;
    @Autowired protected PasswordEncoder passwordEncoder;

    protected static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected TenantService.Signup newBusiness(String prefix) {
        String slug = unique(prefix);
        return tenantService.registerBusiness(new SignupRequest(
                prefix + " business", slug, null, null,
                "owner@" + slug + ".test", PASSWORD, "Owner", prefix));
    }

    protected Customer newCustomer(String prefix) {
        Customer customer = new Customer();
        customer.setEmail(unique(prefix) + "@example.com");
        customer.setPassword(passwordEncoder.encode(PASSWORD));
        customer.setFirstName(prefix);
        customer.setLastName("Tester");
        customer.setEmailVerified(true);
        return customerRepository.save(customer);
    }

    protected Membership join(Customer customer, Tenant tenant, int points, boolean vip) {
        Membership membership = new Membership();
        membership.setCustomer(customer);
        membership.setTenant(tenant);
        membership.setRole(MembershipRole.CUSTOMER);
        membership.setLoyaltyPoints(points);
        membership.setVip(vip);
        return membershipRepository.save(membership);
    }

    protected Membership newMember(Tenant tenant, int points) {
        return join(newCustomer("member"), tenant, points, false);
    }

    protected Reward newReward(Tenant tenant, String name, int cost, Integer stock, int limitPerCustomer) {
        Reward reward = new Reward();
        reward.setTenant(tenant);
        reward.setName(name);
        reward.setPointsRequired(cost);
        reward.setHasStockLimit(stock != null);
        reward.setTotalStock(stock != null ? stock : 0);
        reward.setLimitPerCustomer(limitPerCustomer);
        reward.setStatus(RewardStatus.ACTIVE);
        return rewardRepository.save(reward);
    }

    protected int pointsOf(Membership membership) {
        return membershipRepository.findById(membership.getId()).orElseThrow().getLoyaltyPoints();
    }
}
