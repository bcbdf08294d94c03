package com.ayende.backend.controller;

import com.ayende.backend.domain.Customer;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.repository.TenantRepository;
import com.ayende.backend.service.TenantService;
import com.ayende.backend.testsupport.BaseSpringTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TenantIsolationTest extends BaseSpringTest {

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;
    @Autowired TenantRepository tenantRepository;

    private Tenant simifood;
    private Tenant othershop;
    private TenantService.Signup simifoodSignup;
    private Customer alice;

    @BeforeEach
    void setUp() {
        simifoodSignup = newBusiness("simifood");
        simifood = simifoodSignup.tenant();
        othershop = newBusiness("othershop").tenant();
        alice = newCustomer("alice");
        join(alice, simifood, 25, false);
    }

    @Test
    void unknown_subdomain_is_not_found() throws Exception {
        mockMvc.perform(get("/api/tenant").header("Host", "ghostbiz.example.com"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TENANT_NOT_FOUND"))
                .andExpect(jsonPath("$.details.subdomain").value("ghostbiz"));
    }

    @Test
    void known_subdomain_exposes_public_profile() throws Exception {
        mockMvc.perform(get("/api/tenant").header("Host", host(simifood)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slug").value(simifood.getSlug()));
    }

    @Test
    void expired_trial_requires_subscription() throws Exception {
        Tenant expired = newBusiness("expired").tenant();
        expired.setTrialEndsAt(LocalDateTime.now().minusDays(1));
        tenantRepository.save(expired);

        mockMvc.perform(get("/api/tenant").header("Host", host(expired)))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("SUBSCRIPTION_REQUIRED"));
    }

    @Test
    void token_only_works_on_the_business_that_issued_it() throws Exception {
        String token = login(simifood, alice.getEmail());

        mockMvc.perform(get("/api/rewards").header("Host", host(simifood)).header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/rewards").header("Host", host(othershop)).header("Authorization", "Bearer " + token))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void login_to_business_without_membership_is_forbidden() throws Exception {
        mockMvc.perform(post("/api/auth/login").header("Host", host(othershop))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", alice.getEmail(), "password", PASSWORD))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NO_TENANT_ACCESS"));
    }

    @Test
    void wrong_password_is_unauthorized() throws Exception {
        mockMvc.perform(post("/api/auth/login").header("Host", host(simifood))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", alice.getEmail(), "password", "nope"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"));
    }

    @Test
    void customers_cannot_reach_staff_endpoints() throws Exception {
        String token = login(simifood, alice.getEmail());

        mockMvc.perform(get("/api/staff/customers").header("Host", host(simifood)).header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden());
    }

    @Test
    void staff_list_only_their_own_customers() throws Exception {
        join(newCustomer("bob"), othershop, 0, false);
        String token = login(simifood, simifoodSignup.owner().getEmail());

        mockMvc.perform(get("/api/staff/customers").param("role", "CUSTOMER")
                        .header("Host", host(simifood)).header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].email").value(alice.getEmail()));
    }

    @Test
    void denied_redemption_reports_shortfall() throws Exception {
        var reward = newReward(simifood, "Free lunch", 100, null, 0);
        String token = login(simifood, alice.getEmail());

        mockMvc.perform(post("/api/redemptions").header("Host", host(simifood)).header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("rewardId", reward.getId().toString()))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_POINTS"))
                .andExpect(jsonPath("$.details.shortfall").value(75));
    }

    @Test
    void platform_endpoints_need_a_platform_admin() throws Exception {
        mockMvc.perform(get("/api/platform/tenants"))
                .andExpect(status().isUnauthorized());
    }

    private String login(Tenant tenant, String email) throws Exception {
        String body = mockMvc.perform(post("/api/auth/login").header("Host", host(tenant))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", email, "password", PASSWORD))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = objectMapper.readTree(body);
        return json.get("token").asText();
    }

    private static String host(Tenant tenant) {
        return tenant.getSlug() + ".localhost:8080";
    }
}
