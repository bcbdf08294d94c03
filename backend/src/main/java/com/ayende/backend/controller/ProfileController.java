package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.dto.MembershipDTOs.ChangePasswordRequest;
import com.ayende.backend.dto.MembershipDTOs.PreferencesRequest;
import com.ayende.backend.dto.MembershipDTOs.ProfileRequest;
import com.ayende.backend.dto.MembershipDTOs.ProfileResponse;
import com.ayende.backend.exception.TenantRequiredException;
import com.ayende.backend.service.MembershipService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

// The signed-in member's own account, inside the business of the current subdomain
@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class ProfileController {

    private final MembershipService membershipService;

    @GetMapping
    public ResponseEntity<ProfileResponse> get() {
        return ResponseEntity.ok(ProfileResponse.from(membershipService.get(tenantId(), membershipId())));
    }

    @PutMapping
    public ResponseEntity<ProfileResponse> update(@RequestBody ProfileRequest request) {
        return ResponseEntity.ok(ProfileResponse.from(membershipService.updateOwnProfile(tenantId(), membershipId(), request)));
    }

    @PutMapping("/preferences")
    public ResponseEntity<ProfileResponse> preferences(@RequestBody PreferencesRequest request) {
        return ResponseEntity.ok(ProfileResponse.from(membershipService.updateOwnPreferences(tenantId(), membershipId(), request)));
    }

    @PatchMapping("/password")
    public ResponseEntity<Map<String, String>> changePassword(@RequestBody ChangePasswordRequest request) {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        membershipService.changePassword(member.customerId(), request.currentPassword(), request.newPassword());
        return ResponseEntity.ok(Map.of("message", "Password changed."));
    }

    private static UUID tenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }

    private static UUID membershipId() {
        UUID membershipId = SecurityUtils.getCurrentMember().membershipId();
        if (membershipId == null) {
            throw new TenantRequiredException("Profiles are managed from a business subdomain.");
        }
        return membershipId;
    }
}
