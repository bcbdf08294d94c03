package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.dto.TenantDTOs.SettingsRequest;
import com.ayende.backend.dto.TenantDTOs.SettingsResponse;
import com.ayende.backend.dto.TenantDTOs.SignupRequest;
import com.ayende.backend.dto.TenantDTOs.SignupResponse;
import com.ayende.backend.dto.TenantDTOs.TenantProfileRequest;
import com.ayende.backend.dto.TenantDTOs.TenantResponse;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.service.TenantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class TenantController {

    private final TenantService tenantService;

    // Branding and currency for the current subdomain
    @GetMapping("/api/tenant")
    public ResponseEntity<TenantResponse> current() {
        return ResponseEntity.ok(TenantResponse.from(TenantContext.requireCurrentTenant()));
    }

    @PostMapping("/api/public/signup")
    public ResponseEntity<SignupResponse> signup(@RequestBody SignupRequest request) {
        TenantService.Signup signup = tenantService.registerBusiness(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SignupResponse(
                TenantResponse.from(signup.tenant()), signup.owner().getId(), signup.ownerMembership().getId()));
    }

    @GetMapping("/api/staff/tenant/settings")
    public ResponseEntity<SettingsResponse> settings() {
        return ResponseEntity.ok(SettingsResponse.from(tenantService.getSettings(currentTenantId())));
    }

    @PutMapping("/api/staff/tenant")
    public ResponseEntity<TenantResponse> updateProfile(@RequestBody TenantProfileRequest request) {
        requireTeamManager();
        return ResponseEntity.ok(TenantResponse.from(tenantService.updateProfile(currentTenantId(), request)));
    }

    @PutMapping("/api/staff/tenant/settings")
    public ResponseEntity<SettingsResponse> updateSettings(@RequestBody SettingsRequest request) {
        requireTeamManager();
        return ResponseEntity.ok(SettingsResponse.from(tenantService.updateSettings(currentTenantId(), request)));
    }

    private static UUID currentTenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }

    private static void requireTeamManager() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        if (member.role() == null || !member.role().canManageTeam()) {
            throw new ForbiddenOperationException("Only owners and admins can change business settings.");
        }
    }
}
