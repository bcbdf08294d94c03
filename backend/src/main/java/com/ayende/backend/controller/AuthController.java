package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthResult;
import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.dto.ApiError;
import com.ayende.backend.dto.AuthDTOs.LoginRequest;
import com.ayende.backend.dto.AuthDTOs.LoginResponse;
import com.ayende.backend.dto.AuthDTOs.RegisterRequest;
import com.ayende.backend.dto.MembershipDTOs.MemberResponse;
import com.ayende.backend.service.MembershipService;
import com.ayende.backend.service.TenantAwareAuthenticator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final TenantAwareAuthenticator authenticator;
    private final MembershipService membershipService;

    // Signs in to the business of the current subdomain, or to the platform on the bare host
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody LoginRequest request) {
        Tenant tenant = TenantContext.getCurrentTenant();
        AuthResult result = authenticator.authenticate(tenant, request.email(), request.password());

        if (!result.isSuccess()) {
            return ResponseEntity.status(result.failure().status())
                    .body(new ApiError(result.failure().name(), result.failure().message()));
        }

        AuthenticatedMember member = result.member();
        return ResponseEntity.ok(new LoginResponse(
            result.token(),
            member.customerId(),
            member.fullName(),
            member.email(),
            member.tenantId(),
            member.membershipId(),
            member.role()
        ));
    }

    @PostMapping("/register")
    public ResponseEntity<MemberResponse> register(@RequestBody RegisterRequest request) {
        Tenant tenant = TenantContext.requireCurrentTenant();
        var membership = membershipService.registerCustomer(tenant.getId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(membership));
    }

    @GetMapping("/me")
    public ResponseEntity<?> me() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        if (member.tenantId() == null) {
            return ResponseEntity.ok(member);
        }
        return ResponseEntity.ok(MemberResponse.from(membershipService.get(member.tenantId(), member.membershipId())));
    }
}
