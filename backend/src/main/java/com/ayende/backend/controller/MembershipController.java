package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.domain.enums.MembershipRole;
import com.ayende.backend.dto.MembershipDTOs.AddMemberRequest;
import com.ayende.backend.dto.MembershipDTOs.MemberResponse;
import com.ayende.backend.dto.MembershipDTOs.RemovalResponse;
import com.ayende.backend.dto.MembershipDTOs.UpdateMemberRequest;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.service.MembershipService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/staff/customers")
@RequiredArgsConstructor
public class MembershipController {

    private final MembershipService membershipService;

    @GetMapping
    public ResponseEntity<List<MemberResponse>> list(@RequestParam(required = false) MembershipRole role) {
        return ResponseEntity.ok(membershipService.list(tenantId(), role).stream().map(MemberResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MemberResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(MemberResponse.from(membershipService.get(tenantId(), id)));
    }

    @PostMapping
    public ResponseEntity<MemberResponse> add(@RequestBody AddMemberRequest request) {
        var membership = membershipService.addMember(tenantId(), request, SecurityUtils.getCurrentMember().role());
        return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(membership));
    }

    @PutMapping("/{id}")
    public ResponseEntity<MemberResponse> update(@PathVariable UUID id, @RequestBody UpdateMemberRequest request) {
        var membership = membershipService.update(tenantId(), id, request, SecurityUtils.getCurrentMember().role());
        return ResponseEntity.ok(MemberResponse.from(membership));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<RemovalResponse> remove(@PathVariable UUID id) {
        requireCustomerManager();
        boolean deleted = membershipService.remove(tenantId(), id);
        return ResponseEntity.ok(new RemovalResponse(id, deleted));
    }

    @PostMapping("/{id}/verify-email")
    public ResponseEntity<MemberResponse> verifyEmail(@PathVariable UUID id) {
        requireCustomerManager();
        return ResponseEntity.ok(MemberResponse.from(membershipService.markEmailVerified(tenantId(), id)));
    }

    private static UUID tenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }

    private static void requireCustomerManager() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        if (member.role() == null || !member.role().canManageCustomers()) {
            throw new ForbiddenOperationException("You are not allowed to manage customers.");
        }
    }
}
