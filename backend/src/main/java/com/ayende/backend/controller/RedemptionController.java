package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.domain.Redemption;
import com.ayende.backend.domain.enums.RedemptionStatus;
import com.ayende.backend.dto.RewardDTOs.CancelRequest;
import com.ayende.backend.dto.RewardDTOs.RedeemRequest;
import com.ayende.backend.dto.RewardDTOs.RedemptionResponse;
import com.ayende.backend.dto.RewardDTOs.RejectRequest;
import com.ayende.backend.dto.RewardDTOs.UseRequest;
import com.ayende.backend.exception.ResourceNotFoundException;
import com.ayende.backend.service.RedemptionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class RedemptionController {

    private final RedemptionService redemptionService;

    // --- Customer ---

    @PostMapping("/api/redemptions")
    public ResponseEntity<?> redeem(@RequestBody RedeemRequest request) {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        return ApiResponses.of(
                redemptionService.redeem(tenantId(), member.membershipId(), request.rewardId(), request.customerNote()),
                RedemptionResponse::from);
    }

    @GetMapping("/api/redemptions/mine")
    public ResponseEntity<List<RedemptionResponse>> mine() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        return ResponseEntity.ok(redemptionService.listForMembership(tenantId(), member.membershipId()).stream()
                .map(RedemptionResponse::from).toList());
    }

    // Customers can take back their own redemption, always with a refund
    @PostMapping("/api/redemptions/{id}/cancel")
    public ResponseEntity<?> cancelOwn(@PathVariable UUID id) {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        Redemption redemption = redemptionService.get(tenantId(), id);
        if (!redemption.getMembership().getId().equals(member.membershipId())) {
            throw new ResourceNotFoundException("Redemption not found.");
        }
        return ApiResponses.of(redemptionService.cancel(tenantId(), id, true), RedemptionResponse::from);
    }

    // --- Staff ---

    @GetMapping("/api/staff/redemptions")
    public ResponseEntity<List<RedemptionResponse>> list(@RequestParam(required = false) RedemptionStatus status) {
        return ResponseEntity.ok(redemptionService.listForTenant(tenantId(), status).stream().map(RedemptionResponse::from).toList());
    }

    @GetMapping("/api/staff/redemptions/code/{code}")
    public ResponseEntity<RedemptionResponse> byCode(@PathVariable String code) {
        return ResponseEntity.ok(RedemptionResponse.from(redemptionService.findByCode(tenantId(), code)));
    }

    @PostMapping("/api/staff/redemptions/{id}/approve")
    public ResponseEntity<?> approve(@PathVariable UUID id) {
        return ApiResponses.of(redemptionService.approve(tenantId(), id, staffId()), RedemptionResponse::from);
    }

    @PostMapping("/api/staff/redemptions/{id}/use")
    public ResponseEntity<?> use(@PathVariable UUID id, @RequestBody(required = false) UseRequest request) {
        String code = request != null ? request.transactionCode() : null;
        String note = request != null ? request.staffNote() : null;
        return ApiResponses.of(redemptionService.use(tenantId(), id, staffId(), code, note), RedemptionResponse::from);
    }

    @PostMapping("/api/staff/redemptions/{id}/cancel")
    public ResponseEntity<?> cancel(@PathVariable UUID id, @RequestBody(required = false) CancelRequest request) {
        boolean refund = request == null || request.refundPoints() == null || request.refundPoints();
        return ApiResponses.of(redemptionService.cancel(tenantId(), id, refund), RedemptionResponse::from);
    }

    @PostMapping("/api/staff/redemptions/{id}/reject")
    public ResponseEntity<?> reject(@PathVariable UUID id, @RequestBody RejectRequest request) {
        boolean refund = request.refundPoints() == null || request.refundPoints();
        return ApiResponses.of(redemptionService.reject(tenantId(), id, request.reason(), refund, staffId()), RedemptionResponse::from);
    }

    private static UUID tenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }

    private static UUID staffId() {
        return SecurityUtils.getCurrentMember().customerId();
    }
}
