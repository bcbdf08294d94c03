package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.domain.LedgerTransaction;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.dto.LedgerDTOs.RecalculationResponse;
import com.ayende.backend.dto.LedgerDTOs.RefundRequest;
import com.ayende.backend.dto.LedgerDTOs.TransactionRequest;
import com.ayende.backend.dto.LedgerDTOs.TransactionResponse;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.service.CurrencyFormatter;
import com.ayende.backend.service.LedgerService;
import com.ayende.backend.service.StatsRecalculationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class TransactionController {

    private final LedgerService ledgerService;
    private final StatsRecalculationService statsRecalculationService;
    private final CurrencyFormatter currencyFormatter;

    // --- Staff ---

    @PostMapping("/api/staff/transactions")
    public ResponseEntity<?> record(@RequestBody TransactionRequest request) {
        AuthenticatedMember staff = SecurityUtils.getCurrentMember();
        return ApiResponses.of(ledgerService.recordTransaction(tenant().getId(), request, staff.customerId()), this::toResponse);
    }

    @GetMapping("/api/staff/transactions")
    public ResponseEntity<List<TransactionResponse>> list() {
        return ResponseEntity.ok(ledgerService.listForTenant(tenant().getId()).stream().map(this::toResponse).toList());
    }

    @GetMapping("/api/staff/transactions/{code}")
    public ResponseEntity<TransactionResponse> get(@PathVariable String code) {
        return ResponseEntity.ok(toResponse(ledgerService.find(tenant().getId(), code)));
    }

    @GetMapping("/api/staff/customers/{membershipId}/transactions")
    public ResponseEntity<List<TransactionResponse>> forCustomer(@PathVariable UUID membershipId) {
        return ResponseEntity.ok(ledgerService.listForMembership(tenant().getId(), membershipId).stream().map(this::toResponse).toList());
    }

    @PostMapping("/api/staff/transactions/{code}/complete")
    public ResponseEntity<?> complete(@PathVariable String code) {
        return ApiResponses.of(ledgerService.completeTransaction(tenant().getId(), code), this::toResponse);
    }

    @PostMapping("/api/staff/transactions/{code}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String code) {
        return ApiResponses.of(ledgerService.cancelTransaction(tenant().getId(), code), this::toResponse);
    }

    @PostMapping("/api/staff/transactions/{code}/refund")
    public ResponseEntity<?> refund(@PathVariable String code, @RequestBody(required = false) RefundRequest request) {
        AuthenticatedMember staff = SecurityUtils.getCurrentMember();
        String reason = request != null ? request.reason() : null;
        return ApiResponses.of(ledgerService.refundTransaction(tenant().getId(), code, reason, staff.customerId()), this::toResponse);
    }

    @PostMapping("/api/staff/transactions/recalculate")
    public ResponseEntity<RecalculationResponse> recalculate() {
        AuthenticatedMember staff = SecurityUtils.getCurrentMember();
        if (staff.role() == null || !staff.role().canManageTeam()) {
            throw new ForbiddenOperationException("Only owners and admins can recalculate statistics.");
        }
        return ResponseEntity.ok(new RecalculationResponse(statsRecalculationService.recalculateStats(tenant().getId())));
    }

    // --- Customer ---

    @GetMapping("/api/transactions/mine")
    public ResponseEntity<List<TransactionResponse>> mine() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        return ResponseEntity.ok(ledgerService.listForMembership(tenant().getId(), member.membershipId()).stream().map(this::toResponse).toList());
    }

    private TransactionResponse toResponse(LedgerTransaction txn) {
        return TransactionResponse.from(txn, currencyFormatter.format(txn.getTenant(), txn.getTotal()));
    }

    private static Tenant tenant() {
        return TenantContext.requireCurrentTenant();
    }
}
