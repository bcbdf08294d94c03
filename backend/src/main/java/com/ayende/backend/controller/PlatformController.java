package com.ayende.backend.controller;

import com.ayende.backend.dto.TenantDTOs.SubscriptionRequest;
import com.ayende.backend.dto.TenantDTOs.TenantResponse;
import com.ayende.backend.service.TenantService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/** Platform operators only (see SecurityConfig). */
@RestController
@RequestMapping("/api/platform/tenants")
@RequiredArgsConstructor
public class PlatformController {

    private final TenantService tenantService;

    @GetMapping
    public ResponseEntity<List<TenantResponse>> list() {
        return ResponseEntity.ok(tenantService.listActive().stream().map(TenantResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<TenantResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(TenantResponse.from(tenantService.getTenant(id)));
    }

    /** With {@code months} the paid period is extended, otherwise only the status label changes. */
    @PutMapping("/{id}/subscription")
    public ResponseEntity<TenantResponse> subscription(@PathVariable UUID id, @RequestBody SubscriptionRequest request) {
        if (request.months() != null) {
            return ResponseEntity.ok(TenantResponse.from(tenantService.activateSubscription(id, request.months())));
        }
        if (request.status() == null) {
            throw new IllegalArgumentException("Either status or months is required.");
        }
        return ResponseEntity.ok(TenantResponse.from(tenantService.changeSubscriptionStatus(id, request.status())));
    }

    @PostMapping("/{id}/deactivate")
    public ResponseEntity<TenantResponse> deactivate(@PathVariable UUID id) {
        return ResponseEntity.ok(TenantResponse.from(tenantService.deactivate(id)));
    }
}
