package com.ayende.backend.controller;

import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.dto.RewardDTOs.RewardRemovalResponse;
import com.ayende.backend.dto.RewardDTOs.RewardRequest;
import com.ayende.backend.dto.RewardDTOs.RewardResponse;
import com.ayende.backend.dto.RewardDTOs.StatusRequest;
import com.ayende.backend.service.RewardService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class RewardController {

    private final RewardService rewardService;

    @GetMapping("/api/rewards")
    public ResponseEntity<List<RewardResponse>> available() {
        return ResponseEntity.ok(rewardService.listAvailable(tenantId(), LocalDateTime.now()).stream().map(RewardResponse::from).toList());
    }

    @GetMapping("/api/rewards/featured")
    public ResponseEntity<List<RewardResponse>> featured() {
        return ResponseEntity.ok(rewardService.listFeatured(tenantId(), LocalDateTime.now()).stream().map(RewardResponse::from).toList());
    }

    @GetMapping("/api/staff/rewards")
    public ResponseEntity<List<RewardResponse>> all() {
        return ResponseEntity.ok(rewardService.listAll(tenantId()).stream().map(RewardResponse::from).toList());
    }

    @PostMapping("/api/staff/rewards")
    public ResponseEntity<RewardResponse> create(@RequestBody RewardRequest request) {
        var reward = rewardService.create(tenantId(), request, SecurityUtils.getCurrentMember().customerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RewardResponse.from(reward));
    }

    @PutMapping("/api/staff/rewards/{id}")
    public ResponseEntity<RewardResponse> update(@PathVariable UUID id, @RequestBody RewardRequest request) {
        return ResponseEntity.ok(RewardResponse.from(rewardService.update(tenantId(), id, request)));
    }

    @PutMapping("/api/staff/rewards/{id}/status")
    public ResponseEntity<RewardResponse> changeStatus(@PathVariable UUID id, @RequestBody StatusRequest request) {
        return ResponseEntity.ok(RewardResponse.from(rewardService.changeStatus(tenantId(), id, request.status())));
    }

    @DeleteMapping("/api/staff/rewards/{id}")
    public ResponseEntity<RewardRemovalResponse> delete(@PathVariable UUID id) {
        return ResponseEntity.ok(new RewardRemovalResponse(id, rewardService.delete(tenantId(), id)));
    }

    private static UUID tenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }
}
