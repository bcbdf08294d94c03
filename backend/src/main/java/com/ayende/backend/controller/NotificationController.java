package com.ayende.backend.controller;

import com.ayende.backend.core.security.AuthenticatedMember;
import com.ayende.backend.core.security.SecurityUtils;
import com.ayende.backend.core.tenant.TenantContext;
import com.ayende.backend.dto.NotificationDTOs.InboxItem;
import com.ayende.backend.dto.NotificationDTOs.InboxResponse;
import com.ayende.backend.dto.NotificationDTOs.NotificationRequest;
import com.ayende.backend.dto.NotificationDTOs.NotificationResponse;
import com.ayende.backend.dto.NotificationDTOs.ScheduleRequest;
import com.ayende.backend.exception.ForbiddenOperationException;
import com.ayende.backend.service.NotificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    // --- Staff ---

    @GetMapping("/api/staff/notifications")
    public ResponseEntity<List<NotificationResponse>> list() {
        return ResponseEntity.ok(notificationService.list(tenantId()).stream().map(NotificationResponse::from).toList());
    }

    @GetMapping("/api/staff/notifications/{id}")
    public ResponseEntity<NotificationResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(NotificationResponse.from(notificationService.get(tenantId(), id)));
    }

    @PostMapping("/api/staff/notifications")
    public ResponseEntity<NotificationResponse> create(@RequestBody NotificationRequest request) {
        AuthenticatedMember staff = requireSender();
        var notification = notificationService.create(tenantId(), request, staff.customerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(NotificationResponse.from(notification));
    }

    @PostMapping("/api/staff/notifications/{id}/send")
    public ResponseEntity<NotificationResponse> send(@PathVariable UUID id) {
        requireSender();
        return ResponseEntity.ok(NotificationResponse.from(notificationService.send(tenantId(), id)));
    }

    @PostMapping("/api/staff/notifications/{id}/schedule")
    public ResponseEntity<NotificationResponse> schedule(@PathVariable UUID id, @RequestBody ScheduleRequest request) {
        requireSender();
        return ResponseEntity.ok(NotificationResponse.from(notificationService.schedule(tenantId(), id, request.scheduledFor())));
    }

    // --- Customer inbox ---

    @GetMapping("/api/notifications")
    public ResponseEntity<InboxResponse> inbox() {
        UUID membershipId = SecurityUtils.getCurrentMember().membershipId();
        List<InboxItem> items = notificationService.inbox(membershipId).stream().map(InboxItem::from).toList();
        return ResponseEntity.ok(new InboxResponse(notificationService.unreadCount(membershipId), items));
    }

    @PostMapping("/api/notifications/{recipientId}/read")
    public ResponseEntity<Map<String, Boolean>> markRead(@PathVariable UUID recipientId) {
        boolean changed = notificationService.markRead(SecurityUtils.getCurrentMember().membershipId(), recipientId);
        return ResponseEntity.ok(Map.of("changed", changed));
    }

    @PostMapping("/api/notifications/{recipientId}/unread")
    public ResponseEntity<Map<String, Boolean>> markUnread(@PathVariable UUID recipientId) {
        boolean changed = notificationService.markUnread(SecurityUtils.getCurrentMember().membershipId(), recipientId);
        return ResponseEntity.ok(Map.of("changed", changed));
    }

    private static UUID tenantId() {
        return TenantContext.requireCurrentTenant().getId();
    }

    private static AuthenticatedMember requireSender() {
        AuthenticatedMember member = SecurityUtils.getCurrentMember();
        if (member.role() == null || !member.role().canSendNotifications()) {
            throw new ForbiddenOperationException("You are not allowed to send notifications.");
        }
        return member;
    }
}
