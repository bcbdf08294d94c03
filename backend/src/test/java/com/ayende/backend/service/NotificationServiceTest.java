package com.ayende.backend.service;

import com.ayende.backend.domain.Membership;
import com.ayende.backend.domain.Notification;
import com.ayende.backend.domain.NotificationRecipient;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.NotificationStatus;
import com.ayende.backend.dto.NotificationDTOs.NotificationRequest;
import com.ayende.backend.repository.NotificationRecipientRepository;
import com.ayende.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationServiceTest extends BaseSpringTest {

    @Autowired NotificationService notificationService;
    @Autowired NotificationRecipientRepository recipientRepository;

    private Tenant tenant;
    private UUID ownerId;
    private final List<Membership> vips = new ArrayList<>();
    private final List<Membership> regulars = new ArrayList<>();

    @BeforeEach
    void setUp() {
        TenantService.Signup signup = newBusiness("notify");
        tenant = signup.tenant();
        ownerId = signup.owner().getId();
        vips.clear();
        regulars.clear();
        for (int i = 0; i < 10; i++) {
            Membership member = join(newCustomer("reader"), tenant, i * 10, i < 3);
            (i < 3 ? vips : regulars).add(member);
        }
    }

    @Test
    void vip_only_reaches_exactly_the_vips() {
        Notification notification = notificationService.create(tenant.getId(), request(true, false, null, null, null), ownerId);

        Notification sent = notificationService.send(tenant.getId(), notification.getId());

        assertThat(sent.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(sent.getTotalRecipients()).isEqualTo(3);
        assertThat(recipientRepository.countByNotificationId(notification.getId())).isEqualTo(3);
        for (Membership vip : vips) {
            assertThat(notificationService.inbox(vip.getId())).hasSize(1);
        }
        assertThat(notificationService.inbox(regulars.get(0).getId())).isEmpty();
    }

    @Test
    void everyone_means_active_customers_only() {
        Membership inactive = regulars.get(0);
        inactive.setActive(false);
        membershipRepository.save(inactive);

        Notification sent = notificationService.send(tenant.getId(),
                notificationService.create(tenant.getId(), request(false, true, null, null, null), ownerId).getId());

        // The owner is staff, not a customer
        assertThat(sent.getTotalRecipients()).isEqualTo(9);
    }

    @Test
    void points_range_narrows_the_audience() {
        Notification sent = notificationService.send(tenant.getId(),
                notificationService.create(tenant.getId(), request(false, true, 30, 60, null), ownerId).getId());

        assertThat(sent.getTotalRecipients()).isEqualTo(4);
    }

    @Test
    void explicit_targets_replace_the_everyone_audience() {
        Set<UUID> targets = Set.of(regulars.get(1).getId(), regulars.get(2).getId());

        Notification sent = notificationService.send(tenant.getId(),
                notificationService.create(tenant.getId(), request(false, false, null, null, targets), ownerId).getId());

        assertThat(sent.getTotalRecipients()).isEqualTo(2);
    }

    @Test
    void empty_audience_fails_the_notification() {
        Notification sent = notificationService.send(tenant.getId(),
                notificationService.create(tenant.getId(), request(false, false, null, null, null), ownerId).getId());

        assertThat(sent.getStatus()).isEqualTo(NotificationStatus.FAILED);
        assertThat(sent.getTotalRecipients()).isZero();
    }

    @Test
    void sending_twice_does_not_duplicate_recipients() {
        Notification notification = notificationService.create(tenant.getId(), request(true, false, null, null, null), ownerId);

        notificationService.send(tenant.getId(), notification.getId());
        Notification again = notificationService.send(tenant.getId(), notification.getId());

        assertThat(again.getTotalRecipients()).isEqualTo(3);
        assertThat(recipientRepository.countByNotificationId(notification.getId())).isEqualTo(3);
    }

    @Test
    void read_counters_follow_recipient_flags() {
        Notification notification = notificationService.create(tenant.getId(), request(true, false, null, null, null), ownerId);
        notificationService.send(tenant.getId(), notification.getId());
        Membership vip = vips.get(0);
        NotificationRecipient recipient = notificationService.inbox(vip.getId()).get(0);

        assertThat(notificationService.unreadCount(vip.getId())).isEqualTo(1);
        assertThat(notificationService.markRead(vip.getId(), recipient.getId())).isTrue();
        assertThat(notificationService.markRead(vip.getId(), recipient.getId())).isFalse();
        assertThat(notificationService.unreadCount(vip.getId())).isZero();
        assertThat(notificationService.get(tenant.getId(), notification.getId()).getTotalRead()).isEqualTo(1);

        assertThat(notificationService.markUnread(vip.getId(), recipient.getId())).isTrue();
        assertThat(notificationService.get(tenant.getId(), notification.getId()).getTotalRead()).isZero();
    }

    @Test
    void scheduled_notification_goes_out_when_due() {
        Notification notification = notificationService.create(tenant.getId(), request(true, false, null, null, null), ownerId);
        notificationService.schedule(tenant.getId(), notification.getId(), LocalDateTime.now().plusMinutes(5));

        notificationService.dispatchDue(LocalDateTime.now().plusMinutes(10));

        Notification after = notificationService.get(tenant.getId(), notification.getId());
        assertThat(after.getStatus()).isEqualTo(NotificationStatus.SENT);
        assertThat(after.getTotalRecipients()).isEqualTo(3);
    }

    @Test
    void schedule_rejects_past_times() {
        Notification notification = notificationService.create(tenant.getId(), request(true, false, null, null, null), ownerId);

        assertThatThrownBy(() -> notificationService.schedule(tenant.getId(), notification.getId(), LocalDateTime.now().minusMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static NotificationRequest request(boolean vipOnly, boolean everyone, Integer minPoints, Integer maxPoints, Set<UUID> targets) {
        return new NotificationRequest("Double points weekend", "Every purchase earns double points.",
                null, null, everyone || vipOnly, vipOnly, minPoints, maxPoints, targets, null);
    }
}
