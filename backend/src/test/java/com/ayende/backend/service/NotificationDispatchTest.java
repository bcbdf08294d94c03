package com.ayende.backend.service;

import com.ayende.backend.domain.Notification;
import com.ayende.backend.domain.Tenant;
import com.ayende.backend.domain.enums.NotificationStatus;
import com.ayende.backend.repository.CustomerRepository;
import com.ayende.backend.repository.MembershipRepository;
import com.ayende.backend.repository.NotificationRecipientRepository;
import com.ayende.backend.repository.NotificationRepository;
import com.ayende.backend.repository.TenantRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationDispatchTest {

    private NotificationRepository notificationRepository;
    private PlatformTransactionManager transactionManager;
    private NotificationService notificationService;

    private Tenant tenant;

    @BeforeEach
    void setUp() {
        notificationRepository = Mockito.mock(NotificationRepository.class);
        transactionManager = Mockito.mock(PlatformTransactionManager.class);
        when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());

        notificationService = Mockito.spy(new NotificationService(
                notificationRepository,
                Mockito.mock(NotificationRecipientRepository.class),
                Mockito.mock(MembershipRepository.class),
                Mockito.mock(TenantRepository.class),
                Mockito.mock(CustomerRepository.class),
                new TransactionTemplate(transactionManager)));

        tenant = new Tenant();
        tenant.setId(UUID.randomUUID());
    }

    @Test
    void one_failing_notification_does_not_hold_back_the_others() {
        Notification broken = scheduled();
        Notification fine = scheduled();
        LocalDateTime now = LocalDateTime.now();
        when(notificationRepository.findByStatusAndScheduledForLessThanEqual(NotificationStatus.SCHEDULED, now))
                .thenReturn(List.of(broken, fine));
        when(notificationRepository.findById(broken.getId())).thenReturn(Optional.of(broken));
        doThrow(new IllegalStateException("recipient insert failed")).when(notificationService).send(tenant.getId(), broken.getId());
        doReturn(fine).when(notificationService).send(tenant.getId(), fine.getId());

        int dispatched = notificationService.dispatchDue(now);

        assertThat(dispatched).isEqualTo(1);
        assertThat(broken.getStatus()).isEqualTo(NotificationStatus.FAILED);
        verify(notificationService).send(tenant.getId(), fine.getId());
        verify(notificationRepository).save(broken);
        // the failed send rolled back on its own, the successful one committed
        verify(transactionManager).rollback(any());
    }

    private Notification scheduled() {
        Notification notification = new Notification();
        notification.setId(UUID.randomUUID());
        notification.setTenant(tenant);
        notification.setStatus(NotificationStatus.SCHEDULED);
        return notification;
    }
}
