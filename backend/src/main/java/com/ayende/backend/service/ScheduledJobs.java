package com.ayende.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Periodic work. Each run only calls the same transactional operations staff can trigger by hand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduledJobs {

    private final NotificationService notificationService;
    private final RedemptionService redemptionService;

    @Scheduled(fixedRateString = "${ayende.jobs.notification-dispatch-ms:60000}",
               initialDelayString = "${ayende.jobs.initial-delay-ms:60000}")
    public void dispatchScheduledNotifications() {
        int sent = notificationService.dispatchDue(LocalDateTime.now());
        if (sent > 0) {
            log.info("Dispatched {} scheduled notifications", sent);
        }
    }

    // Hourly
    @Scheduled(fixedRateString = "${ayende.jobs.redemption-expiry-ms:3600000}",
               initialDelayString = "${ayende.jobs.initial-delay-ms:60000}")
    public void expireRedemptions() {
        redemptionService.expireElapsed(LocalDateTime.now());
    }
}
