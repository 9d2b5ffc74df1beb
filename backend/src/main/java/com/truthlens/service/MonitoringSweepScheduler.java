package com.truthlens.service;

import com.truthlens.entity.ContentSession;
import com.truthlens.entity.Notification;
import com.truthlens.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodic maintenance of the monitoring pipeline.
 *
 * - Inactivity cleanup: ends sessions without a heartbeat for the inactivity timeout.
 * - Sweep: break and wellness evaluation of every active session.
 * - Purge: removes expired notifications.
 *
 * A failure for one user is logged and the sweep continues with the next one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringSweepScheduler {

    private final SessionCoordinator sessionCoordinator;
    private final ThresholdEvaluator thresholdEvaluator;
    private final NotificationService notificationService;
    private final SessionStore sessionStore;

    @Value("${app.monitoring.inactivity-timeout-minutes:30}")
    private long inactivityTimeoutMinutes = 30;

    @Scheduled(fixedDelayString = "${app.monitoring.inactivity-check-interval-ms:300000}",
            initialDelayString = "${app.monitoring.inactivity-check-interval-ms:300000}")
    public void endInactiveSessions() {
        int ended = sessionCoordinator.endInactiveSessions(Duration.ofMinutes(inactivityTimeoutMinutes));
        if (ended > 0) {
            log.info("Inactivity cleanup finished: ended={}, timeoutMinutes={}", ended, inactivityTimeoutMinutes);
        }
    }

    @Scheduled(cron = "${app.monitoring.sweep-cron:0 0 * * * *}", zone = "${app.monitoring.time-zone:UTC}")
    public void sweep() {
        List<ContentSession> active = sessionStore.findActive();
        log.info("Monitoring sweep started: activeSessions={}", active.size());

        int emitted = 0;
        int failed = 0;
        for (ContentSession session : active) {
            try {
                List<Notification> notifications = thresholdEvaluator.evaluateSweep(session.getUserId());
                emitted += notifications.size();
            } catch (DataAccessException | IllegalStateException e) {
                failed++;
                log.error("Sweep evaluation failed: userId={}, error={}", session.getUserId(), e.getMessage(), e);
            }
        }

        int purged = notificationService.purgeExpired();
        log.info("Monitoring sweep completed: activeSessions={}, emitted={}, failed={}, purged={}",
                active.size(), emitted, failed, purged);
    }
}
