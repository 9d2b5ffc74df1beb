package com.truthlens.service;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.entity.ContentSession;
import com.truthlens.exception.MonitoringException;
import com.truthlens.store.ConsumptionLogStore;
import com.truthlens.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Session lifecycle of a user: INACTIVE, ACTIVE, ENDED.
 *
 * Every mutation first locks the user's session row, so updates of one user
 * apply one at a time in the order the database grants the lock. Each public
 * method is a single transaction: a rejected or failed call leaves neither a
 * consumption record nor a session change behind.
 *
 * Ended sessions never reopen. An update that arrives within the late-arrival
 * window after the end is still credited to the ended session; later updates,
 * and updates with no session at all, start a fresh one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionCoordinator {

    private final SessionStore sessionStore;
    private final ConsumptionLogStore consumptionLogStore;
    private final ThresholdEvaluationTrigger evaluationTrigger;
    private final Clock clock;

    @Value("${app.monitoring.late-arrival-window-seconds:30}")
    private long lateArrivalWindowSeconds = 30;

    /**
     * Start a session. Idempotent while a session is active: the running
     * session and its counters are kept.
     */
    @Transactional
    public ContentSession start(UUID userId) {
        ContentSession session = sessionStore.lockForUpdate(userId);
        if (session.isActive()) {
            log.debug("Session already active: userId={}, sessionNumber={}", userId, session.getSessionNumber());
            return session;
        }

        session.begin(clock.instant());
        ContentSession saved = sessionStore.save(session);
        log.info("Session started: userId={}, sessionNumber={}", userId, saved.getSessionNumber());
        return saved;
    }

    /**
     * Log one piece of consumed content and credit its time to the session.
     *
     * @throws MonitoringException with category VALIDATION before any mutation
     */
    @Transactional
    public SessionUpdateResult update(UUID userId, SessionUpdate update) {
        // Step 1: Validate the whole request
        validate(update);

        // Step 2: Drop empty reports
        if (update.getTimeSpentSeconds() <= 0) {
            log.debug("Dropped update with non-positive time: userId={}, timeSpent={}",
                    userId, update.getTimeSpentSeconds());
            return SessionUpdateResult.dropped();
        }

        // Step 3: Serialise on the session row
        ContentSession session = sessionStore.lockForUpdate(userId);
        Instant now = clock.instant();
        long timeSpent = update.getTimeSpentSeconds();

        // Step 4: Credit the session
        SessionUpdateResult.Outcome outcome;
        if (session.isActive()) {
            session.recordConsumption(timeSpent, now, true);
            outcome = SessionUpdateResult.Outcome.RECORDED;
        } else if (session.acceptsLateArrival(now, lateArrivalWindow())) {
            session.recordConsumption(timeSpent, now, false);
            outcome = SessionUpdateResult.Outcome.LATE_ARRIVAL;
            log.info("Late update applied to ended session: userId={}, sessionNumber={}",
                    userId, session.getSessionNumber());
        } else {
            session.begin(now);
            session.recordConsumption(timeSpent, now, true);
            outcome = SessionUpdateResult.Outcome.STARTED_AND_RECORDED;
            log.info("Session implicitly started by update: userId={}, sessionNumber={}",
                    userId, session.getSessionNumber());
        }

        // Step 5: Append consumption record
        ConsumptionRecord record = consumptionLogStore.append(ConsumptionRecord.builder()
                .userId(userId)
                .contentType(update.getContentType())
                .contentUrl(update.getContentUrl())
                .contentTitle(update.getContentTitle())
                .timeSpentSeconds(timeSpent)
                .scrollDepthPercent(update.getScrollDepthPercent())
                .credibilityScore(update.getCredibilityScore())
                .biasScore(update.getBiasScore())
                .sessionNumber(session.getSessionNumber())
                .consumedAt(now)
                .build());
        ContentSession saved = sessionStore.save(session);

        // Step 6: Evaluate thresholds asynchronously after commit
        evaluationTrigger.requestEvaluation(userId, update.getContentType());

        log.info("Consumption logged: userId={}, contentType={}, timeSpent={}, accumulatedSeconds={}, outcome={}",
                userId, update.getContentType(), timeSpent, saved.getAccumulatedSeconds(), outcome);
        return SessionUpdateResult.of(outcome, record.getId(), saved);
    }

    /**
     * End the active session. Ending an inactive or ended session changes nothing.
     */
    @Transactional
    public ContentSession end(UUID userId) {
        ContentSession session = sessionStore.lockForUpdate(userId);
        if (!session.isActive()) {
            log.debug("No active session to end: userId={}, state={}", userId, session.getState());
            return session;
        }

        session.end(clock.instant());
        ContentSession saved = sessionStore.save(session);
        log.info("Session ended: userId={}, sessionNumber={}, accumulatedSeconds={}",
                userId, saved.getSessionNumber(), saved.getAccumulatedSeconds());
        return saved;
    }

    /**
     * End every active session whose last heartbeat is older than {@code inactivity}.
     *
     * @return number of sessions ended
     */
    @Transactional
    public int endInactiveSessions(Duration inactivity) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(inactivity);
        List<ContentSession> candidates = sessionStore.findActiveWithHeartbeatBefore(cutoff);

        int ended = 0;
        for (ContentSession candidate : candidates) {
            // Re-check under the lock; an update may have refreshed the heartbeat meanwhile
            ContentSession session = sessionStore.lockForUpdate(candidate.getUserId());
            if (session.isActive()
                    && session.getLastHeartbeatAt() != null
                    && session.getLastHeartbeatAt().isBefore(cutoff)) {
                session.end(now);
                sessionStore.save(session);
                ended++;
                log.info("Inactive session ended: userId={}, sessionNumber={}, lastHeartbeatAt={}",
                        session.getUserId(), session.getSessionNumber(), session.getLastHeartbeatAt());
            }
        }
        return ended;
    }

    private Duration lateArrivalWindow() {
        return Duration.ofSeconds(lateArrivalWindowSeconds);
    }

    private void validate(SessionUpdate update) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (update.getContentType() == null) {
            errors.put("content_type", "Content type is required");
        }
        if (update.getTimeSpentSeconds() == null) {
            errors.put("time_spent", "Time spent is required");
        }
        if (!inUnitRange(update.getCredibilityScore())) {
            errors.put("credibility_score", "Credibility score must be between 0 and 1");
        }
        if (!inUnitRange(update.getBiasScore())) {
            errors.put("bias_score", "Bias score must be between 0 and 1");
        }
        Integer scroll = update.getScrollDepthPercent();
        if (scroll != null && (scroll < 0 || scroll > 100)) {
            errors.put("scroll_depth_percent", "Scroll depth must be between 0 and 100");
        }

        if (!errors.isEmpty()) {
            log.warn("Rejected session update: errors={}", errors.keySet());
            throw MonitoringException.validation(errors);
        }
    }

    private static boolean inUnitRange(Double score) {
        return score == null || (score >= 0.0 && score <= 1.0);
    }
}
