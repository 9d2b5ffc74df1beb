package com.truthlens.service;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.entity.ContentSession;
import com.truthlens.entity.ContentType;
import com.truthlens.entity.Notification;
import com.truthlens.service.alert.BreakReminderAlert;
import com.truthlens.service.alert.ContentLimitAlert;
import com.truthlens.service.alert.ContentLimitAlert.LimitMetric;
import com.truthlens.service.alert.ContentQualityAlert;
import com.truthlens.service.alert.WellnessAlert;
import com.truthlens.service.alert.WellnessGoalAlert;
import com.truthlens.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Compares today's consumption against the user's thresholds and emits
 * notifications for the crossings.
 *
 * Checks:
 * - Limits: daily time and per-type counts, warning at 80%, exceeded at 100%.
 *   Exceeded takes precedence within one evaluation; the two tiers have
 *   different dedupe keys, so a warning earlier in the day does not block
 *   the exceeded notification.
 * - Break: active time since the last break reminder of the running session.
 * - Quality: averages over the most recent scored records of today.
 * - Wellness goals: achievement or reminder per configured goal.
 *
 * After every logged update the limit, break and quality checks run;
 * wellness only runs on explicit request and on the periodic sweep.
 * Each method returns the notifications actually emitted (deduped ones excluded).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThresholdEvaluator {

    static final int QUALITY_WINDOW = 10;
    static final int QUALITY_MIN_RECORDS = 3;

    static final String GOAL_REDUCE_MISINFORMATION = "reduce_misinformation";
    static final String GOAL_BALANCED_PERSPECTIVE = "balanced_perspective";
    static final String GOAL_TIME_MANAGEMENT = "time_management";

    private final ConsumptionStatsService statsService;
    private final ContentPreferencesService preferencesService;
    private final SessionStore sessionStore;
    private final NotificationEmitter notificationEmitter;

    /**
     * Checks run after each logged consumption record.
     */
    @Transactional
    public List<Notification> evaluateOnUpdate(UUID userId) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        DailyAggregate today = statsService.aggregateToday(userId);

        List<Notification> emitted = new ArrayList<>();
        emitted.addAll(emitAll(userId, limitAlerts(today, config, EnumSet.allOf(LimitMetric.class)), today.getDate()));
        emitted.addAll(evaluateBreak(userId, config, today.getDate()));
        emitted.addAll(emitAll(userId, optionalList(qualityAlert(userId, config)), today.getDate()));

        log.info("Threshold evaluation completed: userId={}, totalSeconds={}, records={}, emitted={}",
                userId, today.getTotalTimeSeconds(), today.getContentCount(), emitted.size());
        return emitted;
    }

    /**
     * Time limit plus the count limit of {@code contentType}; all count limits when null.
     */
    @Transactional
    public List<Notification> checkLimits(UUID userId, ContentType contentType) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        DailyAggregate today = statsService.aggregateToday(userId);
        return emitAll(userId, limitAlerts(today, config, metricsFor(contentType)), today.getDate());
    }

    @Transactional
    public List<Notification> checkBreak(UUID userId) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        return evaluateBreak(userId, config, statsService.today());
    }

    @Transactional
    public List<Notification> checkQuality(UUID userId) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        return emitAll(userId, optionalList(qualityAlert(userId, config)), statsService.today());
    }

    @Transactional
    public List<Notification> checkWellness(UUID userId) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        DailyAggregate today = statsService.aggregateToday(userId);
        return emitAll(userId, wellnessAlerts(today, config), today.getDate());
    }

    /**
     * Checks run by the periodic sweep for users with an active session.
     */
    @Transactional
    public List<Notification> evaluateSweep(UUID userId) {
        ThresholdConfig config = preferencesService.effectiveConfig(userId);
        DailyAggregate today = statsService.aggregateToday(userId);

        List<Notification> emitted = new ArrayList<>(evaluateBreak(userId, config, today.getDate()));
        emitted.addAll(emitAll(userId, wellnessAlerts(today, config), today.getDate()));
        return emitted;
    }

    // Limits

    static List<WellnessAlert> limitAlerts(DailyAggregate today, ThresholdConfig config, Set<LimitMetric> metrics) {
        List<WellnessAlert> alerts = new ArrayList<>();
        for (LimitMetric metric : metrics) {
            limitAlert(metric, today, config).ifPresent(alerts::add);
        }
        return alerts;
    }

    private static Optional<WellnessAlert> limitAlert(LimitMetric metric, DailyAggregate today, ThresholdConfig config) {
        switch (metric) {
            case TIME: {
                long limitSeconds = config.dailyTimeLimitSeconds();
                return tier(today.getTotalTimeSeconds(), limitSeconds)
                        .map(exceeded -> new ContentLimitAlert(metric,
                                today.totalTimeMinutes(), config.getDailyTimeLimitMinutes(), exceeded));
            }
            case ARTICLES:
                return countAlert(metric, today.countOf(ContentType.ARTICLE), config.getDailyArticleLimit());
            case VIDEOS:
                return countAlert(metric, today.countOf(ContentType.VIDEO), config.getDailyVideoLimit());
            case SOCIAL:
                return countAlert(metric, today.countOf(ContentType.SOCIAL_POST), config.getDailySocialLimit());
            default:
                throw new IllegalArgumentException("Unknown limit metric: " + metric);
        }
    }

    private static Optional<WellnessAlert> countAlert(LimitMetric metric, long count, int limit) {
        return tier(count, limit).map(exceeded -> new ContentLimitAlert(metric, count, limit, exceeded));
    }

    /**
     * @return empty below 80% or when the limit is disabled, otherwise whether the limit is exceeded
     */
    static Optional<Boolean> tier(long current, long limit) {
        if (limit <= 0) {
            return Optional.empty();
        }
        if (current >= limit) {
            return Optional.of(true);
        }
        if (current * 5 >= limit * 4) {
            return Optional.of(false);
        }
        return Optional.empty();
    }

    private static Set<LimitMetric> metricsFor(ContentType contentType) {
        if (contentType == null) {
            return EnumSet.allOf(LimitMetric.class);
        }
        switch (contentType) {
            case ARTICLE:
                return EnumSet.of(LimitMetric.TIME, LimitMetric.ARTICLES);
            case VIDEO:
                return EnumSet.of(LimitMetric.TIME, LimitMetric.VIDEOS);
            case SOCIAL_POST:
                return EnumSet.of(LimitMetric.TIME, LimitMetric.SOCIAL);
            default:
                return EnumSet.of(LimitMetric.TIME);
        }
    }

    // Break

    private List<Notification> evaluateBreak(UUID userId, ThresholdConfig config, LocalDate day) {
        if (!config.isBreakRemindersEnabled() || config.getBreakIntervalMinutes() <= 0) {
            return List.of();
        }

        ContentSession session = sessionStore.lockForUpdate(userId);
        if (!session.isActive() || session.secondsSinceLastBreak() < config.breakIntervalSeconds()) {
            return List.of();
        }

        BreakReminderAlert alert = new BreakReminderAlert(
                session.getSessionNumber(),
                session.getBreakCursorSeconds(),
                session.getAccumulatedSeconds() / 60,
                config.getBreakIntervalMinutes()
        );
        Optional<Notification> emitted = notificationEmitter.emit(userId, alert, day);

        session.markBreakReminded();
        sessionStore.save(session);
        log.debug("Break cursor reset: userId={}, sessionNumber={}, cursorSeconds={}",
                userId, session.getSessionNumber(), session.getBreakCursorSeconds());

        return emitted.map(List::of).orElse(List.of());
    }

    // Quality

    private Optional<WellnessAlert> qualityAlert(UUID userId, ThresholdConfig config) {
        List<ConsumptionRecord> recent = statsService.recentScoredToday(userId, QUALITY_WINDOW);
        if (recent.size() < QUALITY_MIN_RECORDS) {
            return Optional.empty();
        }

        Double averageCredibility = ConsumptionStatsService.average(recent, ConsumptionStatsService.ScoreKind.CREDIBILITY);
        Double averageBias = ConsumptionStatsService.average(recent, ConsumptionStatsService.ScoreKind.BIAS);

        boolean lowCredibility = averageCredibility != null && averageCredibility < config.getMinCredibilityScore();
        boolean highBias = averageBias != null && averageBias > config.getMaxBiasScore();
        if (!lowCredibility && !highBias) {
            return Optional.empty();
        }
        return Optional.of(new ContentQualityAlert(averageCredibility, averageBias, recent.size()));
    }

    // Wellness

    static List<WellnessAlert> wellnessAlerts(DailyAggregate today, ThresholdConfig config) {
        List<WellnessAlert> alerts = new ArrayList<>();
        if (today.getContentCount() == 0) {
            return alerts;
        }

        for (String goal : config.getWellnessGoals()) {
            switch (goal) {
                case GOAL_REDUCE_MISINFORMATION:
                    if (today.getAverageCredibility() != null) {
                        alerts.add(new WellnessGoalAlert(goal,
                                today.getAverageCredibility() >= config.getMinCredibilityScore(),
                                today.getAverageCredibility()));
                    }
                    break;
                case GOAL_BALANCED_PERSPECTIVE:
                    if (today.getAverageBias() != null) {
                        alerts.add(new WellnessGoalAlert(goal,
                                today.getAverageBias() <= config.getMaxBiasScore(),
                                today.getAverageBias()));
                    }
                    break;
                case GOAL_TIME_MANAGEMENT:
                    if (config.getDailyTimeLimitMinutes() > 0) {
                        alerts.add(new WellnessGoalAlert(goal,
                                today.getTotalTimeSeconds() <= config.dailyTimeLimitSeconds(),
                                (double) today.totalTimeMinutes()));
                    }
                    break;
                default:
                    log.debug("Ignoring unknown wellness goal: goal={}", goal);
            }
        }
        return alerts;
    }

    private static List<WellnessAlert> optionalList(Optional<WellnessAlert> alert) {
        return alert.map(List::of).orElse(List.of());
    }

    private List<Notification> emitAll(UUID userId, List<WellnessAlert> alerts, LocalDate day) {
        List<Notification> emitted = new ArrayList<>();
        for (WellnessAlert alert : alerts) {
            notificationEmitter.emit(userId, alert, day).ifPresent(emitted::add);
        }
        return emitted;
    }
}
