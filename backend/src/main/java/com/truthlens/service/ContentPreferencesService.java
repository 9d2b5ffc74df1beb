package com.truthlens.service;

import com.truthlens.entity.ContentPreferences;
import com.truthlens.exception.MonitoringException;
import com.truthlens.store.PreferenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads and writes a user's content limits and wellness settings.
 *
 * Reads never create a row: a user without stored preferences is evaluated
 * against {@link ThresholdConfig#defaults()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentPreferencesService {

    static final int MAX_TIME_LIMIT_MINUTES = 1440;
    static final int MAX_ARTICLE_LIMIT = 100;
    static final int MAX_VIDEO_LIMIT = 50;
    static final int MAX_SOCIAL_LIMIT = 200;
    static final int MIN_BREAK_INTERVAL_MINUTES = 5;
    static final int MAX_BREAK_INTERVAL_MINUTES = 120;

    private final PreferenceStore preferenceStore;

    /**
     * Stored configuration, or empty when the user never saved preferences.
     */
    @Transactional(readOnly = true)
    public Optional<ThresholdConfig> storedConfig(UUID userId) {
        return preferenceStore.find(userId).map(ThresholdConfig::from);
    }

    /**
     * Stored configuration with defaults applied.
     */
    @Transactional(readOnly = true)
    public ThresholdConfig effectiveConfig(UUID userId) {
        return storedConfig(userId).orElseGet(() -> {
            log.debug("No stored preferences, using defaults: userId={}", userId);
            return ThresholdConfig.defaults();
        });
    }

    /**
     * Validate and apply a partial update, creating the row on first write.
     *
     * @throws MonitoringException with category VALIDATION if any field is out of range
     */
    @Transactional
    public ThresholdConfig upsert(UUID userId, PreferencesUpdate update) {
        validate(update);

        Optional<ContentPreferences> existing = preferenceStore.find(userId);
        ThresholdConfig current = existing.map(ThresholdConfig::from).orElseGet(ThresholdConfig::defaults);
        ThresholdConfig merged = merge(current, update);

        ContentPreferences row = existing.orElseGet(() -> ContentPreferences.builder().userId(userId).build());
        merged.applyTo(row);
        preferenceStore.save(row);

        log.info("Preferences {}: userId={}, dailyTimeLimitMinutes={}, breakIntervalMinutes={}",
                existing.isPresent() ? "updated" : "created",
                userId, merged.getDailyTimeLimitMinutes(), merged.getBreakIntervalMinutes());
        return merged;
    }

    /**
     * Remove stored preferences so that the defaults apply again.
     */
    @Transactional
    public ThresholdConfig reset(UUID userId) {
        boolean removed = preferenceStore.delete(userId);
        log.info("Preferences reset to defaults: userId={}, removed={}", userId, removed);
        return ThresholdConfig.defaults();
    }

    private static ThresholdConfig merge(ThresholdConfig current, PreferencesUpdate update) {
        ThresholdConfig.ThresholdConfigBuilder builder = current.toBuilder();
        if (update.getDailyTimeLimitMinutes() != null) {
            builder.dailyTimeLimitMinutes(update.getDailyTimeLimitMinutes());
        }
        if (update.getDailyArticleLimit() != null) {
            builder.dailyArticleLimit(update.getDailyArticleLimit());
        }
        if (update.getDailyVideoLimit() != null) {
            builder.dailyVideoLimit(update.getDailyVideoLimit());
        }
        if (update.getDailySocialLimit() != null) {
            builder.dailySocialLimit(update.getDailySocialLimit());
        }
        if (update.getMinCredibilityScore() != null) {
            builder.minCredibilityScore(update.getMinCredibilityScore());
        }
        if (update.getMaxBiasScore() != null) {
            builder.maxBiasScore(update.getMaxBiasScore());
        }
        if (update.getBreakRemindersEnabled() != null) {
            builder.breakRemindersEnabled(update.getBreakRemindersEnabled());
        }
        if (update.getBreakIntervalMinutes() != null) {
            builder.breakIntervalMinutes(update.getBreakIntervalMinutes());
        }
        if (update.getWellnessGoals() != null) {
            builder.wellnessGoals(List.copyOf(update.getWellnessGoals()));
        }
        if (update.getPreferredContentTypes() != null) {
            builder.preferredContentTypes(List.copyOf(update.getPreferredContentTypes()));
        }
        if (update.getAvoidedContentTypes() != null) {
            builder.avoidedContentTypes(List.copyOf(update.getAvoidedContentTypes()));
        }
        return builder.build();
    }

    private static void validate(PreferencesUpdate update) {
        Map<String, String> errors = new LinkedHashMap<>();

        checkRange(errors, "daily_time_limit_minutes", update.getDailyTimeLimitMinutes(), 0, MAX_TIME_LIMIT_MINUTES);
        checkRange(errors, "daily_article_limit", update.getDailyArticleLimit(), 0, MAX_ARTICLE_LIMIT);
        checkRange(errors, "daily_video_limit", update.getDailyVideoLimit(), 0, MAX_VIDEO_LIMIT);
        checkRange(errors, "daily_social_limit", update.getDailySocialLimit(), 0, MAX_SOCIAL_LIMIT);
        checkRange(errors, "break_interval_minutes", update.getBreakIntervalMinutes(),
                MIN_BREAK_INTERVAL_MINUTES, MAX_BREAK_INTERVAL_MINUTES);
        checkScore(errors, "min_credibility_score", update.getMinCredibilityScore());
        checkScore(errors, "max_bias_score", update.getMaxBiasScore());

        if (!errors.isEmpty()) {
            log.warn("Rejected preferences update: errors={}", errors.keySet());
            throw MonitoringException.validation(errors);
        }
    }

    private static void checkRange(Map<String, String> errors, String field, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            errors.put(field, String.format("Must be between %d and %d", min, max));
        }
    }

    private static void checkScore(Map<String, String> errors, String field, Double value) {
        if (value != null && !(value >= 0.0 && value <= 1.0)) {
            errors.put(field, "Must be between 0 and 1");
        }
    }
}
