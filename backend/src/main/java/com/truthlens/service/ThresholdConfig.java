package com.truthlens.service;

import com.truthlens.entity.ContentPreferences;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Effective limits and wellness settings of a user, with defaults applied.
 *
 * A limit of zero disables that limit.
 */
@Value
@Builder(toBuilder = true)
public class ThresholdConfig {

    public static final List<String> DEFAULT_WELLNESS_GOALS =
            List.of("reduce_misinformation", "balanced_perspective", "time_management");
    public static final List<String> DEFAULT_PREFERRED_CONTENT_TYPES =
            List.of("educational", "news", "technology", "science");
    public static final List<String> DEFAULT_AVOIDED_CONTENT_TYPES =
            List.of("gossip", "clickbait", "conspiracy");

    @Builder.Default
    int dailyTimeLimitMinutes = 120;

    @Builder.Default
    int dailyArticleLimit = 10;

    @Builder.Default
    int dailyVideoLimit = 5;

    @Builder.Default
    int dailySocialLimit = 30;

    @Builder.Default
    double minCredibilityScore = 0.70;

    @Builder.Default
    double maxBiasScore = 0.30;

    @Builder.Default
    boolean breakRemindersEnabled = true;

    @Builder.Default
    int breakIntervalMinutes = 30;

    @Builder.Default
    List<String> wellnessGoals = DEFAULT_WELLNESS_GOALS;

    @Builder.Default
    List<String> preferredContentTypes = DEFAULT_PREFERRED_CONTENT_TYPES;

    @Builder.Default
    List<String> avoidedContentTypes = DEFAULT_AVOIDED_CONTENT_TYPES;

    public static ThresholdConfig defaults() {
        return ThresholdConfig.builder().build();
    }

    public static ThresholdConfig from(ContentPreferences preferences) {
        return ThresholdConfig.builder()
                .dailyTimeLimitMinutes(preferences.getDailyTimeLimitMinutes())
                .dailyArticleLimit(preferences.getDailyArticleLimit())
                .dailyVideoLimit(preferences.getDailyVideoLimit())
                .dailySocialLimit(preferences.getDailySocialLimit())
                .minCredibilityScore(preferences.getMinCredibilityScore())
                .maxBiasScore(preferences.getMaxBiasScore())
                .breakRemindersEnabled(preferences.isBreakRemindersEnabled())
                .breakIntervalMinutes(preferences.getBreakIntervalMinutes())
                .wellnessGoals(orDefault(preferences.getWellnessGoals(), DEFAULT_WELLNESS_GOALS))
                .preferredContentTypes(orDefault(preferences.getPreferredContentTypes(), DEFAULT_PREFERRED_CONTENT_TYPES))
                .avoidedContentTypes(orDefault(preferences.getAvoidedContentTypes(), DEFAULT_AVOIDED_CONTENT_TYPES))
                .build();
    }

    public long dailyTimeLimitSeconds() {
        return dailyTimeLimitMinutes * 60L;
    }

    public long breakIntervalSeconds() {
        return breakIntervalMinutes * 60L;
    }

    /**
     * Copy this configuration onto a preferences row.
     */
    public void applyTo(ContentPreferences preferences) {
        preferences.setDailyTimeLimitMinutes(dailyTimeLimitMinutes);
        preferences.setDailyArticleLimit(dailyArticleLimit);
        preferences.setDailyVideoLimit(dailyVideoLimit);
        preferences.setDailySocialLimit(dailySocialLimit);
        preferences.setMinCredibilityScore(minCredibilityScore);
        preferences.setMaxBiasScore(maxBiasScore);
        preferences.setBreakRemindersEnabled(breakRemindersEnabled);
        preferences.setBreakIntervalMinutes(breakIntervalMinutes);
        preferences.setWellnessGoals(List.copyOf(wellnessGoals));
        preferences.setPreferredContentTypes(List.copyOf(preferredContentTypes));
        preferences.setAvoidedContentTypes(List.copyOf(avoidedContentTypes));
    }

    private static List<String> orDefault(List<String> values, List<String> defaults) {
        return values == null ? defaults : List.copyOf(values);
    }
}
