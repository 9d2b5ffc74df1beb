package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.service.ThresholdConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PreferencesResponse {

    private int dailyTimeLimitMinutes;

    private int dailyArticleLimit;

    private int dailyVideoLimit;

    private int dailySocialLimit;

    private double minCredibilityScore;

    private double maxBiasScore;

    private boolean breakRemindersEnabled;

    private int breakIntervalMinutes;

    private List<String> wellnessGoals;

    private List<String> preferredContentTypes;

    private List<String> avoidedContentTypes;

    /** True when nothing is stored and the defaults are shown. */
    private boolean usingDefaults;

    public static PreferencesResponse from(ThresholdConfig config, boolean usingDefaults) {
        return PreferencesResponse.builder()
                .dailyTimeLimitMinutes(config.getDailyTimeLimitMinutes())
                .dailyArticleLimit(config.getDailyArticleLimit())
                .dailyVideoLimit(config.getDailyVideoLimit())
                .dailySocialLimit(config.getDailySocialLimit())
                .minCredibilityScore(config.getMinCredibilityScore())
                .maxBiasScore(config.getMaxBiasScore())
                .breakRemindersEnabled(config.isBreakRemindersEnabled())
                .breakIntervalMinutes(config.getBreakIntervalMinutes())
                .wellnessGoals(config.getWellnessGoals())
                .preferredContentTypes(config.getPreferredContentTypes())
                .avoidedContentTypes(config.getAvoidedContentTypes())
                .usingDefaults(usingDefaults)
                .build();
    }
}
