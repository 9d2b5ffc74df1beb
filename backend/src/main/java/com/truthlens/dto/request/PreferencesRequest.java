package com.truthlens.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.service.PreferencesUpdate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of {@code PUT /api/content-preferences}. Absent fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PreferencesRequest {

    @Min(value = 0, message = "Daily time limit must be between 0 and 1440 minutes")
    @Max(value = 1440, message = "Daily time limit must be between 0 and 1440 minutes")
    private Integer dailyTimeLimitMinutes;

    @Min(value = 0, message = "Daily article limit must be between 0 and 100")
    @Max(value = 100, message = "Daily article limit must be between 0 and 100")
    private Integer dailyArticleLimit;

    @Min(value = 0, message = "Daily video limit must be between 0 and 50")
    @Max(value = 50, message = "Daily video limit must be between 0 and 50")
    private Integer dailyVideoLimit;

    @Min(value = 0, message = "Daily social limit must be between 0 and 200")
    @Max(value = 200, message = "Daily social limit must be between 0 and 200")
    private Integer dailySocialLimit;

    @DecimalMin(value = "0.0", message = "Minimum credibility score must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Minimum credibility score must be between 0 and 1")
    private Double minCredibilityScore;

    @DecimalMin(value = "0.0", message = "Maximum bias score must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Maximum bias score must be between 0 and 1")
    private Double maxBiasScore;

    private Boolean breakRemindersEnabled;

    @Min(value = 5, message = "Break interval must be between 5 and 120 minutes")
    @Max(value = 120, message = "Break interval must be between 5 and 120 minutes")
    private Integer breakIntervalMinutes;

    @Size(max = 20, message = "At most 20 wellness goals are allowed")
    private List<String> wellnessGoals;

    @Size(max = 50, message = "At most 50 preferred content types are allowed")
    private List<String> preferredContentTypes;

    @Size(max = 50, message = "At most 50 avoided content types are allowed")
    private List<String> avoidedContentTypes;

    public PreferencesUpdate toUpdate() {
        return PreferencesUpdate.builder()
                .dailyTimeLimitMinutes(dailyTimeLimitMinutes)
                .dailyArticleLimit(dailyArticleLimit)
                .dailyVideoLimit(dailyVideoLimit)
                .dailySocialLimit(dailySocialLimit)
                .minCredibilityScore(minCredibilityScore)
                .maxBiasScore(maxBiasScore)
                .breakRemindersEnabled(breakRemindersEnabled)
                .breakIntervalMinutes(breakIntervalMinutes)
                .wellnessGoals(wellnessGoals)
                .preferredContentTypes(preferredContentTypes)
                .avoidedContentTypes(avoidedContentTypes)
                .build();
    }
}
