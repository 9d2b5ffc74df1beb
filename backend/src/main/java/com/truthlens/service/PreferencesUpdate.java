package com.truthlens.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial change to a user's preferences; null fields keep their current value.
 */
@Value
@Builder
public class PreferencesUpdate {
    Integer dailyTimeLimitMinutes;
    Integer dailyArticleLimit;
    Integer dailyVideoLimit;
    Integer dailySocialLimit;
    Double minCredibilityScore;
    Double maxBiasScore;
    Boolean breakRemindersEnabled;
    Integer breakIntervalMinutes;
    List<String> wellnessGoals;
    List<String> preferredContentTypes;
    List<String> avoidedContentTypes;
}
