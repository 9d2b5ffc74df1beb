package com.truthlens.tracker.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * Scores returned by the analysis collaborator, each in [0,1] or null when
 * the corresponding analysis was unavailable.
 */
@Value
@Builder
public class AnalysisResult {

    Double credibilityScore;

    Double biasScore;

    boolean biasDetected;
}
