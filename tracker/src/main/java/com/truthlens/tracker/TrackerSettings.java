package com.truthlens.tracker;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the client-side tracker. Defaults match the server's
 * accounting rules and should only be changed together with them.
 */
@Value
@Builder
public class TrackerSettings {

    /** Base URL of the platform API. */
    @Builder.Default
    String apiBaseUrl = "http://localhost:3000";

    /** Time after the last interaction during which viewing time is still credited. */
    @Builder.Default
    Duration idleWindow = Duration.ofSeconds(30);

    /** Period of the checkpoint tick for the running segment. */
    @Builder.Default
    Duration tickInterval = Duration.ofSeconds(30);

    /** Quiet period after load or the last content mutation before analysis fires. */
    @Builder.Default
    Duration analysisDebounce = Duration.ofSeconds(3);

    @Builder.Default
    int minAnalysisChars = 100;

    @Builder.Default
    int maxTransmittedChars = 5000;

    @Builder.Default
    int wordsPerMinute = 200;

    /** Pending time a page view must exceed before a draft is logged. */
    @Builder.Default
    long loggingThresholdSeconds = 10;

    @Builder.Default
    Duration syncFlushInterval = Duration.ofSeconds(30);

    @Builder.Default
    int analysisHistoryCapacity = 100;

    @Builder.Default
    int consumptionLogCapacity = 500;
}
