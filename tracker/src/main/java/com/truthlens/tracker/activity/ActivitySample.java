package com.truthlens.tracker.activity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of the activity state of the current page view.
 */
@Value
@Builder
public class ActivitySample {

    Instant timestamp;

    /** Running maximum scroll depth, 0..100. */
    double scrollDepth;

    boolean visible;

    Instant lastInteractionAt;

    long creditedSeconds;
}
