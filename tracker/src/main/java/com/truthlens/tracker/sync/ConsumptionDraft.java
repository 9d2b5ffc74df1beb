package com.truthlens.tracker.sync;

import com.truthlens.tracker.content.ContentType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Client-side consumption record waiting to be sent with {@code update_session}.
 */
@Value
@Builder
public class ConsumptionDraft {

    /** Longest {@code content_url} the Session API accepts. */
    public static final int MAX_URL_CHARS = 2048;

    /** Longest {@code content_title} the Session API accepts. */
    public static final int MAX_TITLE_CHARS = 500;

    String url;

    String title;

    String domain;

    ContentType contentType;

    long timeSpentSeconds;

    int scrollDepthPercent;

    int wordCount;

    double engagementScore;

    /** Null until analysis has completed for the page view. */
    Double credibilityScore;

    Double biasScore;

    Instant capturedAt;
}
