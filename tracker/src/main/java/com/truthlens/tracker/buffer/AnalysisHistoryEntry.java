package com.truthlens.tracker.buffer;

import com.truthlens.tracker.analysis.AnalysisResult;
import com.truthlens.tracker.content.ContentType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one page analysis, kept for the local history view.
 */
@Value
@Builder
public class AnalysisHistoryEntry {

    String url;

    String title;

    String domain;

    ContentType contentType;

    AnalysisResult result;

    Instant analyzedAt;
}
