package com.truthlens.tracker.activity;

import com.truthlens.tracker.analysis.AnalysisResult;
import com.truthlens.tracker.content.ContentSnapshot;
import com.truthlens.tracker.scheduler.ScheduledHandle;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutable state of a single page view. Confined to the tracker's event loop.
 *
 * Time is credited in segments. A segment starts when the page becomes
 * visible and is closed by a checkpoint, which credits the part of it that
 * lies within the idle window of the last interaction.
 */
final class PageView {

    private final String url;
    private final Duration idleWindow;
    private final Instant startedAt;

    private String html;
    private boolean visible = true;
    private Instant segmentStart;
    private Instant lastInteractionAt;
    private long creditedMillis;
    private long emittedMillis;
    private double maxScrollDepth;

    private boolean analysisRequested;
    private ContentSnapshot snapshot;
    private AnalysisResult analysis;
    private ScheduledHandle debounceHandle;
    private boolean closed;

    PageView(String url, String html, Instant now, Duration idleWindow) {
        this.url = url;
        this.html = html;
        this.idleWindow = idleWindow;
        this.startedAt = now;
        this.segmentStart = now;
        this.lastInteractionAt = now;
    }

    /**
     * Credit the running segment up to {@code now} and start a new one.
     */
    void checkpoint(Instant now) {
        if (!visible || segmentStart == null) {
            return;
        }
        Instant idleCutoff = lastInteractionAt.plus(idleWindow);
        Instant creditUntil = now.isBefore(idleCutoff) ? now : idleCutoff;
        if (creditUntil.isAfter(segmentStart)) {
            creditedMillis += Duration.between(segmentStart, creditUntil).toMillis();
        }
        segmentStart = now;
    }

    void recordInteraction(Instant now) {
        // close out the previous stretch first so idle time before this interaction is not credited
        checkpoint(now);
        lastInteractionAt = now;
    }

    void recordScroll(Instant now, double depthPercent) {
        double clamped = Math.max(0.0, Math.min(100.0, depthPercent));
        if (clamped > maxScrollDepth) {
            maxScrollDepth = clamped;
        }
        recordInteraction(now);
    }

    void hide(Instant now) {
        checkpoint(now);
        visible = false;
        segmentStart = null;
    }

    void show(Instant now) {
        if (visible) {
            return;
        }
        visible = true;
        segmentStart = now;
        lastInteractionAt = now;
    }

    long pendingSeconds() {
        return (creditedMillis - emittedMillis) / 1000;
    }

    void markEmitted(long seconds) {
        emittedMillis += seconds * 1000;
    }

    long creditedSeconds() {
        return creditedMillis / 1000;
    }

    ActivitySample sample(Instant now) {
        return ActivitySample.builder()
                .timestamp(now)
                .scrollDepth(maxScrollDepth)
                .visible(visible)
                .lastInteractionAt(lastInteractionAt)
                .creditedSeconds(creditedSeconds())
                .build();
    }

    String url() {
        return url;
    }

    Instant startedAt() {
        return startedAt;
    }

    String html() {
        return html;
    }

    void updateHtml(String html) {
        this.html = html;
    }

    boolean isVisible() {
        return visible;
    }

    double maxScrollDepth() {
        return maxScrollDepth;
    }

    boolean isAnalysisRequested() {
        return analysisRequested;
    }

    void markAnalysisRequested() {
        analysisRequested = true;
    }

    ContentSnapshot snapshot() {
        return snapshot;
    }

    void snapshot(ContentSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    AnalysisResult analysis() {
        return analysis;
    }

    void analysis(AnalysisResult analysis) {
        this.analysis = analysis;
    }

    void rearmDebounce(ScheduledHandle handle) {
        cancelDebounce();
        debounceHandle = handle;
    }

    void cancelDebounce() {
        if (debounceHandle != null) {
            debounceHandle.cancel();
            debounceHandle = null;
        }
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        cancelDebounce();
        closed = true;
    }
}
