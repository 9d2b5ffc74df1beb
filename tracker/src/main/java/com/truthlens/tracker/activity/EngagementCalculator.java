package com.truthlens.tracker.activity;

/**
 * Bounded engagement heuristic for a page view.
 *
 * <pre>
 * 0.4 * min(1, timeSpent / readingTime)
 *   + 0.4 * scrollDepth / 100
 *   + 0.2 * min(1, timeSpent / 120s)
 * </pre>
 *
 * A page with no measurable reading time gets full credit for the first
 * term once any time was spent on it.
 */
public final class EngagementCalculator {

    static final double ACTIVE_READING_CAP_SECONDS = 120.0;

    private EngagementCalculator() {
    }

    /**
     * @param timeSpentSeconds   credited viewing time
     * @param readingTimeMinutes estimated reading time of the page
     * @param scrollDepthPercent maximum scroll depth, 0..100
     * @return score in [0,1]
     */
    public static double score(long timeSpentSeconds, int readingTimeMinutes, double scrollDepthPercent) {
        double timeSpent = Math.max(0, timeSpentSeconds);
        double readingSeconds = readingTimeMinutes * 60.0;

        double readingRatio = readingSeconds > 0
                ? Math.min(1.0, timeSpent / readingSeconds)
                : (timeSpent > 0 ? 1.0 : 0.0);
        double scrollRatio = Math.max(0.0, Math.min(100.0, scrollDepthPercent)) / 100.0;
        double activeRatio = Math.min(1.0, timeSpent / ACTIVE_READING_CAP_SECONDS);

        double score = 0.4 * readingRatio + 0.4 * scrollRatio + 0.2 * activeRatio;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
