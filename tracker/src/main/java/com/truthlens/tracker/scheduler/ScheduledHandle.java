package com.truthlens.tracker.scheduler;

/**
 * Cancellable handle for a task armed on a {@link TrackerScheduler}.
 */
public interface ScheduledHandle {

    /**
     * Cancel the task. Cancelling twice is a no-op.
     */
    void cancel();

    boolean isCancelled();
}
