package com.truthlens.tracker.scheduler;

import java.time.Duration;

/**
 * Event loop of the tracker.
 *
 * All page-view state is mutated only from tasks run by this scheduler, so
 * implementations must run tasks one at a time in submission order. Network
 * calls never run here; they go to a separate executor and post their results
 * back with {@link #execute(Runnable)}.
 */
public interface TrackerScheduler {

    /**
     * Run a task on the loop as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Run a task once after the given delay.
     */
    ScheduledHandle schedule(Runnable task, Duration delay);

    /**
     * Run a task repeatedly until its handle is cancelled.
     */
    ScheduledHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Stop the loop. Pending tasks are discarded.
     */
    void shutdown();
}
