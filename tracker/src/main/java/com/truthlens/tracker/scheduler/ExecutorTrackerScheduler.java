package com.truthlens.tracker.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TrackerScheduler} backed by a single-thread {@link ScheduledExecutorService}.
 *
 * Task failures are logged and do not stop the loop or a periodic task.
 */
@Slf4j
public class ExecutorTrackerScheduler implements TrackerScheduler {

    private final ScheduledExecutorService executor;

    public ExecutorTrackerScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tracker-loop");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ExecutorTrackerScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public ScheduledHandle schedule(Runnable task, Duration delay) {
        return new FutureHandle(executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public ScheduledHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        return new FutureHandle(executor.scheduleAtFixedRate(guarded(task),
                initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Tracker task failed", e);
            }
        };
    }

    private static final class FutureHandle implements ScheduledHandle {

        private final ScheduledFuture<?> future;

        private FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
