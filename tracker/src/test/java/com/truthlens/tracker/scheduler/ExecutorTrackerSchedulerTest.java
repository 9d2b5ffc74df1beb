package com.truthlens.tracker.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExecutorTrackerScheduler Unit Tests")
class ExecutorTrackerSchedulerTest {

    private final ExecutorTrackerScheduler scheduler = new ExecutorTrackerScheduler();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("A failing task does not stop the loop")
    void testFailingTaskDoesNotStopLoop() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.execute(() -> {
            throw new IllegalStateException("boom");
        });
        scheduler.execute(latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Cancelled periodic task stops running")
    void testCancelPeriodicTask() throws InterruptedException {
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch firstRuns = new CountDownLatch(2);

        ScheduledHandle handle = scheduler.scheduleAtFixedRate(() -> {
            runs.incrementAndGet();
            firstRuns.countDown();
        }, Duration.ZERO, Duration.ofMillis(10));
        assertTrue(firstRuns.await(2, TimeUnit.SECONDS));

        handle.cancel();
        int afterCancel = runs.get();
        Thread.sleep(100);

        assertTrue(handle.isCancelled());
        assertTrue(runs.get() <= afterCancel + 1);
    }
}
