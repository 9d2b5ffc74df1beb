package com.truthlens.tracker.sync;

import com.truthlens.tracker.ManualTrackerScheduler;
import com.truthlens.tracker.MutableClock;
import com.truthlens.tracker.RecordingApiClient;
import com.truthlens.tracker.buffer.BufferedEntry;
import com.truthlens.tracker.buffer.LocalBuffer;
import com.truthlens.tracker.content.ContentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SyncQueue.
 *
 * Runs the queue on a virtual-time scheduler with an inline network executor.
 */
@DisplayName("SyncQueue Unit Tests")
class SyncQueueTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private ManualTrackerScheduler scheduler;
    private RecordingApiClient apiClient;
    private LocalBuffer buffer;
    private SyncQueue syncQueue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        scheduler = new ManualTrackerScheduler(clock);
        apiClient = new RecordingApiClient();
        buffer = new LocalBuffer(100, 500);
        syncQueue = new SyncQueue(buffer, apiClient, scheduler, Runnable::run, clock, Duration.ofSeconds(30), 10);
    }

    @Test
    @DisplayName("Submitted draft is synced immediately when online")
    void testImmediateSync() {
        // Act
        syncQueue.submit(draft("https://example.com/a", 42));

        // Assert
        assertEquals(1, apiClient.updates.size());
        assertTrue(buffer.pendingConsumption().isEmpty());
        assertEquals(1, buffer.consumptionLogs().size());
        assertEquals(START, syncQueue.getLastFlushAt());
    }

    @Test
    @DisplayName("Failed sync keeps the draft buffered until the next periodic flush")
    void testRetryOnPeriodicFlush() {
        // Arrange
        syncQueue.start();
        apiClient.setOffline(true);
        syncQueue.submit(draft("https://example.com/a", 42));

        List<BufferedEntry<ConsumptionDraft>> pending = buffer.pendingConsumption();
        assertEquals(1, pending.size());
        assertEquals(1, pending.get(0).getAttempts());

        // Act
        apiClient.setOffline(false);
        scheduler.advance(Duration.ofSeconds(30));

        // Assert
        assertEquals(1, apiClient.updates.size());
        assertTrue(buffer.pendingConsumption().isEmpty());
        assertEquals(START.plusSeconds(30), syncQueue.getLastFlushAt());
    }

    @Test
    @DisplayName("Next submission retries earlier failures oldest first")
    void testRetryOnNextMutation() {
        apiClient.setOffline(true);
        syncQueue.submit(draft("https://example.com/first", 20));

        apiClient.setOffline(false);
        syncQueue.submit(draft("https://example.com/second", 30));

        assertEquals(2, apiClient.updates.size());
        assertEquals("https://example.com/first", apiClient.updates.get(0).getUrl());
        assertEquals("https://example.com/second", apiClient.updates.get(1).getUrl());
    }

    @Test
    @DisplayName("Starting twice arms a single periodic flush")
    void testSingleTimer() {
        syncQueue.start();
        syncQueue.start();

        assertEquals(1, scheduler.activePeriodicTasks());
        assertTrue(syncQueue.isRunning());

        syncQueue.stop();
        assertEquals(0, scheduler.activePeriodicTasks());
        assertFalse(syncQueue.isRunning());
    }

    @Test
    @DisplayName("Unload flush only sends drafts above the logging threshold")
    void testUnloadFlushThreshold() {
        // Arrange
        syncQueue.enqueue(draft("https://example.com/short", 8));
        syncQueue.enqueue(draft("https://example.com/long", 45));

        // Act
        int synced = syncQueue.flushOnUnload();

        // Assert
        assertEquals(1, synced);
        assertEquals("https://example.com/long", apiClient.updates.get(0).getUrl());
        assertEquals(1, buffer.pendingConsumption().size());
    }

    @Test
    @DisplayName("Unload flush attempts every draft even after a failure")
    void testUnloadFlushContinuesAfterFailure() {
        apiClient.setOffline(true);
        syncQueue.enqueue(draft("https://example.com/a", 45));
        syncQueue.enqueue(draft("https://example.com/b", 45));

        int synced = syncQueue.flushOnUnload();

        assertEquals(0, synced);
        assertEquals(2, apiClient.failedUpdates);
        assertEquals(2, buffer.pendingConsumption().size());
    }

    @Test
    @DisplayName("Draft refused by the server does not block later drafts")
    void testRejectedDraftDoesNotBlockQueue() {
        // Arrange
        syncQueue.start();
        apiClient.setMaxUrlChars(2048);
        syncQueue.submit(draft("https://example.com/a?utm=" + "x".repeat(3000), 42));

        // Act
        for (int i = 0; i < 5; i++) {
            syncQueue.submit(draft("https://example.com/ok-" + i, 42));
            scheduler.advance(Duration.ofSeconds(30));
        }

        // Assert
        assertEquals(5, apiClient.updates.size());
        assertEquals("https://example.com/ok-0", apiClient.updates.get(0).getUrl());
        assertEquals(1, apiClient.rejectedUpdates);
        assertTrue(buffer.pendingConsumption().isEmpty());
        BufferedEntry<ConsumptionDraft> rejected = buffer.consumptionLogs().get(0);
        assertTrue(rejected.isRejected());
        assertFalse(rejected.isSynced());
    }

    @Test
    @DisplayName("Transient failure still stops the flush at the oldest draft")
    void testTransientFailureStopsFlush() {
        apiClient.setOffline(true);
        syncQueue.enqueue(draft("https://example.com/a", 42));
        syncQueue.enqueue(draft("https://example.com/b", 42));

        int synced = syncQueue.flush();

        assertEquals(0, synced);
        assertEquals(1, apiClient.failedUpdates);
        assertEquals(2, buffer.pendingConsumption().size());
    }

    private static ConsumptionDraft draft(String url, long seconds) {
        return ConsumptionDraft.builder()
                .url(url)
                .title("Title")
                .domain("example.com")
                .contentType(ContentType.ARTICLE)
                .timeSpentSeconds(seconds)
                .scrollDepthPercent(40)
                .capturedAt(START)
                .build();
    }
}
