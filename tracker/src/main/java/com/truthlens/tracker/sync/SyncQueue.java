package com.truthlens.tracker.sync;

import com.truthlens.tracker.buffer.BufferedEntry;
import com.truthlens.tracker.buffer.LocalBuffer;
import com.truthlens.tracker.scheduler.ScheduledHandle;
import com.truthlens.tracker.scheduler.TrackerScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Moves buffered consumption drafts to the Session API.
 *
 * Every submitted draft is buffered first and then sent in the background.
 * A transient send failure leaves the draft in the buffer; it is retried by
 * the next periodic flush or the next submission, until the ring buffer
 * evicts it. A draft the server refuses outright is marked rejected and
 * skipped, so it never holds back the drafts behind it.
 *
 * There is exactly one periodic flush timer and one {@code lastFlushAt}
 * cursor per queue. Flushes never overlap: a flush requested while another
 * is running is skipped, since the running flush already covers the same
 * pending set.
 */
@Slf4j
public class SyncQueue {

    private final LocalBuffer buffer;
    private final MonitoringApiClient apiClient;
    private final TrackerScheduler scheduler;
    private final Executor networkExecutor;
    private final Clock clock;
    private final Duration flushInterval;
    private final long loggingThresholdSeconds;

    private final AtomicBoolean flushing = new AtomicBoolean(false);
    private ScheduledHandle flushHandle;
    private volatile Instant lastFlushAt;

    public SyncQueue(LocalBuffer buffer, MonitoringApiClient apiClient, TrackerScheduler scheduler,
                     Executor networkExecutor, Clock clock, Duration flushInterval, long loggingThresholdSeconds) {
        this.buffer = buffer;
        this.apiClient = apiClient;
        this.scheduler = scheduler;
        this.networkExecutor = networkExecutor;
        this.clock = clock;
        this.flushInterval = flushInterval;
        this.loggingThresholdSeconds = loggingThresholdSeconds;
    }

    /**
     * Arm the periodic flush. Calling it again while armed is a no-op.
     */
    public synchronized void start() {
        if (flushHandle != null && !flushHandle.isCancelled()) {
            return;
        }
        flushHandle = scheduler.scheduleAtFixedRate(this::flushAsync, flushInterval, flushInterval);
        log.debug("Sync queue started: interval={}", flushInterval);
    }

    public synchronized void stop() {
        if (flushHandle != null) {
            flushHandle.cancel();
            flushHandle = null;
        }
    }

    public synchronized boolean isRunning() {
        return flushHandle != null && !flushHandle.isCancelled();
    }

    /**
     * Buffer a draft and attempt to send everything pending.
     */
    public void submit(ConsumptionDraft draft) {
        enqueue(draft);
        flushAsync();
    }

    /**
     * Buffer a draft without triggering a send.
     */
    public void enqueue(ConsumptionDraft draft) {
        buffer.recordConsumption(draft, clock.instant());
    }

    public void flushAsync() {
        networkExecutor.execute(this::flush);
    }

    /**
     * Send pending drafts oldest first, stopping at the first transient
     * failure so an offline client does not hammer the server.
     *
     * @return number of drafts synced by this call
     */
    public int flush() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Flush already in progress, skipping");
            return 0;
        }
        try {
            return send(buffer.pendingConsumption(), true);
        } finally {
            lastFlushAt = clock.instant();
            flushing.set(false);
        }
    }

    /**
     * Best-effort synchronous flush run when the page or tracker goes away.
     * Only drafts above the logging threshold are worth the blocking calls;
     * failures are logged and the drafts stay buffered.
     *
     * @return number of drafts synced
     */
    public int flushOnUnload() {
        if (!flushing.compareAndSet(false, true)) {
            log.debug("Unload flush skipped, background flush in progress");
            return 0;
        }
        try {
            List<BufferedEntry<ConsumptionDraft>> pending = buffer.pendingConsumption().stream()
                    .filter(entry -> entry.getPayload().getTimeSpentSeconds() > loggingThresholdSeconds)
                    .collect(Collectors.toList());
            return send(pending, false);
        } finally {
            lastFlushAt = clock.instant();
            flushing.set(false);
        }
    }

    private int send(List<BufferedEntry<ConsumptionDraft>> pending, boolean stopOnFailure) {
        int synced = 0;
        for (BufferedEntry<ConsumptionDraft> entry : pending) {
            try {
                apiClient.updateSession(entry.getPayload());
                buffer.markAttempt(entry, clock.instant(), true);
                synced++;
            } catch (SyncException e) {
                if (e.isPermanent()) {
                    buffer.markRejected(entry, clock.instant());
                    log.warn("Draft rejected by server, dropping: url={}, error={}",
                            entry.getPayload().getUrl(), e.getMessage());
                    continue;
                }
                buffer.markAttempt(entry, clock.instant(), false);
                log.warn("Sync failed, draft stays buffered: url={}, attempts={}, error={}",
                        entry.getPayload().getUrl(), entry.getAttempts(), e.getMessage());
                if (stopOnFailure) {
                    break;
                }
            }
        }
        if (!pending.isEmpty()) {
            log.debug("Flush finished: pending={}, synced={}", pending.size(), synced);
        }
        return synced;
    }

    /** Time of the last completed flush, or null before the first one. */
    public Instant getLastFlushAt() {
        return lastFlushAt;
    }
}
