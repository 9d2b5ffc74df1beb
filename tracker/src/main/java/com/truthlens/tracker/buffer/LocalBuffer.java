package com.truthlens.tracker.buffer;

import com.truthlens.tracker.sync.ConsumptionDraft;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Client-side store holding the two independent ring buffers: analysis
 * history and consumption logs.
 *
 * Consumption entries stay in the buffer after a successful sync, flagged as
 * synced, until they are evicted. Entries the server refused are flagged as
 * rejected and never retried. The remaining entries are the retry set of the
 * sync queue.
 */
@Slf4j
public class LocalBuffer {

    private final RingBuffer<AnalysisHistoryEntry> analysisHistory;
    private final RingBuffer<BufferedEntry<ConsumptionDraft>> consumptionLogs;

    public LocalBuffer(int analysisHistoryCapacity, int consumptionLogCapacity) {
        this.analysisHistory = new RingBuffer<>(analysisHistoryCapacity);
        this.consumptionLogs = new RingBuffer<>(consumptionLogCapacity);
    }

    public void recordAnalysis(AnalysisHistoryEntry entry) {
        analysisHistory.add(entry)
                .ifPresent(evicted -> log.debug("Evicted analysis history entry: url={}", evicted.getUrl()));
    }

    public BufferedEntry<ConsumptionDraft> recordConsumption(ConsumptionDraft draft, Instant now) {
        BufferedEntry<ConsumptionDraft> entry = new BufferedEntry<>(draft, now);
        consumptionLogs.add(entry).ifPresent(evicted -> {
            if (!evicted.isSynced() && !evicted.isRejected()) {
                log.warn("Dropped unsynced consumption draft: url={}, attempts={}",
                        evicted.getPayload().getUrl(), evicted.getAttempts());
            }
        });
        return entry;
    }

    /** Consumption entries still to be sent, oldest first. */
    public List<BufferedEntry<ConsumptionDraft>> pendingConsumption() {
        return consumptionLogs.snapshot().stream()
                .filter(entry -> !entry.isSynced() && !entry.isRejected())
                .collect(Collectors.toList());
    }

    public void markAttempt(BufferedEntry<ConsumptionDraft> entry, Instant at, boolean success) {
        entry.markAttempt(at, success);
    }

    public void markRejected(BufferedEntry<ConsumptionDraft> entry, Instant at) {
        entry.markRejected(at);
    }

    public List<AnalysisHistoryEntry> analysisHistory() {
        return analysisHistory.snapshot();
    }

    public List<BufferedEntry<ConsumptionDraft>> consumptionLogs() {
        return consumptionLogs.snapshot();
    }
}
