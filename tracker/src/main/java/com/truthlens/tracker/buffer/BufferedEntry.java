package com.truthlens.tracker.buffer;

import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A buffered record plus its sync bookkeeping.
 */
@Getter
public final class BufferedEntry<T> {

    private final UUID id = UUID.randomUUID();
    private final T payload;
    private final Instant bufferedAt;
    private volatile boolean synced;
    private volatile boolean rejected;
    private volatile int attempts;
    private volatile Instant lastAttemptAt;

    public BufferedEntry(T payload, Instant bufferedAt) {
        this.payload = payload;
        this.bufferedAt = bufferedAt;
    }

    synchronized void markAttempt(Instant at, boolean success) {
        attempts++;
        lastAttemptAt = at;
        if (success) {
            synced = true;
        }
    }

    synchronized void markRejected(Instant at) {
        attempts++;
        lastAttemptAt = at;
        rejected = true;
    }
}
