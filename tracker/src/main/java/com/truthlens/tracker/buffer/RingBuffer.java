package com.truthlens.tracker.buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded FIFO buffer holding the last {@code capacity} entries.
 *
 * Insertion is O(1); at capacity the oldest entry is evicted and returned to
 * the caller.
 */
public final class RingBuffer<T> {

    private final int capacity;
    private final Deque<T> ring;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ring = new ArrayDeque<>(capacity);
    }

    /**
     * Append an entry.
     *
     * @return the evicted oldest entry, or empty when there was room
     */
    public synchronized Optional<T> add(T entry) {
        T evicted = null;
        if (ring.size() == capacity) {
            evicted = ring.removeFirst();
        }
        ring.addLast(entry);
        return Optional.ofNullable(evicted);
    }

    /** Entries oldest first. */
    public synchronized List<T> snapshot() {
        return new ArrayList<>(ring);
    }

    public synchronized int size() {
        return ring.size();
    }

    public int capacity() {
        return capacity;
    }
}
