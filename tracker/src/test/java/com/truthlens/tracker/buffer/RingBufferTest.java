package com.truthlens.tracker.buffer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RingBuffer Unit Tests")
class RingBufferTest {

    @Test
    @DisplayName("Inserting capacity + 1 entries keeps capacity entries and evicts the oldest")
    void testEvictsOldestAtCapacity() {
        // Arrange
        RingBuffer<Integer> buffer = new RingBuffer<>(3);
        buffer.add(1);
        buffer.add(2);
        buffer.add(3);

        // Act
        Optional<Integer> evicted = buffer.add(4);

        // Assert
        assertEquals(Optional.of(1), evicted);
        assertEquals(3, buffer.size());
        assertEquals(List.of(2, 3, 4), buffer.snapshot());
    }

    @Test
    @DisplayName("Adding below capacity evicts nothing")
    void testNoEvictionBelowCapacity() {
        RingBuffer<String> buffer = new RingBuffer<>(2);

        assertTrue(buffer.add("a").isEmpty());
        assertEquals(List.of("a"), buffer.snapshot());
        assertEquals(2, buffer.capacity());
    }

    @Test
    @DisplayName("Non-positive capacity is rejected")
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RingBuffer<>(0));
    }
}
