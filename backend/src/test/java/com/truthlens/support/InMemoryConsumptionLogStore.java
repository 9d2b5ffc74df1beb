package com.truthlens.support;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.store.ConsumptionLogStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

public class InMemoryConsumptionLogStore implements ConsumptionLogStore {

    private final List<ConsumptionRecord> records = new ArrayList<>();

    @Override
    public synchronized ConsumptionRecord append(ConsumptionRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID());
        }
        records.add(record);
        return record;
    }

    @Override
    public synchronized List<ConsumptionRecord> findInWindow(UUID userId, Instant from, Instant to) {
        return records.stream()
                .filter(record -> record.getUserId().equals(userId))
                .filter(record -> !record.getConsumedAt().isBefore(from) && record.getConsumedAt().isBefore(to))
                .sorted(Comparator.comparing(ConsumptionRecord::getConsumedAt))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ConsumptionRecord> findRecentScored(UUID userId, Instant from, Instant to, int limit) {
        List<ConsumptionRecord> window = findInWindow(userId, from, to);
        Collections.reverse(window);
        return window.stream().filter(ConsumptionRecord::isScored).limit(limit).collect(Collectors.toList());
    }

    public synchronized List<ConsumptionRecord> all() {
        return new ArrayList<>(records);
    }
}
