package com.truthlens.store.jpa;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.repository.ConsumptionRecordRepository;
import com.truthlens.store.ConsumptionLogStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaConsumptionLogStore implements ConsumptionLogStore {

    private final ConsumptionRecordRepository repository;

    @Override
    public ConsumptionRecord append(ConsumptionRecord record) {
        return repository.save(record);
    }

    @Override
    public List<ConsumptionRecord> findInWindow(UUID userId, Instant from, Instant to) {
        return repository.findInWindow(userId, from, to);
    }

    @Override
    public List<ConsumptionRecord> findRecentScored(UUID userId, Instant from, Instant to, int limit) {
        return repository.findRecentScoredInWindow(userId, from, to, PageRequest.of(0, limit));
    }
}
