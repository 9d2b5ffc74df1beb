package com.truthlens.store;

import com.truthlens.entity.ConsumptionRecord;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only storage of consumption records.
 */
public interface ConsumptionLogStore {

    ConsumptionRecord append(ConsumptionRecord record);

    /**
     * All records of the user in [from, to), oldest first.
     */
    List<ConsumptionRecord> findInWindow(UUID userId, Instant from, Instant to);

    /**
     * At most {@code limit} records carrying a credibility or bias score, newest first.
     */
    List<ConsumptionRecord> findRecentScored(UUID userId, Instant from, Instant to, int limit);
}
