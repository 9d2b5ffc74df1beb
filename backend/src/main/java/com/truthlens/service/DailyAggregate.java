package com.truthlens.service;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.entity.ContentType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Totals of one user's local day, recomputed from raw consumption records.
 */
@Value
@Builder
public class DailyAggregate {

    LocalDate date;
    long totalTimeSeconds;
    int contentCount;
    Map<ContentType, Long> countsByType;

    /** Average over records carrying a credibility score, null if none. */
    Double averageCredibility;

    /** Average over records carrying a bias score, null if none. */
    Double averageBias;

    /** Newest first. */
    List<ConsumptionRecord> recentRecords;

    public long countOf(ContentType type) {
        return countsByType.getOrDefault(type, 0L);
    }

    public long totalTimeMinutes() {
        return totalTimeSeconds / 60;
    }
}
