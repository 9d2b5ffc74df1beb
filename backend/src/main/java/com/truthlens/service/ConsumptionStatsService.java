package com.truthlens.service;

import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.entity.ContentType;
import com.truthlens.store.ConsumptionLogStore;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * Daily aggregates over the consumption log.
 *
 * A "day" is the user's local date in the configured monitoring time zone.
 * Aggregates are never cached; every call recomputes from raw records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsumptionStatsService {

    static final int RECENT_RECORD_LIMIT = 10;

    private final ConsumptionLogStore consumptionLogStore;
    private final Clock clock;
    private final ZoneId zoneId;

    /**
     * Half-open instant range [from, to) of one local date.
     */
    @Value
    public static class DayWindow {
        LocalDate date;
        Instant from;
        Instant to;
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId));
    }

    public DayWindow windowFor(LocalDate date) {
        return new DayWindow(
                date,
                date.atStartOfDay(zoneId).toInstant(),
                date.plusDays(1).atStartOfDay(zoneId).toInstant()
        );
    }

    @Transactional(readOnly = true)
    public DailyAggregate aggregateToday(UUID userId) {
        return aggregate(userId, today());
    }

    @Transactional(readOnly = true)
    public DailyAggregate aggregate(UUID userId, LocalDate date) {
        DayWindow window = windowFor(date);
        List<ConsumptionRecord> records = consumptionLogStore.findInWindow(userId, window.getFrom(), window.getTo());

        long totalSeconds = 0;
        Map<ContentType, Long> counts = new EnumMap<>(ContentType.class);
        for (ConsumptionRecord record : records) {
            totalSeconds += record.getTimeSpentSeconds();
            counts.merge(record.getContentType(), 1L, Long::sum);
        }

        List<ConsumptionRecord> recent = new ArrayList<>(records);
        Collections.reverse(recent);
        if (recent.size() > RECENT_RECORD_LIMIT) {
            recent = recent.subList(0, RECENT_RECORD_LIMIT);
        }

        DailyAggregate aggregate = DailyAggregate.builder()
                .date(date)
                .totalTimeSeconds(totalSeconds)
                .contentCount(records.size())
                .countsByType(Collections.unmodifiableMap(counts))
                .averageCredibility(average(records, ScoreKind.CREDIBILITY))
                .averageBias(average(records, ScoreKind.BIAS))
                .recentRecords(List.copyOf(recent))
                .build();

        log.debug("Computed daily aggregate: userId={}, date={}, records={}, totalSeconds={}",
                userId, date, records.size(), totalSeconds);
        return aggregate;
    }

    /**
     * Most recent records of today that carry a score, newest first.
     */
    @Transactional(readOnly = true)
    public List<ConsumptionRecord> recentScoredToday(UUID userId, int limit) {
        DayWindow window = windowFor(today());
        return consumptionLogStore.findRecentScored(userId, window.getFrom(), window.getTo(), limit);
    }

    public enum ScoreKind {
        CREDIBILITY,
        BIAS
    }

    /**
     * Mean of the present scores of one kind, null when no record carries one.
     */
    public static Double average(List<ConsumptionRecord> records, ScoreKind kind) {
        OptionalDouble average = records.stream()
                .map(record -> kind == ScoreKind.CREDIBILITY ? record.getCredibilityScore() : record.getBiasScore())
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }
}
