package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.ContentType;
import com.truthlens.service.DailyAggregate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TodayStatsResponse {

    private LocalDate date;

    /** Seconds. */
    private long totalTime;

    private long totalTimeMinutes;

    private int totalContent;

    private long articles;

    private long videos;

    private long social;

    /** Every content type, zero when not consumed today. */
    private Map<String, Long> contentByType;

    private Double averageCredibility;

    private Double averageBias;

    /** Last ten records, newest first. */
    private List<ConsumptionRecordResponse> recentContent;

    public static TodayStatsResponse from(DailyAggregate aggregate) {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (ContentType type : ContentType.values()) {
            byType.put(type.getWireValue(), aggregate.countOf(type));
        }

        return TodayStatsResponse.builder()
                .date(aggregate.getDate())
                .totalTime(aggregate.getTotalTimeSeconds())
                .totalTimeMinutes(aggregate.totalTimeMinutes())
                .totalContent(aggregate.getContentCount())
                .articles(aggregate.countOf(ContentType.ARTICLE))
                .videos(aggregate.countOf(ContentType.VIDEO))
                .social(aggregate.countOf(ContentType.SOCIAL_POST))
                .contentByType(byType)
                .averageCredibility(aggregate.getAverageCredibility())
                .averageBias(aggregate.getAverageBias())
                .recentContent(aggregate.getRecentRecords().stream()
                        .map(ConsumptionRecordResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
