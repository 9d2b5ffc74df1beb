package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.ConsumptionRecord;
import com.truthlens.entity.ContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConsumptionRecordResponse {

    private UUID id;

    private ContentType contentType;

    private String contentUrl;

    private String contentTitle;

    private long timeSpent;

    private Integer scrollDepthPercent;

    private Double credibilityScore;

    private Double biasScore;

    private Instant consumedAt;

    public static ConsumptionRecordResponse from(ConsumptionRecord record) {
        return ConsumptionRecordResponse.builder()
                .id(record.getId())
                .contentType(record.getContentType())
                .contentUrl(record.getContentUrl())
                .contentTitle(record.getContentTitle())
                .timeSpent(record.getTimeSpentSeconds())
                .scrollDepthPercent(record.getScrollDepthPercent())
                .credibilityScore(record.getCredibilityScore())
                .biasScore(record.getBiasScore())
                .consumedAt(record.getConsumedAt())
                .build();
    }
}
