package com.truthlens.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.ContentType;
import com.truthlens.service.SessionUpdate;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/content-monitoring/session/update}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SessionUpdateRequest {

    @NotNull(message = "Content type is required")
    private ContentType contentType;

    /** Seconds; zero or negative values are accepted and ignored. */
    @NotNull(message = "Time spent is required")
    private Long timeSpent;

    @DecimalMin(value = "0.0", message = "Credibility score must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Credibility score must be between 0 and 1")
    private Double credibilityScore;

    @DecimalMin(value = "0.0", message = "Bias score must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Bias score must be between 0 and 1")
    private Double biasScore;

    @Min(value = 0, message = "Scroll depth must be between 0 and 100")
    @Max(value = 100, message = "Scroll depth must be between 0 and 100")
    private Integer scrollDepthPercent;

    @Size(max = 2048, message = "Content URL must not exceed 2048 characters")
    private String contentUrl;

    @Size(max = 500, message = "Content title must not exceed 500 characters")
    private String contentTitle;

    public SessionUpdate toCommand() {
        return SessionUpdate.builder()
                .contentType(contentType)
                .timeSpentSeconds(timeSpent)
                .credibilityScore(credibilityScore)
                .biasScore(biasScore)
                .scrollDepthPercent(scrollDepthPercent)
                .contentUrl(contentUrl)
                .contentTitle(contentTitle)
                .build();
    }
}
