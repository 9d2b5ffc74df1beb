package com.truthlens.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One logged piece of consumed content. Append-only.
 *
 * {@code consumedAt} is the server receipt time; records are ordered by it
 * for chronological views and grouped by the user's local date for the
 * daily aggregates.
 */
@Entity
@Table(name = "consumption_logs", indexes = {
    @Index(name = "idx_consumption_user_consumed_at", columnList = "user_id, consumed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", nullable = false, length = 20)
    private ContentType contentType;

    @Column(name = "content_url", columnDefinition = "TEXT")
    private String contentUrl;

    @Column(name = "content_title", length = 500)
    private String contentTitle;

    @Column(name = "time_spent_seconds", nullable = false)
    private long timeSpentSeconds;

    @Column(name = "scroll_depth_percent")
    private Integer scrollDepthPercent;

    @Column(name = "credibility_score")
    private Double credibilityScore;

    @Column(name = "bias_score")
    private Double biasScore;

    @Column(name = "session_number", nullable = false)
    private int sessionNumber;

    @Column(name = "consumed_at", nullable = false, updatable = false)
    private Instant consumedAt;

    public boolean isScored() {
        return credibilityScore != null || biasScore != null;
    }
}
