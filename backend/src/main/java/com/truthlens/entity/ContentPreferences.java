package com.truthlens.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Stored content limits and wellness settings of a user. At most one row per
 * user; a missing row means the defaults apply.
 */
@Entity
@Table(name = "content_preferences")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentPreferences {

    @Id
    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID userId;

    @Column(name = "daily_time_limit_minutes", nullable = false)
    private int dailyTimeLimitMinutes;

    @Column(name = "daily_article_limit", nullable = false)
    private int dailyArticleLimit;

    @Column(name = "daily_video_limit", nullable = false)
    private int dailyVideoLimit;

    @Column(name = "daily_social_limit", nullable = false)
    private int dailySocialLimit;

    @Column(name = "min_credibility_score", nullable = false)
    private double minCredibilityScore;

    @Column(name = "max_bias_score", nullable = false)
    private double maxBiasScore;

    @Column(name = "break_reminders_enabled", nullable = false)
    private boolean breakRemindersEnabled;

    @Column(name = "break_interval_minutes", nullable = false)
    private int breakIntervalMinutes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "wellness_goals", columnDefinition = "jsonb")
    private List<String> wellnessGoals;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "preferred_content_types", columnDefinition = "jsonb")
    private List<String> preferredContentTypes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "avoided_content_types", columnDefinition = "jsonb")
    private List<String> avoidedContentTypes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
