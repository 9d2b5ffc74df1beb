package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationCategory;
import com.truthlens.entity.NotificationPriority;
import com.truthlens.entity.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification as returned by the API and pushed over the real-time feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationResponse {

    private UUID id;

    private UUID userId;

    private NotificationType type;

    private NotificationCategory category;

    private String title;

    private String message;

    private Map<String, Object> data;

    private NotificationPriority priority;

    private boolean read;

    private Instant expiresAt;

    private Instant createdAt;

    public static NotificationResponse from(Notification notification) {
        return NotificationResponse.builder()
                .id(notification.getId())
                .userId(notification.getUserId())
                .type(notification.getType())
                .category(notification.getCategory())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .data(notification.getData())
                .priority(notification.getPriority())
                .read(notification.isRead())
                .expiresAt(notification.getExpiresAt())
                .createdAt(notification.getCreatedAt())
                .build();
    }
}
