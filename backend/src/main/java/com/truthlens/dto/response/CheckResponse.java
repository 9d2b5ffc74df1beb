package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.entity.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of an explicit threshold check: the notifications it emitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CheckResponse {

    private String check;

    private int notificationsEmitted;

    private List<NotificationResponse> notifications;

    public static CheckResponse of(String check, List<Notification> emitted) {
        return CheckResponse.builder()
                .check(check)
                .notificationsEmitted(emitted.size())
                .notifications(emitted.stream().map(NotificationResponse::from).collect(Collectors.toList()))
                .build();
    }
}
