package com.truthlens.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.truthlens.service.NotificationPage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationListResponse {

    private List<NotificationResponse> notifications;

    private Pagination pagination;

    private long unreadCount;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int totalPages;
    }

    public static NotificationListResponse from(NotificationPage page) {
        return NotificationListResponse.builder()
                .notifications(page.getNotifications().stream()
                        .map(NotificationResponse::from)
                        .collect(Collectors.toList()))
                .pagination(new Pagination(page.getPage(), page.getSize(),
                        page.getTotalElements(), page.getTotalPages()))
                .unreadCount(page.getUnreadCount())
                .build();
    }
}
