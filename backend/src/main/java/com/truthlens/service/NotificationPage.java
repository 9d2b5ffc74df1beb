package com.truthlens.service;

import com.truthlens.entity.Notification;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class NotificationPage {
    List<Notification> notifications;
    int page;
    int size;
    long totalElements;
    int totalPages;
    long unreadCount;
}
