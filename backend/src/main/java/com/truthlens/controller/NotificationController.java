package com.truthlens.controller;

import com.truthlens.dto.request.MarkReadRequest;
import com.truthlens.dto.response.NotificationListResponse;
import com.truthlens.entity.NotificationType;
import com.truthlens.security.AuthenticatedUser;
import com.truthlens.service.NotificationService;
import com.truthlens.service.NotificationStreamRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.UUID;

/**
 * Notification inbox and real-time stream.
 *
 * The list uses 1-based pages like the dashboard; the stream pushes each new
 * notification as a {@code notification} event, after an initial
 * {@code connected} event.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationStreamRegistry streamRegistry;

    @GetMapping
    public ResponseEntity<NotificationListResponse> listNotifications(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly,
            @RequestParam(name = "type", required = false) NotificationType type,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        return ResponseEntity.ok(NotificationListResponse.from(
                notificationService.list(userId, unreadOnly, type, page - 1, limit)));
    }

    @PatchMapping("/read")
    public ResponseEntity<Map<String, Object>> markAsRead(
            @Valid @RequestBody MarkReadRequest request,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        int updated = notificationService.markRead(userId, request.getNotificationIds(), request.isMarkAllAsRead());
        return ResponseEntity.ok(Map.of("success", true, "updated", updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteNotification(
            @PathVariable UUID id,
            Authentication authentication) {

        UUID userId = AuthenticatedUser.idOf(authentication);
        notificationService.delete(userId, id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamNotifications(Authentication authentication) {
        UUID userId = AuthenticatedUser.idOf(authentication);
        log.info("Notification stream requested: userId={}", userId);
        return streamRegistry.register(userId);
    }
}
