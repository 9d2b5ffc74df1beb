package com.truthlens.service;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationType;
import com.truthlens.exception.MonitoringException;
import com.truthlens.store.NotificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

/**
 * Read side of notifications: listing, read state, deletion and expiry.
 *
 * Read state and deletion only touch the notification row; the dedupe key
 * that produced it stays in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    static final int MAX_PAGE_SIZE = 100;

    private final NotificationStore notificationStore;
    private final Clock clock;

    /**
     * Non-expired notifications of the user, newest first, with the unread count.
     *
     * @param type optional type filter, null for all types
     */
    @Transactional(readOnly = true)
    public NotificationPage list(UUID userId, boolean unreadOnly, NotificationType type, int page, int size) {
        if (page < 0) {
            throw MonitoringException.validation("page", "Page must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw MonitoringException.validation("limit", "Limit must be between 1 and " + MAX_PAGE_SIZE);
        }

        Instant now = clock.instant();
        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Notification> result = notificationStore.findVisible(userId, unreadOnly, type, now, pageRequest);
        long unread = notificationStore.countUnread(userId, now);

        log.debug("Listed notifications: userId={}, page={}, size={}, returned={}, unread={}",
                userId, page, size, result.getNumberOfElements(), unread);

        return NotificationPage.builder()
                .notifications(result.getContent())
                .page(page)
                .size(size)
                .totalElements(result.getTotalElements())
                .totalPages(result.getTotalPages())
                .unreadCount(unread)
                .build();
    }

    /**
     * Mark the given notifications, or all of them, as read.
     *
     * @return number of notifications changed
     */
    @Transactional
    public int markRead(UUID userId, Collection<UUID> notificationIds, boolean markAll) {
        Instant now = clock.instant();
        int updated;
        if (markAll) {
            updated = notificationStore.markAllRead(userId, now);
        } else {
            if (notificationIds == null || notificationIds.isEmpty()) {
                throw MonitoringException.validation("notification_ids",
                        "Provide notification ids or set mark_all_as_read");
            }
            updated = notificationStore.markRead(userId, notificationIds, now);
        }

        log.info("Notifications marked as read: userId={}, markAll={}, updated={}", userId, markAll, updated);
        return updated;
    }

    /**
     * Delete one notification of the user.
     *
     * @throws MonitoringException with category NOT_FOUND if the user has no such notification
     */
    @Transactional
    public void delete(UUID userId, UUID notificationId) {
        Notification notification = notificationStore.find(userId, notificationId)
                .orElseThrow(() -> MonitoringException.notFound("Notification", notificationId));

        notificationStore.delete(notification);
        log.info("Notification deleted: userId={}, notificationId={}, checkKey={}",
                userId, notificationId, notification.getCheckKey());
    }

    /**
     * @return number of expired notifications removed
     */
    @Transactional
    public int purgeExpired() {
        int purged = notificationStore.deleteExpired(clock.instant());
        if (purged > 0) {
            log.info("Purged expired notifications: count={}", purged);
        }
        return purged;
    }
}
