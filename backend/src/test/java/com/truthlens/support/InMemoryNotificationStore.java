package com.truthlens.support;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationDedupeKey;
import com.truthlens.entity.NotificationType;
import com.truthlens.store.NotificationStore;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

public class InMemoryNotificationStore implements NotificationStore {

    private final List<Notification> notifications = new ArrayList<>();
    private final List<NotificationDedupeKey> dedupeKeys = new ArrayList<>();
    private final Clock clock;

    public InMemoryNotificationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized boolean dedupeKeyExists(UUID userId, String checkKey, LocalDate localDate) {
        return dedupeKeys.stream().anyMatch(key -> key.getUserId().equals(userId)
                && key.getCheckKey().equals(checkKey)
                && key.getLocalDate().equals(localDate));
    }

    @Override
    public synchronized void saveDedupeKey(NotificationDedupeKey key) {
        if (key.getId() == null) {
            key.setId(UUID.randomUUID());
        }
        dedupeKeys.add(key);
    }

    @Override
    public synchronized Notification save(Notification notification) {
        if (notification.getId() == null) {
            notification.setId(UUID.randomUUID());
            notification.setCreatedAt(clock.instant());
            notifications.add(notification);
        }
        notification.setUpdatedAt(clock.instant());
        return notification;
    }

    @Override
    public synchronized Optional<Notification> find(UUID userId, UUID notificationId) {
        return notifications.stream()
                .filter(n -> n.getId().equals(notificationId) && n.getUserId().equals(userId))
                .findFirst();
    }

    @Override
    public synchronized Page<Notification> findVisible(UUID userId, boolean unreadOnly, NotificationType type,
                                                       Instant now, Pageable pageable) {
        List<Notification> visible = new ArrayList<>();
        for (int i = notifications.size() - 1; i >= 0; i--) {
            Notification n = notifications.get(i);
            if (n.getUserId().equals(userId)
                    && !n.isExpiredAt(now)
                    && (!unreadOnly || !n.isRead())
                    && (type == null || n.getType() == type)) {
                visible.add(n);
            }
        }
        visible.sort(Comparator.comparing(Notification::getCreatedAt).reversed());

        int from = (int) Math.min(pageable.getOffset(), visible.size());
        int to = Math.min(from + pageable.getPageSize(), visible.size());
        return new PageImpl<>(new ArrayList<>(visible.subList(from, to)), pageable, visible.size());
    }

    @Override
    public synchronized long countUnread(UUID userId, Instant now) {
        return notifications.stream()
                .filter(n -> n.getUserId().equals(userId) && !n.isRead() && !n.isExpiredAt(now))
                .count();
    }

    @Override
    public synchronized int markRead(UUID userId, Collection<UUID> ids, Instant now) {
        int updated = 0;
        for (Notification n : notifications) {
            if (n.getUserId().equals(userId) && ids.contains(n.getId()) && !n.isRead()) {
                n.setRead(true);
                n.setUpdatedAt(now);
                updated++;
            }
        }
        return updated;
    }

    @Override
    public synchronized int markAllRead(UUID userId, Instant now) {
        int updated = 0;
        for (Notification n : notifications) {
            if (n.getUserId().equals(userId) && !n.isRead()) {
                n.setRead(true);
                n.setUpdatedAt(now);
                updated++;
            }
        }
        return updated;
    }

    @Override
    public synchronized void delete(Notification notification) {
        notifications.removeIf(n -> n.getId().equals(notification.getId()));
    }

    @Override
    public synchronized int deleteExpired(Instant now) {
        int before = notifications.size();
        notifications.removeIf(n -> n.isExpiredAt(now));
        return before - notifications.size();
    }

    public synchronized List<Notification> all() {
        return new ArrayList<>(notifications);
    }

    public synchronized List<Notification> ofType(NotificationType type) {
        return notifications.stream().filter(n -> n.getType() == type).collect(Collectors.toList());
    }

    public synchronized List<NotificationDedupeKey> dedupeKeys() {
        return new ArrayList<>(dedupeKeys);
    }
}
