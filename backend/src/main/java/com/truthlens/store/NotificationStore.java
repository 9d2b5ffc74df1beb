package com.truthlens.store;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationDedupeKey;
import com.truthlens.entity.NotificationType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of notifications and their dedupe keys.
 */
public interface NotificationStore {

    boolean dedupeKeyExists(UUID userId, String checkKey, LocalDate localDate);

    void saveDedupeKey(NotificationDedupeKey key);

    Notification save(Notification notification);

    Optional<Notification> find(UUID userId, UUID notificationId);

    /**
     * Non-expired notifications of the user.
     *
     * @param type optional type filter, null for all
     */
    Page<Notification> findVisible(UUID userId, boolean unreadOnly, NotificationType type, Instant now, Pageable pageable);

    long countUnread(UUID userId, Instant now);

    int markRead(UUID userId, Collection<UUID> ids, Instant now);

    int markAllRead(UUID userId, Instant now);

    void delete(Notification notification);

    int deleteExpired(Instant now);
}
