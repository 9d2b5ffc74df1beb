package com.truthlens.store.jpa;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationDedupeKey;
import com.truthlens.entity.NotificationType;
import com.truthlens.repository.NotificationDedupeKeyRepository;
import com.truthlens.repository.NotificationRepository;
import com.truthlens.store.NotificationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaNotificationStore implements NotificationStore {

    private final NotificationRepository notificationRepository;
    private final NotificationDedupeKeyRepository dedupeKeyRepository;

    @Override
    public boolean dedupeKeyExists(UUID userId, String checkKey, LocalDate localDate) {
        return dedupeKeyRepository.existsByUserIdAndCheckKeyAndLocalDate(userId, checkKey, localDate);
    }

    @Override
    public void saveDedupeKey(NotificationDedupeKey key) {
        dedupeKeyRepository.save(key);
    }

    @Override
    public Notification save(Notification notification) {
        return notificationRepository.save(notification);
    }

    @Override
    public Optional<Notification> find(UUID userId, UUID notificationId) {
        return notificationRepository.findByIdAndUserId(notificationId, userId);
    }

    @Override
    public Page<Notification> findVisible(UUID userId, boolean unreadOnly, NotificationType type,
                                          Instant now, Pageable pageable) {
        return notificationRepository.findVisible(userId, unreadOnly, type, now, pageable);
    }

    @Override
    public long countUnread(UUID userId, Instant now) {
        return notificationRepository.countUnread(userId, now);
    }

    @Override
    public int markRead(UUID userId, Collection<UUID> ids, Instant now) {
        return notificationRepository.markRead(userId, ids, now);
    }

    @Override
    public int markAllRead(UUID userId, Instant now) {
        return notificationRepository.markAllRead(userId, now);
    }

    @Override
    public void delete(Notification notification) {
        notificationRepository.delete(notification);
    }

    @Override
    public int deleteExpired(Instant now) {
        return notificationRepository.deleteExpired(now);
    }
}
