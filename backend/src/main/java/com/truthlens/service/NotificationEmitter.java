package com.truthlens.service;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationDedupeKey;
import com.truthlens.service.alert.WellnessAlert;
import com.truthlens.store.NotificationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns threshold crossings into persisted, deduplicated notifications.
 *
 * Each alert is gated by its dedupe key (user, check key, local date). The
 * key is stored separately from the notification, so reading or deleting a
 * notification never lets the same check fire again that day.
 *
 * Emission is check-then-insert without a unique constraint. Two evaluations
 * of the same user racing past the check can both insert; session mutations
 * are serialised per user, which keeps that window small.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationEmitter {

    private final NotificationStore notificationStore;
    private final NotificationFeed notificationFeed;
    private final Clock clock;

    /**
     * Emit the alert unless its dedupe key was already used on {@code day}.
     *
     * @return the persisted notification, or empty when suppressed
     */
    @Transactional
    public Optional<Notification> emit(UUID userId, WellnessAlert alert, LocalDate day) {
        String checkKey = alert.checkKey();

        // Step 1: Dedupe gate
        if (notificationStore.dedupeKeyExists(userId, checkKey, day)) {
            log.debug("Notification suppressed by dedupe key: userId={}, checkKey={}, date={}",
                    userId, checkKey, day);
            return Optional.empty();
        }

        // Step 2: Persist notification
        Instant now = clock.instant();
        Notification notification = Notification.builder()
                .userId(userId)
                .type(alert.kind())
                .category(alert.category())
                .title(alert.title())
                .message(alert.message())
                .data(alert.payload())
                .priority(alert.priority())
                .expiresAt(alert.expiresAfter().map(now::plus).orElse(null))
                .checkKey(checkKey)
                .dedupeDate(day)
                .build();
        Notification saved = notificationStore.save(notification);

        // Step 3: Record dedupe key
        notificationStore.saveDedupeKey(new NotificationDedupeKey(userId, checkKey, day, saved.getId()));

        // Step 4: Publish to real-time feed after commit
        notificationFeed.publish(saved);

        log.info("Notification emitted: userId={}, type={}, checkKey={}, notificationId={}",
                userId, saved.getType(), checkKey, saved.getId());
        return Optional.of(saved);
    }
}
