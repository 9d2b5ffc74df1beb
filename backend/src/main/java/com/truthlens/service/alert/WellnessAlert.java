package com.truthlens.service.alert;

import com.truthlens.entity.NotificationCategory;
import com.truthlens.entity.NotificationPriority;
import com.truthlens.entity.NotificationType;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * A threshold crossing that should become a user-visible notification.
 *
 * Each subclass is one kind of check and knows its own dedupe key, message
 * and payload. Title, category and priority default to the values fixed on
 * the {@link NotificationType}.
 *
 * The dedupe key is scoped by the emitter to (user, local date); subclasses
 * only return the part that identifies the check itself.
 */
public abstract class WellnessAlert {

    public abstract NotificationType kind();

    /**
     * Identity of the check within one user's day, e.g.
     * {@code CONTENT_LIMIT_EXCEEDED#time}.
     */
    public abstract String checkKey();

    public abstract String message();

    /**
     * Structured details stored in the notification's {@code data} column.
     */
    public abstract Map<String, Object> payload();

    public String title() {
        return kind().getTitle();
    }

    public NotificationPriority priority() {
        return kind().getDefaultPriority();
    }

    public NotificationCategory category() {
        return kind().getCategory();
    }

    /**
     * How long the notification stays visible, empty for no expiry.
     */
    public Optional<Duration> expiresAfter() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + checkKey() + "]";
    }
}
