package com.truthlens.service;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationType;
import com.truthlens.exception.ErrorCategory;
import com.truthlens.exception.MonitoringException;
import com.truthlens.service.alert.BreakReminderAlert;
import com.truthlens.service.alert.ContentLimitAlert;
import com.truthlens.service.alert.ContentLimitAlert.LimitMetric;
import com.truthlens.service.alert.WellnessGoalAlert;
import com.truthlens.support.InMemoryNotificationStore;
import com.truthlens.support.MutableClock;
import com.truthlens.support.RecordingNotificationFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NotificationService Unit Tests")
class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-06T09:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 5, 6);

    private MutableClock clock;
    private InMemoryNotificationStore store;
    private NotificationEmitter emitter;
    private NotificationService service;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryNotificationStore(clock);
        emitter = new NotificationEmitter(store, new RecordingNotificationFeed(), clock);
        service = new NotificationService(store, clock);
        userId = UUID.randomUUID();
    }

    private Notification emitLimit(LimitMetric metric) {
        clock.advance(Duration.ofSeconds(1));
        return emitter.emit(userId, new ContentLimitAlert(metric, 10, 10, true), DAY).orElseThrow();
    }

    @Test
    @DisplayName("list should return notifications newest first with the unread count")
    void testList_NewestFirst() {
        // Arrange
        Notification first = emitLimit(LimitMetric.TIME);
        Notification second = emitLimit(LimitMetric.ARTICLES);
        Notification third = emitLimit(LimitMetric.VIDEOS);
        emitter.emit(UUID.randomUUID(), new ContentLimitAlert(LimitMetric.TIME, 1, 1, true), DAY);

        // Act
        NotificationPage page = service.list(userId, false, null, 0, 20);

        // Assert
        assertEquals(List.of(third.getId(), second.getId(), first.getId()),
                List.of(page.getNotifications().get(0).getId(),
                        page.getNotifications().get(1).getId(),
                        page.getNotifications().get(2).getId()));
        assertEquals(3, page.getTotalElements());
        assertEquals(1, page.getTotalPages());
        assertEquals(3, page.getUnreadCount());
    }

    @Test
    @DisplayName("list should page through results")
    void testList_Paging() {
        // Arrange
        emitLimit(LimitMetric.TIME);
        emitLimit(LimitMetric.ARTICLES);
        Notification oldest = store.all().get(0);
        emitLimit(LimitMetric.VIDEOS);

        // Act
        NotificationPage page = service.list(userId, false, null, 1, 2);

        // Assert
        assertEquals(1, page.getNotifications().size());
        assertEquals(oldest.getId(), page.getNotifications().get(0).getId());
        assertEquals(2, page.getTotalPages());
    }

    @Test
    @DisplayName("expired notifications should be hidden from the list and the unread count")
    void testList_ExcludesExpired() {
        // Arrange
        emitter.emit(userId, new BreakReminderAlert(1, 0, 30, 30), DAY);
        emitLimit(LimitMetric.TIME);
        clock.advance(Duration.ofDays(1).plusMinutes(1));

        // Act
        NotificationPage page = service.list(userId, false, null, 0, 20);

        // Assert
        assertEquals(1, page.getNotifications().size());
        assertEquals(NotificationType.CONTENT_LIMIT_EXCEEDED, page.getNotifications().get(0).getType());
        assertEquals(1, page.getUnreadCount());
    }

    @Test
    @DisplayName("list should filter by unread state and by type")
    void testList_Filters() {
        // Arrange
        Notification limit = emitLimit(LimitMetric.TIME);
        emitter.emit(userId, new WellnessGoalAlert("time_management", true, 10.0), DAY);
        service.markRead(userId, List.of(limit.getId()), false);

        // Act
        NotificationPage unread = service.list(userId, true, null, 0, 20);
        NotificationPage limits = service.list(userId, false, NotificationType.CONTENT_LIMIT_EXCEEDED, 0, 20);

        // Assert
        assertEquals(1, unread.getNotifications().size());
        assertEquals(NotificationType.WELLNESS_GOAL_ACHIEVED, unread.getNotifications().get(0).getType());
        assertEquals(1, limits.getNotifications().size());
        assertTrue(limits.getNotifications().get(0).isRead());
        assertEquals(1, limits.getUnreadCount());
    }

    @Test
    @DisplayName("list should reject a negative page and an out of range limit")
    void testList_Validation() {
        // Act
        MonitoringException badPage = assertThrows(MonitoringException.class,
                () -> service.list(userId, false, null, -1, 20));
        MonitoringException badLimit = assertThrows(MonitoringException.class,
                () -> service.list(userId, false, null, 0, 101));

        // Assert
        assertTrue(badPage.getFieldErrors().containsKey("page"));
        assertTrue(badLimit.getFieldErrors().containsKey("limit"));
    }

    @Test
    @DisplayName("markRead should only change the given notifications of the user")
    void testMarkRead_ByIds() {
        // Arrange
        Notification mine = emitLimit(LimitMetric.TIME);
        emitLimit(LimitMetric.ARTICLES);
        Notification foreign = emitter.emit(UUID.randomUUID(),
                new ContentLimitAlert(LimitMetric.TIME, 1, 1, true), DAY).orElseThrow();

        // Act
        int updated = service.markRead(userId, List.of(mine.getId(), foreign.getId()), false);

        // Assert
        assertEquals(1, updated);
        assertTrue(mine.isRead());
        assertFalse(foreign.isRead());
        assertEquals(1, service.list(userId, false, null, 0, 20).getUnreadCount());
    }

    @Test
    @DisplayName("markRead with markAll should read every notification of the user")
    void testMarkRead_All() {
        // Arrange
        emitLimit(LimitMetric.TIME);
        emitLimit(LimitMetric.ARTICLES);

        // Act
        int updated = service.markRead(userId, null, true);

        // Assert
        assertEquals(2, updated);
        assertEquals(0, service.list(userId, false, null, 0, 20).getUnreadCount());
    }

    @Test
    @DisplayName("markRead without ids and without markAll should be rejected")
    void testMarkRead_NoIds() {
        // Act
        MonitoringException exception = assertThrows(MonitoringException.class,
                () -> service.markRead(userId, List.of(), false));

        // Assert
        assertEquals(ErrorCategory.VALIDATION, exception.getCategory());
        assertTrue(exception.getFieldErrors().containsKey("notification_ids"));
    }

    @Test
    @DisplayName("delete should remove the notification but keep its dedupe key")
    void testDelete() {
        // Arrange
        Notification notification = emitLimit(LimitMetric.TIME);

        // Act
        service.delete(userId, notification.getId());

        // Assert
        assertTrue(store.all().isEmpty());
        assertEquals(1, store.dedupeKeys().size());
    }

    @Test
    @DisplayName("delete should report NOT_FOUND for unknown or foreign notifications")
    void testDelete_NotFound() {
        // Arrange
        Notification foreign = emitter.emit(UUID.randomUUID(),
                new ContentLimitAlert(LimitMetric.TIME, 1, 1, true), DAY).orElseThrow();

        // Act
        MonitoringException unknown = assertThrows(MonitoringException.class,
                () -> service.delete(userId, UUID.randomUUID()));
        MonitoringException notMine = assertThrows(MonitoringException.class,
                () -> service.delete(userId, foreign.getId()));

        // Assert
        assertEquals(ErrorCategory.NOT_FOUND, unknown.getCategory());
        assertEquals(ErrorCategory.NOT_FOUND, notMine.getCategory());
        assertEquals(1, store.all().size());
    }

    @Test
    @DisplayName("purgeExpired should only remove expired notifications")
    void testPurgeExpired() {
        // Arrange
        emitter.emit(userId, new BreakReminderAlert(1, 0, 30, 30), DAY);
        emitter.emit(userId, new WellnessGoalAlert("time_management", false, 200.0), DAY);
        emitLimit(LimitMetric.TIME);
        clock.advance(Duration.ofDays(2));

        // Act
        int purged = service.purgeExpired();

        // Assert
        assertEquals(2, purged);
        assertEquals(1, store.all().size());
    }
}
