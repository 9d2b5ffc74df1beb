package com.truthlens.service.alert;

import com.truthlens.entity.NotificationPriority;
import com.truthlens.entity.NotificationType;
import com.truthlens.service.alert.ContentLimitAlert.LimitMetric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WellnessAlert Unit Tests")
class WellnessAlertTest {

    @Test
    @DisplayName("limit warning should report percentage and use the warning key")
    void testContentLimitAlert_Warning() {
        // Act
        ContentLimitAlert alert = new ContentLimitAlert(LimitMetric.VIDEOS, 4, 5, false);

        // Assert
        assertEquals(NotificationType.CONTENT_LIMIT_WARNING, alert.kind());
        assertEquals("CONTENT_LIMIT_WARNING#videos", alert.checkKey());
        assertEquals("You are approaching your daily videos limit (4/5 - 80%).", alert.message());
        assertEquals(NotificationPriority.NORMAL, alert.priority());
        Map<String, Object> payload = alert.payload();
        assertEquals("videos", payload.get("limitType"));
        assertEquals(80L, ((Number) payload.get("percentage")).longValue());
        assertEquals(Boolean.FALSE, payload.get("isExceeded"));
        assertEquals(Optional.empty(), alert.expiresAfter());
    }

    @Test
    @DisplayName("limit exceeded should use the exceeded key and high priority")
    void testContentLimitAlert_Exceeded() {
        // Act
        ContentLimitAlert alert = new ContentLimitAlert(LimitMetric.SOCIAL, 31, 30, true);

        // Assert
        assertEquals("CONTENT_LIMIT_EXCEEDED#social", alert.checkKey());
        assertEquals("You have exceeded your daily social limit (31/30).", alert.message());
        assertEquals(NotificationPriority.HIGH, alert.priority());
    }

    @Test
    @DisplayName("limit alert should reject a disabled limit")
    void testContentLimitAlert_RejectsZeroLimit() {
        assertThrows(IllegalArgumentException.class,
                () -> new ContentLimitAlert(LimitMetric.TIME, 10, 0, true));
    }

    @Test
    @DisplayName("break reminder key should identify session and cursor")
    void testBreakReminderAlert() {
        // Act
        BreakReminderAlert alert = new BreakReminderAlert(3, 1800, 62, 30);

        // Assert
        assertEquals(NotificationType.BREAK_REMINDER, alert.kind());
        assertEquals("BREAK_REMINDER#3-1800", alert.checkKey());
        assertEquals("You have been consuming content for 62 minutes. Consider taking a 30 minute break.",
                alert.message());
        assertEquals(Optional.of(Duration.ofDays(1)), alert.expiresAfter());
    }

    @Test
    @DisplayName("quality alert should print missing averages as n/a")
    void testContentQualityAlert_MissingAverage() {
        // Act
        ContentQualityAlert alert = new ContentQualityAlert(0.456, null, 4);

        // Assert
        assertEquals("LOW_QUALITY_CONTENT_ALERT", alert.checkKey());
        assertEquals("Recent content quality is below your preferences. Average credibility: 46%, Average bias: n/a.",
                alert.message());
        assertEquals(4, alert.payload().get("contentCount"));
    }

    @Test
    @DisplayName("wellness goal achievement and reminder should have distinct keys and lifetimes")
    void testWellnessGoalAlert() {
        // Act
        WellnessGoalAlert achieved = new WellnessGoalAlert("balanced_perspective", true, 0.2);
        WellnessGoalAlert reminder = new WellnessGoalAlert("balanced_perspective", false, 0.5);

        // Assert
        assertEquals("WELLNESS_GOAL_ACHIEVED#balanced_perspective", achieved.checkKey());
        assertEquals("WELLNESS_GOAL_REMINDER#balanced_perspective", reminder.checkKey());
        assertEquals("Congratulations! You have achieved your balanced perspective goal.", achieved.message());
        assertEquals("Remember to focus on your balanced perspective goal while consuming content today.",
                reminder.message());
        assertEquals(Optional.empty(), achieved.expiresAfter());
        assertEquals(Optional.of(Duration.ofDays(1)), reminder.expiresAfter());
        assertEquals(NotificationPriority.LOW, reminder.priority());
    }
}
