package com.truthlens.service.alert;

import com.truthlens.entity.NotificationType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Active time since the last break reminder reached the configured interval.
 *
 * The check key embeds the session number and the break cursor so that
 * every interval of every session can fire once.
 */
public class BreakReminderAlert extends WellnessAlert {

    private static final Duration EXPIRY = Duration.ofDays(1);

    private final int sessionNumber;
    private final long breakCursorSeconds;
    private final long sessionMinutes;
    private final int breakIntervalMinutes;

    public BreakReminderAlert(int sessionNumber, long breakCursorSeconds, long sessionMinutes, int breakIntervalMinutes) {
        this.sessionNumber = sessionNumber;
        this.breakCursorSeconds = breakCursorSeconds;
        this.sessionMinutes = sessionMinutes;
        this.breakIntervalMinutes = breakIntervalMinutes;
    }

    @Override
    public NotificationType kind() {
        return NotificationType.BREAK_REMINDER;
    }

    @Override
    public String checkKey() {
        return kind().name() + "#" + sessionNumber + "-" + breakCursorSeconds;
    }

    @Override
    public String message() {
        return String.format("You have been consuming content for %d minutes. Consider taking a %d minute break.",
                sessionMinutes, breakIntervalMinutes);
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionDuration", sessionMinutes);
        data.put("breakInterval", breakIntervalMinutes);
        data.put("sessionNumber", sessionNumber);
        return data;
    }

    @Override
    public Optional<Duration> expiresAfter() {
        return Optional.of(EXPIRY);
    }
}
