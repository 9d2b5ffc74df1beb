package com.truthlens.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse grouping of notifications shown to the user.
 */
public enum NotificationCategory {
    CONTENT_ALERT,
    CONTENT_REMINDER,
    WELLNESS_GOAL;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
