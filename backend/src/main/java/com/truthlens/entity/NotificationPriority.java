package com.truthlens.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT;

    @JsonValue
    public String getWireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
