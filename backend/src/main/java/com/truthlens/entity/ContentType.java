package com.truthlens.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of consumed content.
 *
 * Serialized with its lower-case wire value; {@code social} is accepted as an
 * alias of {@code social_post} for older clients.
 */
public enum ContentType {
    ARTICLE("article"),
    VIDEO("video"),
    PODCAST("podcast"),
    SOCIAL_POST("social_post"),
    WEBPAGE("webpage");

    private final String wireValue;

    ContentType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    /**
     * Parse a wire value.
     *
     * @param value wire value, case-insensitive
     * @return the content type
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static ContentType fromWireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Content type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("social".equals(normalized)) {
            return SOCIAL_POST;
        }
        for (ContentType type : values()) {
            if (type.wireValue.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }
}
