package com.truthlens.tracker.content;

/**
 * Kind of content a page view represents.
 *
 * The wire value is the lower-case name used by the Session API
 * (for example {@code social_post}).
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

    public String getWireValue() {
        return wireValue;
    }
}
