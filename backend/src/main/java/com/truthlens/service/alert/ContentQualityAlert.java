package com.truthlens.service.alert;

import com.truthlens.entity.NotificationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recent scored content falls below the user's credibility or bias preferences.
 */
public class ContentQualityAlert extends WellnessAlert {

    private final Double averageCredibility;
    private final Double averageBias;
    private final int contentCount;

    /**
     * @param averageCredibility null when no recent record carried a credibility score
     * @param averageBias        null when no recent record carried a bias score
     */
    public ContentQualityAlert(Double averageCredibility, Double averageBias, int contentCount) {
        this.averageCredibility = averageCredibility;
        this.averageBias = averageBias;
        this.contentCount = contentCount;
    }

    @Override
    public NotificationType kind() {
        return NotificationType.LOW_QUALITY_CONTENT_ALERT;
    }

    @Override
    public String checkKey() {
        return kind().name();
    }

    @Override
    public String message() {
        return String.format("Recent content quality is below your preferences. Average credibility: %s, Average bias: %s.",
                percent(averageCredibility), percent(averageBias));
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("averageCredibility", averageCredibility);
        data.put("averageBias", averageBias);
        data.put("contentCount", contentCount);
        return data;
    }

    private static String percent(Double value) {
        return value == null ? "n/a" : Math.round(value * 100) + "%";
    }
}
