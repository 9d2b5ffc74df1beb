package com.truthlens.service.alert;

import com.truthlens.entity.NotificationType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Daily time or per-type count limit reached (warning) or crossed (exceeded).
 */
public class ContentLimitAlert extends WellnessAlert {

    /**
     * What a limit counts. Time is compared in seconds but reported in minutes.
     */
    public enum LimitMetric {
        TIME("time"),
        ARTICLES("articles"),
        VIDEOS("videos"),
        SOCIAL("social");

        private final String key;

        LimitMetric(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    private final LimitMetric metric;
    private final long currentValue;
    private final long limit;
    private final boolean exceeded;

    /**
     * @param currentValue today's value in the unit shown to the user
     * @param limit        configured limit, same unit, greater than zero
     */
    public ContentLimitAlert(LimitMetric metric, long currentValue, long limit, boolean exceeded) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        this.metric = metric;
        this.currentValue = currentValue;
        this.limit = limit;
        this.exceeded = exceeded;
    }

    public LimitMetric getMetric() {
        return metric;
    }

    public boolean isExceeded() {
        return exceeded;
    }

    public long getPercentage() {
        return Math.round(currentValue * 100.0 / limit);
    }

    @Override
    public NotificationType kind() {
        return exceeded ? NotificationType.CONTENT_LIMIT_EXCEEDED : NotificationType.CONTENT_LIMIT_WARNING;
    }

    @Override
    public String checkKey() {
        return kind().name() + "#" + metric.getKey();
    }

    @Override
    public String message() {
        if (exceeded) {
            return String.format("You have exceeded your daily %s limit (%d/%d).",
                    metric.getKey(), currentValue, limit);
        }
        return String.format("You are approaching your daily %s limit (%d/%d - %d%%).",
                metric.getKey(), currentValue, limit, getPercentage());
    }

    @Override
    public Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("limitType", metric.getKey());
        data.put("currentValue", currentValue);
        data.put("limit", limit);
        data.put("percentage", getPercentage());
        data.put("isExceeded", exceeded);
        return data;
    }
}
