package com.truthlens.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Domain exception of the monitoring pipeline.
 *
 * Carries an {@link ErrorCategory} that decides the HTTP status, and for
 * validation failures the offending fields. Thrown before any mutation so a
 * rejected call leaves no trace.
 */
public class MonitoringException extends RuntimeException {

    private final ErrorCategory category;
    private final Map<String, String> fieldErrors;

    public MonitoringException(ErrorCategory category, String message) {
        this(category, message, Collections.emptyMap(), null);
    }

    public MonitoringException(ErrorCategory category, String message, Throwable cause) {
        this(category, message, Collections.emptyMap(), cause);
    }

    public MonitoringException(ErrorCategory category, String message, Map<String, String> fieldErrors, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.fieldErrors = fieldErrors == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    public static MonitoringException validation(Map<String, String> fieldErrors) {
        return new MonitoringException(
                ErrorCategory.VALIDATION,
                "Request validation failed: " + String.join(", ", fieldErrors.keySet()),
                fieldErrors,
                null
        );
    }

    public static MonitoringException validation(String field, String message) {
        return validation(Map.of(field, message));
    }

    public static MonitoringException notFound(String resource, Object id) {
        return new MonitoringException(
                ErrorCategory.NOT_FOUND,
                String.format("%s '%s' was not found.", resource, id)
        );
    }

    public static MonitoringException dependency(String dependency, Throwable cause) {
        return new MonitoringException(
                ErrorCategory.DEPENDENCY,
                String.format("%s is unavailable. Please try again later.", dependency),
                cause
        );
    }
}
