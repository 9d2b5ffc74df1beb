package com.truthlens.exception;

import org.springframework.http.HttpStatus;

/**
 * Category of a {@link MonitoringException}, with the HTTP status it maps to.
 */
public enum ErrorCategory {
    VALIDATION(HttpStatus.BAD_REQUEST, "validation-failed"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "not-found"),
    DEPENDENCY(HttpStatus.SERVICE_UNAVAILABLE, "dependency-unavailable"),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "internal-error");

    private final HttpStatus status;
    private final String errorType;

    ErrorCategory(HttpStatus status, String errorType) {
        this.status = status;
        this.errorType = errorType;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorType() {
        return errorType;
    }
}
