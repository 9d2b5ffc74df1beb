package com.truthlens.exception;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Global exception handler producing RFC 7807 {@link ProblemDetail} responses.
 *
 * Every error body carries {@code type}, {@code title}, {@code status},
 * {@code detail}, {@code instance}, {@code timestamp} and an error
 * {@code category}; validation failures also carry a field {@code errors} map.
 *
 * Mapping:
 * - MonitoringException: by its category (400, 404, 503, 500)
 * - Bean validation, unreadable bodies, bad arguments: 400 VALIDATION
 * - AccessDeniedException, AuthenticationException: 401
 * - Database failures: 503 DEPENDENCY
 * - Anything else: 500 INTERNAL
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.truthlens.app/errors";
    private static final PropertyNamingStrategies.NamingBase SNAKE_CASE = new PropertyNamingStrategies.SnakeCaseStrategy();

    @ExceptionHandler(MonitoringException.class)
    public ResponseEntity<ProblemDetail> handleMonitoringException(
            MonitoringException ex,
            WebRequest request
    ) {
        ErrorCategory category = ex.getCategory();
        if (category == ErrorCategory.VALIDATION || category == ErrorCategory.NOT_FOUND) {
            log.warn("Request rejected: category={}, message={}", category, ex.getMessage());
        } else {
            log.error("Monitoring operation failed: category={}, message={}", category, ex.getMessage(), ex);
        }

        ProblemDetail problemDetail = createProblemDetail(
                category.getStatus(),
                titleOf(category),
                ex.getMessage(),
                request,
                category
        );
        if (!ex.getFieldErrors().isEmpty()) {
            problemDetail.setProperty("errors", ex.getFieldErrors());
        }

        return ResponseEntity.status(category.getStatus()).body(problemDetail);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {}", ex.getMessage());

        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.putIfAbsent(SNAKE_CASE.translate(error.getField()), error.getDefaultMessage()));

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request,
                ErrorCategory.VALIDATION
        );
        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains an unknown value. Please check your request format.",
                request,
                ErrorCategory.VALIDATION
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            RuntimeException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                ErrorCategory.VALIDATION
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler({AccessDeniedException.class, AuthenticationException.class})
    public ResponseEntity<ProblemDetail> handleAuthenticationException(
            RuntimeException ex,
            WebRequest request
    ) {
        log.warn("Access denied: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Required",
                "You must be authenticated to access this resource. Please provide a valid JWT token.",
                request,
                ErrorCategory.VALIDATION
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccessException(
            DataAccessException ex,
            WebRequest request
    ) {
        log.error("Database operation failed: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "The request could not be completed. No changes were applied; please retry.",
                request,
                ErrorCategory.DEPENDENCY
        );

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problemDetail);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later.",
                request,
                ErrorCategory.INTERNAL
        );
        problemDetail.setProperty("errorId", String.format("ERR-%d", System.currentTimeMillis()));

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            ErrorCategory category
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, category.getErrorType())));
        problemDetail.setTitle(title);

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("category", category.name().toLowerCase(Locale.ROOT));
        problemDetail.setProperty("timestamp", Instant.now().toString());

        return problemDetail;
    }

    private static String titleOf(ErrorCategory category) {
        switch (category) {
            case VALIDATION:
                return "Validation Failed";
            case NOT_FOUND:
                return "Resource Not Found";
            case DEPENDENCY:
                return "Dependency Unavailable";
            default:
                return "Internal Server Error";
        }
    }
}
