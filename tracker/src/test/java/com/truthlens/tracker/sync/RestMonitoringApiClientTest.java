package com.truthlens.tracker.sync;

import com.truthlens.tracker.content.ContentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RestMonitoringApiClient Unit Tests")
class RestMonitoringApiClientTest {

    @Test
    @DisplayName("Validation and not-found errors are permanent")
    void testPermanentClientErrors() {
        assertTrue(RestMonitoringApiClient.isPermanent(HttpStatus.BAD_REQUEST));
        assertTrue(RestMonitoringApiClient.isPermanent(HttpStatus.NOT_FOUND));
        assertTrue(RestMonitoringApiClient.isPermanent(HttpStatus.UNPROCESSABLE_ENTITY));
    }

    @Test
    @DisplayName("Auth, timeout, throttling and server errors stay retryable")
    void testRetryableErrors() {
        assertFalse(RestMonitoringApiClient.isPermanent(HttpStatus.UNAUTHORIZED));
        assertFalse(RestMonitoringApiClient.isPermanent(HttpStatus.REQUEST_TIMEOUT));
        assertFalse(RestMonitoringApiClient.isPermanent(HttpStatus.TOO_MANY_REQUESTS));
        assertFalse(RestMonitoringApiClient.isPermanent(HttpStatus.SERVICE_UNAVAILABLE));
    }

    @Test
    @DisplayName("Request body uses wire names and omits missing scores")
    void testRequestBody() {
        // Arrange
        ConsumptionDraft draft = ConsumptionDraft.builder()
                .url("https://example.com/a")
                .title("Title")
                .contentType(ContentType.ARTICLE)
                .timeSpentSeconds(42)
                .scrollDepthPercent(60)
                .capturedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        // Act
        Map<String, Object> body = RestMonitoringApiClient.toRequest(draft);

        // Assert
        assertEquals(42L, body.get("time_spent"));
        assertEquals("https://example.com/a", body.get("content_url"));
        assertFalse(body.containsKey("credibility_score"));
        assertFalse(body.containsKey("bias_score"));
    }
}
