package com.truthlens.tracker.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link MonitoringApiClient} over Spring's {@link RestClient}, authenticated
 * with a bearer token obtained per call.
 */
@Slf4j
public class RestMonitoringApiClient implements MonitoringApiClient {

    static final String BASE_PATH = "/api/content-monitoring/session";

    /** Client errors that may succeed on a later attempt. */
    private static final Set<Integer> RETRYABLE_CLIENT_ERRORS = Set.of(
            HttpStatus.UNAUTHORIZED.value(),
            HttpStatus.REQUEST_TIMEOUT.value(),
            HttpStatus.TOO_MANY_REQUESTS.value());

    private final RestClient restClient;
    private final Supplier<String> tokenSupplier;

    public RestMonitoringApiClient(RestClient restClient, Supplier<String> tokenSupplier) {
        this.restClient = restClient;
        this.tokenSupplier = tokenSupplier;
    }

    @Override
    public void startSession() {
        post("/start", Map.of());
    }

    @Override
    public void updateSession(ConsumptionDraft draft) {
        post("/update", toRequest(draft));
        log.debug("Synced consumption draft: url={}, timeSpent={}", draft.getUrl(), draft.getTimeSpentSeconds());
    }

    @Override
    public void endSession() {
        post("/end", Map.of());
    }

    static Map<String, Object> toRequest(ConsumptionDraft draft) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content_type", draft.getContentType().getWireValue());
        body.put("time_spent", draft.getTimeSpentSeconds());
        body.put("scroll_depth_percent", draft.getScrollDepthPercent());
        if (draft.getCredibilityScore() != null) {
            body.put("credibility_score", draft.getCredibilityScore());
        }
        if (draft.getBiasScore() != null) {
            body.put("bias_score", draft.getBiasScore());
        }
        body.put("content_url", draft.getUrl());
        body.put("content_title", draft.getTitle());
        return body;
    }

    private void post(String path, Map<String, Object> body) {
        try {
            restClient.post()
                    .uri(BASE_PATH + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(tokenSupplier.get()))
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (HttpClientErrorException e) {
            boolean permanent = isPermanent(e.getStatusCode());
            throw new SyncException("Session API rejected call: " + path + " status=" + e.getStatusCode().value(),
                    e, permanent);
        } catch (RestClientException e) {
            throw new SyncException("Session API call failed: " + path, e);
        }
    }

    static boolean isPermanent(HttpStatusCode status) {
        return status.is4xxClientError() && !RETRYABLE_CLIENT_ERRORS.contains(status.value());
    }
}
