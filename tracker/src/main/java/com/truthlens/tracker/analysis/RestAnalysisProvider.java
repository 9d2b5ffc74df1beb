package com.truthlens.tracker.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.truthlens.tracker.content.ContentSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link AnalysisProvider} calling the platform's extension endpoints
 * {@code /api/extension/fact-check} and {@code /api/extension/bias-analysis}.
 *
 * The two calls are independent: a failed bias analysis still yields a
 * credibility score and vice versa. Only when both fail is the analysis
 * reported as failed.
 */
@Slf4j
public class RestAnalysisProvider implements AnalysisProvider {

    static final String FACT_CHECK_PATH = "/api/extension/fact-check";
    static final String BIAS_ANALYSIS_PATH = "/api/extension/bias-analysis";

    private final RestClient restClient;
    private final Supplier<String> tokenSupplier;

    public RestAnalysisProvider(RestClient restClient, Supplier<String> tokenSupplier) {
        this.restClient = restClient;
        this.tokenSupplier = tokenSupplier;
    }

    @Override
    public AnalysisResult analyze(ContentSnapshot snapshot) {
        Map<String, Object> body = requestBody(snapshot);

        JsonNode factCheck = post(FACT_CHECK_PATH, body, snapshot.getUrl());
        JsonNode bias = post(BIAS_ANALYSIS_PATH, body, snapshot.getUrl());
        if (factCheck == null && bias == null) {
            throw new AnalysisException("Analysis unavailable for " + snapshot.getUrl());
        }

        Double credibility = factCheck == null ? null
                : score(factCheck, "credibility_score", "credibilityScore", "score");
        Double biasScore = bias == null ? null
                : score(bias, "bias_score", "biasScore", "score");
        boolean biasDetected = bias != null && bias.path("bias_detected").asBoolean(false);

        return AnalysisResult.builder()
                .credibilityScore(credibility)
                .biasScore(biasScore)
                .biasDetected(biasDetected)
                .build();
    }

    private Map<String, Object> requestBody(ContentSnapshot snapshot) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", snapshot.getUrl());
        metadata.put("domain", snapshot.getDomain());
        metadata.put("title", snapshot.getTitle());
        metadata.put("author", snapshot.getAuthor());
        metadata.put("publish_date", snapshot.getPublishDate());
        metadata.put("content_type", snapshot.getContentType().getWireValue());
        metadata.put("word_count", snapshot.getWordCount());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("content", snapshot.getExtractedText());
        body.put("metadata", metadata);
        return body;
    }

    private JsonNode post(String path, Map<String, Object> body, String url) {
        try {
            return restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(tokenSupplier.get()))
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Analysis call failed: path={}, url={}, error={}", path, url, e.getMessage());
            return null;
        }
    }

    /**
     * Read the first numeric field present. Percent-style values (above 1) are
     * scaled down; anything still outside [0,1] is discarded.
     */
    static Double score(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || !value.isNumber()) {
                continue;
            }
            double raw = value.asDouble();
            if (raw > 1.0 && raw <= 100.0) {
                raw = raw / 100.0;
            }
            return raw >= 0.0 && raw <= 1.0 ? raw : null;
        }
        return null;
    }
}
