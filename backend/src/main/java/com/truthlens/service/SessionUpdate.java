package com.truthlens.service;

import com.truthlens.entity.ContentType;
import lombok.Builder;
import lombok.Value;

/**
 * One consumption report sent to {@link SessionCoordinator#update}.
 *
 * Only {@code contentType} and {@code timeSpentSeconds} are required.
 */
@Value
@Builder
public class SessionUpdate {
    ContentType contentType;
    Long timeSpentSeconds;
    Double credibilityScore;
    Double biasScore;
    Integer scrollDepthPercent;
    String contentUrl;
    String contentTitle;
}
