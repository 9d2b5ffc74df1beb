package com.truthlens.messaging;

import com.truthlens.entity.ContentType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of {@code threshold.evaluation.queue}: evaluate the thresholds of a
 * user after a consumption record was logged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdEvaluationMessage {

    private UUID userId;

    private ContentType contentType;

    private Instant requestedAt;
}
