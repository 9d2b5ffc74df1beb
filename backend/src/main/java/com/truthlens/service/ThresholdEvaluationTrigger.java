package com.truthlens.service;

import com.truthlens.entity.ContentType;

import java.util.UUID;

/**
 * Requests an asynchronous threshold evaluation for a user.
 *
 * Implementations must not fail the caller: the request is sent after the
 * surrounding transaction commits and delivery problems are only logged.
 */
public interface ThresholdEvaluationTrigger {

    void requestEvaluation(UUID userId, ContentType contentType);
}
