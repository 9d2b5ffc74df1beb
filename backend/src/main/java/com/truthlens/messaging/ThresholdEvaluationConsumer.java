package com.truthlens.messaging;

import com.truthlens.entity.Notification;
import com.truthlens.service.ThresholdEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the threshold evaluation requested by {@link ThresholdEvaluationProducer}.
 *
 * Malformed messages are rejected without requeue. Other failures propagate;
 * the listener container does not requeue rejected messages, so the broker
 * moves them to the dead letter queue.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ThresholdEvaluationConsumer {

    private final ThresholdEvaluator thresholdEvaluator;

    @RabbitListener(queues = "${app.rabbitmq.queue.threshold-evaluation:threshold.evaluation.queue}")
    public void onEvaluationRequested(ThresholdEvaluationMessage message) {
        if (message == null || message.getUserId() == null) {
            log.error("Received threshold evaluation without user ID: message={}", message);
            throw new AmqpRejectAndDontRequeueException("Threshold evaluation message has no user ID");
        }

        log.debug("Received threshold evaluation: userId={}, contentType={}, requestedAt={}",
                message.getUserId(), message.getContentType(), message.getRequestedAt());

        try {
            List<Notification> emitted = thresholdEvaluator.evaluateOnUpdate(message.getUserId());
            log.debug("Threshold evaluation handled: userId={}, emitted={}", message.getUserId(), emitted.size());
        } catch (RuntimeException e) {
            log.error("Threshold evaluation failed: userId={}, error={}", message.getUserId(), e.getMessage(), e);
            throw e;
        }
    }
}
