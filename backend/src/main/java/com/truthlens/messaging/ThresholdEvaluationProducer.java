package com.truthlens.messaging;

import com.truthlens.entity.ContentType;
import com.truthlens.service.ThresholdEvaluationTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes threshold evaluation requests to RabbitMQ.
 *
 * Inside a transaction the message is sent after commit, so the consumer
 * always sees the consumption record that caused it; a rolled back update
 * sends nothing. Broker failures are logged and never reach the caller: the
 * record is already stored and the next update or the periodic sweep
 * evaluates again.
 *
 * Message Format:
 * - Payload: {@link ThresholdEvaluationMessage} as JSON
 * - Exchange: monitoring.exchange (direct)
 * - Routing Key: threshold.evaluate
 * - Queue: threshold.evaluation.queue
 *
 * @see com.truthlens.config.RabbitMQConfig
 * @see ThresholdEvaluationConsumer
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ThresholdEvaluationProducer implements ThresholdEvaluationTrigger {

    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    @Value("${app.rabbitmq.exchange.monitoring:monitoring.exchange}")
    private String monitoringExchange;

    @Value("${app.rabbitmq.routing-key.threshold-evaluation:threshold.evaluate}")
    private String evaluationRoutingKey;

    @Override
    public void requestEvaluation(UUID userId, ContentType contentType) {
        if (userId == null) {
            throw new IllegalArgumentException("User ID cannot be null");
        }

        ThresholdEvaluationMessage message = new ThresholdEvaluationMessage(userId, contentType, clock.instant());

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(message);
                }
            });
            log.debug("Threshold evaluation deferred until commit: userId={}", userId);
        } else {
            send(message);
        }
    }

    private void send(ThresholdEvaluationMessage message) {
        try {
            rabbitTemplate.convertAndSend(monitoringExchange, evaluationRoutingKey, message);
            log.info("Threshold evaluation queued: userId={}, contentType={}",
                    message.getUserId(), message.getContentType());
        } catch (AmqpException e) {
            log.error("Failed to queue threshold evaluation: userId={}, exchange={}, routingKey={}, error={}",
                    message.getUserId(), monitoringExchange, evaluationRoutingKey, e.getMessage(), e);
        }
    }
}
