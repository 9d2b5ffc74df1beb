package com.truthlens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.*;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for asynchronous threshold evaluation.
 *
 * Architecture:
 * - Exchange: monitoring.exchange (direct)
 * - Main Queue: threshold.evaluation.queue (evaluation requests after logged updates)
 * - DLQ: threshold.evaluation.dlq (requests whose evaluation failed)
 * - Routing Keys: threshold.evaluate (main), threshold.evaluate.dlq (dead letters)
 *
 * Messages are JSON, converted with the application's ObjectMapper so that
 * content types and instants use the same wire format as the HTTP API.
 *
 * @see com.truthlens.messaging.ThresholdEvaluationProducer
 * @see com.truthlens.messaging.ThresholdEvaluationConsumer
 */
@Configuration
@Slf4j
public class RabbitMQConfig {

    @Value("${app.rabbitmq.exchange.monitoring:monitoring.exchange}")
    private String monitoringExchange;

    @Value("${app.rabbitmq.queue.threshold-evaluation:threshold.evaluation.queue}")
    private String evaluationQueue;

    @Value("${app.rabbitmq.queue.threshold-evaluation-dlq:threshold.evaluation.dlq}")
    private String evaluationDLQ;

    @Value("${app.rabbitmq.routing-key.threshold-evaluation:threshold.evaluate}")
    private String evaluationRoutingKey;

    @Value("${app.rabbitmq.routing-key.threshold-evaluation-dlq:threshold.evaluate.dlq}")
    private String dlqRoutingKey;

    @Value("${app.rabbitmq.queue.ttl:3600000}")
    private long queueTTL;

    @Value("${app.rabbitmq.queue.max-length:10000}")
    private int queueMaxLength;

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        log.debug("Configuring Jackson2JsonMessageConverter for RabbitMQ");
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setMandatory(true);

        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (ack) {
                log.debug("Message published successfully to RabbitMQ");
            } else {
                log.error("Failed to publish message to RabbitMQ: {}", cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned -> {
            log.error("Message returned from RabbitMQ - Exchange: {}, RoutingKey: {}, ReplyText: {}",
                    returned.getExchange(),
                    returned.getRoutingKey(),
                    returned.getReplyText());
        });

        log.info("RabbitTemplate configured with JSON message converter and publisher callbacks");
        return rabbitTemplate;
    }

    @Bean
    public Queue thresholdEvaluationDLQ() {
        log.info("Configuring DLQ: {} (durable=true)", evaluationDLQ);
        return QueueBuilder.durable(evaluationDLQ).build();
    }

    /**
     * Expired, overflowing and rejected requests are dead-lettered to the DLQ.
     */
    @Bean
    public Queue thresholdEvaluationQueue() {
        log.info("Configuring queue: {} (durable=true, ttl={}, maxLength={})",
                evaluationQueue, queueTTL, queueMaxLength);

        return QueueBuilder.durable(evaluationQueue)
                .withArgument("x-message-ttl", queueTTL)
                .withArgument("x-max-length", queueMaxLength)
                .withArgument("x-dead-letter-exchange", monitoringExchange)
                .withArgument("x-dead-letter-routing-key", dlqRoutingKey)
                .build();
    }

    @Bean
    public DirectExchange monitoringExchange() {
        log.info("Configuring direct exchange: {} (durable=true)", monitoringExchange);
        return new DirectExchange(monitoringExchange, true, false);
    }

    @Bean
    public Binding dlqBinding() {
        log.debug("Binding DLQ {} to exchange {} with routing key {}",
                evaluationDLQ, monitoringExchange, dlqRoutingKey);

        return BindingBuilder
                .bind(thresholdEvaluationDLQ())
                .to(monitoringExchange())
                .with(dlqRoutingKey);
    }

    @Bean
    public Binding thresholdEvaluationBinding() {
        log.debug("Binding queue {} to exchange {} with routing key {}",
                evaluationQueue, monitoringExchange, evaluationRoutingKey);

        return BindingBuilder
                .bind(thresholdEvaluationQueue())
                .to(monitoringExchange())
                .with(evaluationRoutingKey);
    }

    @Bean
    public AmqpAdmin amqpAdmin(ConnectionFactory connectionFactory) {
        log.info("Configuring AmqpAdmin for automatic queue/exchange declaration");
        return new RabbitAdmin(connectionFactory);
    }
}
