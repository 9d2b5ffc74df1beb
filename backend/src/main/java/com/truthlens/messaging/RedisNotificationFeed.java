package com.truthlens.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.truthlens.dto.response.NotificationResponse;
import com.truthlens.entity.Notification;
import com.truthlens.service.NotificationFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * {@link NotificationFeed} over Redis pub/sub.
 *
 * Each notification is published as JSON on {@code notifications:{userId}}
 * after the emitting transaction commits. Every instance subscribes to the
 * channel pattern and forwards to its own SSE connections, so a client
 * connected to any instance receives it. Delivery is at most once; clients
 * reconcile by notification id through the list API.
 */
@Component
@Slf4j
public class RedisNotificationFeed implements NotificationFeed {

    public static final String CHANNEL_PREFIX = "notifications:";

    private final RedisTemplate<String, String> redisStringTemplate;
    private final ObjectMapper objectMapper;

    public RedisNotificationFeed(
            @Qualifier("redisStringTemplate") RedisTemplate<String, String> redisStringTemplate,
            ObjectMapper objectMapper
    ) {
        this.redisStringTemplate = redisStringTemplate;
        this.objectMapper = objectMapper;
    }

    public static String channelOf(UUID userId) {
        return CHANNEL_PREFIX + userId;
    }

    @Override
    public void publish(Notification notification) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(NotificationResponse.from(notification));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize notification " + notification.getId(), e);
        }

        String channel = channelOf(notification.getUserId());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(channel, payload, notification.getId());
                }
            });
        } else {
            send(channel, payload, notification.getId());
        }
    }

    private void send(String channel, String payload, UUID notificationId) {
        try {
            Long receivers = redisStringTemplate.convertAndSend(channel, payload);
            log.debug("Notification published: channel={}, notificationId={}, receivers={}",
                    channel, notificationId, receivers);
        } catch (DataAccessException e) {
            log.error("Failed to publish notification: channel={}, notificationId={}, error={}",
                    channel, notificationId, e.getMessage(), e);
        }
    }
}
