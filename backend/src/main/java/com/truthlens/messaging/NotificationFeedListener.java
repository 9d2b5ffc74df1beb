package com.truthlens.messaging;

import com.truthlens.service.NotificationStreamRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Forwards notifications received on {@code notifications:*} to the SSE
 * connections of this instance.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationFeedListener implements MessageListener {

    static final String EVENT_NAME = "notification";

    private final NotificationStreamRegistry streamRegistry;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(RedisNotificationFeed.CHANNEL_PREFIX)) {
            log.warn("Ignoring message on unexpected channel: channel={}", channel);
            return;
        }

        UUID userId;
        try {
            userId = UUID.fromString(channel.substring(RedisNotificationFeed.CHANNEL_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring message on channel without user ID: channel={}", channel);
            return;
        }

        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        int delivered = streamRegistry.deliver(userId, EVENT_NAME, body);
        log.debug("Feed message forwarded: userId={}, connections={}", userId, delivered);
    }
}
