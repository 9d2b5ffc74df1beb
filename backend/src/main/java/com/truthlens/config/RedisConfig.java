package com.truthlens.config;

import com.truthlens.messaging.NotificationFeedListener;
import com.truthlens.messaging.RedisNotificationFeed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the real-time notification feed.
 *
 * Provides:
 * - RedisConnectionFactory: Lettuce-based connection
 * - redisStringTemplate: String keys and values, used to publish feed messages
 * - RedisMessageListenerContainer: subscribes this instance to {@code notifications:*}
 *
 * @see RedisNotificationFeed
 * @see NotificationFeedListener
 */
@Configuration
@Slf4j
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redisHost);
        config.setPort(redisPort);

        log.info("Configuring Redis connection factory: host={}, port={}", redisHost, redisPort);
        return new LettuceConnectionFactory(config);
    }

    @Bean
    public RedisTemplate<String, String> redisStringTemplate(RedisConnectionFactory redisConnectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        StringRedisSerializer stringSerializer = new StringRedisSerializer();
        template.setKeySerializer(stringSerializer);
        template.setValueSerializer(stringSerializer);
        template.setHashKeySerializer(stringSerializer);
        template.setHashValueSerializer(stringSerializer);

        template.afterPropertiesSet();
        log.debug("RedisTemplate configured for String operations");
        return template;
    }

    @Bean
    public RedisMessageListenerContainer notificationListenerContainer(
            RedisConnectionFactory redisConnectionFactory,
            NotificationFeedListener notificationFeedListener
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(redisConnectionFactory);
        container.addMessageListener(notificationFeedListener,
                new PatternTopic(RedisNotificationFeed.CHANNEL_PREFIX + "*"));

        log.info("Subscribed to notification feed: pattern={}*", RedisNotificationFeed.CHANNEL_PREFIX);
        return container;
    }
}
