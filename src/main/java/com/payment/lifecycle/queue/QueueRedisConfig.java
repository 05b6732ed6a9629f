package com.payment.lifecycle.queue;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Template for queue entry values. The sorted set itself goes through the
 * auto-configured {@code StringRedisTemplate}.
 */
@Configuration
public class QueueRedisConfig {

    @Bean
    public RedisTemplate<String, QueueEntry> queueEntryRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, QueueEntry> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new QueueEntryRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new QueueEntryRedisSerializer());
        template.afterPropertiesSet();
        return template;
    }
}
