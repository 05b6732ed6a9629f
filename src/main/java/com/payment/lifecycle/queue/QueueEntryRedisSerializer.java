package com.payment.lifecycle.queue;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * JSON form of {@link QueueEntry} in Redis. No {@code @class} hint, so entries stay
 * readable by operators and by other services.
 */
public class QueueEntryRedisSerializer implements RedisSerializer<QueueEntry> {

    private final ObjectMapper mapper;

    public QueueEntryRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(QueueEntry value) throws SerializationException {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize QueueEntry " + value.getExternalReference(), e);
        }
    }

    @Override
    public QueueEntry deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), QueueEntry.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize QueueEntry", e);
        }
    }
}
