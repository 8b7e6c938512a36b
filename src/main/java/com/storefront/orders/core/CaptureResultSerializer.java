package com.storefront.orders.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.storefront.orders.domain.PaymentResult;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.io.IOException;

/**
 * JSON codec for cached captures. Only successful captures belong in the cache: a failed one
 * is refused on write, and an entry that reads back without a capture id or as anything other
 * than SUCCESS is reported as unreadable so the caller falls back to the database.
 */
public class CaptureResultSerializer implements RedisSerializer<PaymentResult> {

    private final ObjectMapper mapper;

    public CaptureResultSerializer(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(PaymentResult value) {
        if (value == null) {
            return null;
        }
        if (!value.isSuccess()) {
            throw new SerializationException("Refusing to cache capture " + value.getIdempotencyKey()
                    + " with status " + value.getStatus());
        }
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Could not write capture " + value.getIdempotencyKey(), e);
        }
    }

    @Override
    public PaymentResult deserialize(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        PaymentResult result;
        try {
            result = mapper.readValue(bytes, PaymentResult.class);
        } catch (IOException e) {
            throw new SerializationException("Could not read cached capture", e);
        }
        if (!result.isSuccess() || result.getProviderTransactionId() == null) {
            throw new SerializationException("Cached capture " + result.getIdempotencyKey()
                    + " is not a completed capture (status " + result.getStatus() + ")");
        }
        return result;
    }
}
