package com.storefront.orders.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.orders.core.CaptureResultSerializer;
import com.storefront.orders.domain.PaymentResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Template behind the capture cache. Keys are plain strings; values go through
 * {@link CaptureResultSerializer} built on the application's ObjectMapper, so cached captures
 * use the same date and enum format as the REST API.
 */
@Configuration
public class CaptureCacheConfig {

    @Bean
    public CaptureResultSerializer captureResultSerializer(ObjectMapper objectMapper) {
        return new CaptureResultSerializer(objectMapper);
    }

    @Bean
    public RedisTemplate<String, PaymentResult> captureResultRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                          CaptureResultSerializer serializer) {
        RedisTemplate<String, PaymentResult> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(serializer);
        template.setEnableDefaultSerializer(false);
        template.afterPropertiesSet();
        return template;
    }
}
