package com.storefront.orders.core;

import com.storefront.orders.config.CaptureCacheProperties;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.TransactionStatus;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers successful captures so a repeated capture of the same gateway order returns the
 * first result instead of calling the gateway again. Redis is the fast path; a COMPLETED
 * payment intent in the database is the fallback.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private final RedisTemplate<String, PaymentResult> redisTemplate;
    private final PaymentPersistenceService persistenceService;
    private final CaptureCacheProperties properties;

    /**
     * Previous capture result for {@code externalReference}, if any. When Redis and the database
     * are both unreachable this returns empty and the capture proceeds (fail-open).
     */
    public Optional<PaymentResult> getCachedResult(String externalReference) {
        String key = properties.key(externalReference);
        try {
            PaymentResult cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Capture idempotency hit in Redis for reference={}", externalReference);
                return Optional.of(cached);
            }
        } catch (SerializationException e) {
            log.error("Capture cache entry {} cannot be read, falling back to database", key, e);
        } catch (RuntimeException e) {
            log.warn("Capture cache read failed for reference={} (Redis unavailable), falling back to database: {}",
                    externalReference, e.getMessage());
        }

        try {
            Optional<PaymentIntent> intentOpt = persistenceService.findIntentByExternalReference(externalReference);
            if (intentOpt.isPresent() && intentOpt.get().getStatus() == IntentStatus.COMPLETED) {
                PaymentResult result = fromIntent(intentOpt.get());
                log.debug("Capture idempotency hit in database for reference={}", externalReference);
                try {
                    storeResult(externalReference, result);
                } catch (Exception e) {
                    log.warn("Failed to re-cache capture result for reference={}: {}", externalReference, e.getMessage());
                }
                return Optional.of(result);
            }
        } catch (Exception e) {
            log.error("Database idempotency check failed for reference={}: {}", externalReference, e.getMessage());
        }

        return Optional.empty();
    }

    /**
     * Caches a successful capture for the configured TTL.
     */
    public void storeResult(String externalReference, PaymentResult result) {
        Duration ttl = properties.getTtl();
        redisTemplate.opsForValue().set(properties.key(externalReference), result, ttl);
        log.debug("Stored capture result for reference={} ttl={}", externalReference, ttl);
    }

    private static PaymentResult fromIntent(PaymentIntent intent) {
        return PaymentResult.builder()
                .idempotencyKey(intent.getExternalReference())
                .providerTransactionId(intent.getProviderTransactionId())
                .status(TransactionStatus.SUCCESS)
                .amount(intent.getExpectedAmount())
                .currencyCode(intent.getCurrency())
                .message("Already captured")
                .timestamp(intent.getUpdatedAt() != null ? intent.getUpdatedAt() : Instant.now())
                .metadata(Map.of("method", intent.getMethod().name()))
                .build();
    }
}
