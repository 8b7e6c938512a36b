package com.storefront.orders.core;

import com.storefront.orders.config.CaptureCacheProperties;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.TransactionStatus;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.serializer.SerializationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for IdempotencyService with mocked Redis and database.
 */
@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final String REFERENCE = "5O190127TN364715T";

    @Mock
    private RedisTemplate<String, PaymentResult> redisTemplate;

    @Mock
    private ValueOperations<String, PaymentResult> valueOps;

    @Mock
    private PaymentPersistenceService persistenceService;

    private IdempotencyService idempotencyService;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        idempotencyService = new IdempotencyService(redisTemplate, persistenceService, new CaptureCacheProperties());
    }

    private static PaymentIntent intent(IntentStatus status) {
        return PaymentIntent.builder()
                .id("intent-1")
                .orderId("order-1")
                .method(PaymentMethod.CARD_REDIRECT)
                .externalReference(REFERENCE)
                .expectedAmount(new BigDecimal("715.98"))
                .currency("GBP")
                .providerTransactionId("3C679366HH908993F")
                .status(status)
                .updatedAt(Instant.parse("2026-03-02T10:15:30Z"))
                .build();
    }

    @Test
    void returnsResultCachedInRedis() {
        PaymentResult cached = PaymentResult.builder()
                .idempotencyKey(REFERENCE)
                .providerTransactionId("3C679366HH908993F")
                .status(TransactionStatus.SUCCESS)
                .build();
        when(valueOps.get("orders:capture:" + REFERENCE)).thenReturn(cached);

        assertThat(idempotencyService.getCachedResult(REFERENCE)).contains(cached);
        verify(persistenceService, never()).findIntentByExternalReference(any());
    }

    @Test
    void fallsBackToCompletedIntentAndRecaches() {
        when(valueOps.get("orders:capture:" + REFERENCE)).thenReturn(null);
        when(persistenceService.findIntentByExternalReference(REFERENCE)).thenReturn(Optional.of(intent(IntentStatus.COMPLETED)));

        Optional<PaymentResult> result = idempotencyService.getCachedResult(REFERENCE);

        assertThat(result).isPresent();
        assertThat(result.get().getStatus()).isEqualTo(TransactionStatus.SUCCESS);
        assertThat(result.get().getProviderTransactionId()).isEqualTo("3C679366HH908993F");
        assertThat(result.get().getAmount()).isEqualByComparingTo("715.98");
        verify(valueOps).set(eq("orders:capture:" + REFERENCE), any(PaymentResult.class), eq(Duration.ofHours(24)));
    }

    @Test
    void openIntentIsNotACachedCapture() {
        when(valueOps.get("orders:capture:" + REFERENCE)).thenReturn(null);
        when(persistenceService.findIntentByExternalReference(REFERENCE)).thenReturn(Optional.of(intent(IntentStatus.INITIATED)));

        assertThat(idempotencyService.getCachedResult(REFERENCE)).isEmpty();
    }

    @Test
    void unreadableCacheEntryIsTreatedAsMiss() {
        when(valueOps.get("orders:capture:" + REFERENCE)).thenThrow(new SerializationException("Cannot deserialize"));
        when(persistenceService.findIntentByExternalReference(REFERENCE)).thenReturn(Optional.empty());

        assertThat(idempotencyService.getCachedResult(REFERENCE)).isEmpty();
    }

    @Test
    void failsOpenWhenRedisAndDatabaseAreDown() {
        when(valueOps.get("orders:capture:" + REFERENCE)).thenThrow(new RedisConnectionFailureException("Connection refused"));
        when(persistenceService.findIntentByExternalReference(REFERENCE)).thenThrow(new IllegalStateException("database down"));

        assertThat(idempotencyService.getCachedResult(REFERENCE)).isEmpty();
    }

    @Test
    void storeResultUsesDefaultTtl() {
        PaymentResult result = PaymentResult.builder().idempotencyKey(REFERENCE).status(TransactionStatus.SUCCESS).build();

        idempotencyService.storeResult(REFERENCE, result);

        verify(valueOps).set("orders:capture:" + REFERENCE, result, Duration.ofHours(24));
    }

    @Test
    void storeResultHonoursConfiguredPrefixAndTtl() {
        CaptureCacheProperties properties = new CaptureCacheProperties();
        properties.setKeyPrefix("eu-west:capture:");
        properties.setTtl(Duration.ofHours(6));
        IdempotencyService regional = new IdempotencyService(redisTemplate, persistenceService, properties);
        PaymentResult result = PaymentResult.builder().idempotencyKey(REFERENCE).status(TransactionStatus.SUCCESS).build();

        regional.storeResult(REFERENCE, result);

        verify(valueOps).set("eu-west:capture:" + REFERENCE, result, Duration.ofHours(6));
    }
}
