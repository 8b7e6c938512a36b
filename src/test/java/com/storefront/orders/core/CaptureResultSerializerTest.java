package com.storefront.orders.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.TransactionStatus;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.SerializationException;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptureResultSerializerTest {

    private final CaptureResultSerializer serializer =
            new CaptureResultSerializer(new ObjectMapper().registerModule(new JavaTimeModule()));

    private static PaymentResult capture(TransactionStatus status) {
        return PaymentResult.builder()
                .idempotencyKey("5O190127TN364715T")
                .providerTransactionId(status == TransactionStatus.SUCCESS ? "3C679366HH908993F" : null)
                .status(status)
                .amount(new BigDecimal("715.98"))
                .currencyCode("GBP")
                .failureCode(status == TransactionStatus.FAILED ? "INSTRUMENT_DECLINED" : null)
                .timestamp(Instant.parse("2026-03-02T10:15:30Z"))
                .metadata(Map.of("gatewayOrderId", "5O190127TN364715T"))
                .build();
    }

    @Test
    void storedCaptureReadsBackWithIsoTimestamp() {
        byte[] bytes = serializer.serialize(capture(TransactionStatus.SUCCESS));

        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"timestamp\":\"2026-03-02T10:15:30Z\"");
        PaymentResult read = serializer.deserialize(bytes);
        assertThat(read.getProviderTransactionId()).isEqualTo("3C679366HH908993F");
        assertThat(read.getAmount()).isEqualByComparingTo("715.98");
        assertThat(read.getTimestamp()).isEqualTo(Instant.parse("2026-03-02T10:15:30Z"));
    }

    @Test
    void declinedCaptureIsNeverCached() {
        assertThatThrownBy(() -> serializer.serialize(capture(TransactionStatus.FAILED)))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("FAILED");
    }

    @Test
    void entryWithoutCaptureIdIsUnreadable() {
        byte[] bytes = "{\"idempotencyKey\":\"5O190127TN364715T\",\"status\":\"SUCCESS\"}".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> serializer.deserialize(bytes))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("5O190127TN364715T");
    }

    @Test
    void unknownFieldsFromNewerWritersAreTolerated() {
        byte[] bytes = ("{\"idempotencyKey\":\"5O190127TN364715T\",\"providerTransactionId\":\"3C679366HH908993F\","
                + "\"status\":\"SUCCESS\",\"settlementBatch\":\"B-17\"}").getBytes(StandardCharsets.UTF_8);

        assertThat(serializer.deserialize(bytes).getStatus()).isEqualTo(TransactionStatus.SUCCESS);
        assertThat(serializer.deserialize(new byte[0])).isNull();
    }
}
