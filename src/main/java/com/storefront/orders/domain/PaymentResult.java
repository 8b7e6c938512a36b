package com.storefront.orders.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a capture call. Cached by external reference so a repeated capture returns
 * the first result instead of charging again.
 */
@Value
@Builder
@JsonDeserialize(builder = PaymentResult.PaymentResultBuilder.class)
@JsonPOJOBuilder(withPrefix = "")
public class PaymentResult {

    String idempotencyKey;
    String providerTransactionId;
    TransactionStatus status;
    BigDecimal amount;
    String currencyCode;
    String failureCode;
    String message;
    Instant timestamp;
    Map<String, Object> metadata;

    public boolean isSuccess() {
        return status == TransactionStatus.SUCCESS;
    }
}
