package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request to refund all or part of an order's captured payment.
 */
@Value
@Builder(toBuilder = true)
public class RefundRequest {

    /** {@code cancel-<orderId>} or {@code return-<returnId>}. */
    String idempotencyKey;
    String orderId;
    PaymentMethod paymentMethod;
    /** Gateway capture id, filled in from the completed intent. */
    String providerTransactionId;
    String externalReference;
    BigDecimal amount;
    String currencyCode;
    String reason;
    String correlationId;
}
