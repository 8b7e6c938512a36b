package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One payment attempt for an order. Matched to incoming webhooks and polls by
 * {@code externalReference} (gateway order id, deposit address or processor request id).
 */
@Value
@Builder(toBuilder = true)
public class PaymentIntent {

    String id;
    String orderId;
    PaymentMethod method;
    String externalReference;
    /** Amount due in the order currency. */
    BigDecimal expectedAmount;
    String currency;
    /** Amount due in the crypto asset; null for redirect payments. */
    BigDecimal cryptoAmount;
    /** Crypto units per unit of order currency at the time of quoting. */
    BigDecimal exchangeRate;
    Instant exchangeRateTimestamp;
    String presentationUrl;
    String depositAddress;
    String qrPayload;
    Instant expirationTime;
    int requiredConfirmations;
    int observedConfirmations;
    /** Gateway capture id once the payment is captured. */
    String providerTransactionId;
    IntentStatus status;
    Instant createdAt;
    Instant updatedAt;

    public boolean isOpen() {
        return status != null && !status.isTerminal();
    }

    public boolean isExpiredAt(Instant now) {
        return expirationTime != null && now.isAfter(expirationTime);
    }
}
