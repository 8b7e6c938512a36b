package com.storefront.orders.adapters.client;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payment request at the Monero processor.
 */
@Value
@Builder
public class MoneroPaymentRequest {

    String id;
    /** unpaid, paid, underpaid, overpaid, cancelled, expired */
    String status;
    String paymentAddress;
    BigDecimal total;
    String paymentUrl;
    Instant expiresAt;
    Integer confirmations;
    BigDecimal paidAmount;
    String transactionHash;
}
