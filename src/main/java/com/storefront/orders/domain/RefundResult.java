package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Result of a refund, standardized across gateways.
 */
@Value
@Builder
public class RefundResult {

    String idempotencyKey;
    String orderId;
    /** Gateway refund id, or a manual-refund reference for crypto. */
    String providerRefundId;
    RefundStatus status;
    BigDecimal amount;
    String currencyCode;
    String failureCode;
    String message;
    Instant timestamp;
    Map<String, Object> metadata;

    /** PENDING counts as success: the refund is committed and awaits manual settlement. */
    public boolean isSuccess() {
        return status == RefundStatus.SUCCESS || status == RefundStatus.PENDING;
    }
}
