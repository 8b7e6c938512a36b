package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A customer's request to send back some or all items of a delivered order.
 */
@Value
@Builder(toBuilder = true)
public class ReturnRequest {

    String id;
    String orderId;
    String orderNumber;
    String customerId;
    /** RET-yyyyMMdd-NNN */
    String requestNumber;
    Instant requestDate;
    @Singular
    List<ReturnItem> items;
    BigDecimal totalRefundAmount;
    ReturnStatus status;
    String adminNotes;
    String resolvedBy;
    Instant approvedAt;
    String refundId;
    Instant refundIssuedAt;
    Instant updatedAt;
}
