package com.storefront.orders.domain;

/**
 * Status of a refund. PENDING covers manual crypto refunds that an operator still has to send.
 */
public enum RefundStatus {
    PENDING,
    SUCCESS,
    FAILED,
    CANCELLED
}
