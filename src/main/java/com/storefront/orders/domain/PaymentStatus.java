package com.storefront.orders.domain;

/**
 * Payment status tracked on the order itself, independent of any single payment intent.
 */
public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED
}
