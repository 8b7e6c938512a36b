package com.storefront.orders.domain;

/**
 * Fulfillment status of an order. CANCELLED and RETURNED are terminal.
 */
public enum OrderStatus {
    PENDING,
    PROCESSING,
    SHIPPED,
    OUT_FOR_DELIVERY,
    DELIVERED,
    CANCELLED,
    RETURNED;

    public boolean isTerminal() {
        return this == CANCELLED || this == RETURNED;
    }
}
