package com.storefront.orders.domain;

/**
 * Lifecycle of a single payment attempt against a gateway.
 */
public enum IntentStatus {
    INITIATED,
    AWAITING_CONFIRMATION,
    COMPLETED,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED || this == FAILED;
    }
}
