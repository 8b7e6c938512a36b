package com.storefront.orders.domain;

/**
 * Outcome of a synchronous gateway capture.
 */
public enum TransactionStatus {
    SUCCESS,
    FAILED
}
