package com.storefront.orders.api;

/**
 * Thrown when the stored order no longer matches the snapshot a change was computed from. Callers re-read and retry.
 */
public class OrderConcurrentModificationException extends OrderProcessingException {

    public OrderConcurrentModificationException(String message) {
        super("CONCURRENT_MODIFICATION", message);
    }

    public OrderConcurrentModificationException(String message, Throwable cause) {
        super("CONCURRENT_MODIFICATION", message, cause);
    }
}
