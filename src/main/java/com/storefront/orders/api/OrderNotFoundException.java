package com.storefront.orders.api;

/**
 * Thrown when no order exists for the given id.
 */
public class OrderNotFoundException extends OrderProcessingException {

    public OrderNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public OrderNotFoundException(String message, Throwable cause) {
        super("NOT_FOUND", message, cause);
    }
}
