package com.storefront.orders.api;

/**
 * Thrown when an order or payment status change is not allowed from the current state. Nothing is written.
 */
public class InvalidTransitionException extends OrderProcessingException {

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }

    public InvalidTransitionException(String message, Throwable cause) {
        super("INVALID_TRANSITION", message, cause);
    }
}
