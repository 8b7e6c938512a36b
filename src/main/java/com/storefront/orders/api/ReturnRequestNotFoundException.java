package com.storefront.orders.api;

/**
 * Thrown when no return request exists for the given id.
 */
public class ReturnRequestNotFoundException extends OrderProcessingException {

    public ReturnRequestNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public ReturnRequestNotFoundException(String message, Throwable cause) {
        super("NOT_FOUND", message, cause);
    }
}
