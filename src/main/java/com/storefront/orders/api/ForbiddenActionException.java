package com.storefront.orders.api;

/**
 * Thrown when the caller is not allowed to act on the resource (not the owner, or not an admin).
 */
public class ForbiddenActionException extends OrderProcessingException {

    public ForbiddenActionException(String message) {
        super("FORBIDDEN", message);
    }

    public ForbiddenActionException(String message, Throwable cause) {
        super("FORBIDDEN", message, cause);
    }
}
