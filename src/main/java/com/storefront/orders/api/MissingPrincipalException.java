package com.storefront.orders.api;

/**
 * Thrown when a request reaches an endpoint without the identity headers set by the auth layer.
 */
public class MissingPrincipalException extends OrderProcessingException {

    public MissingPrincipalException(String message) {
        super("UNAUTHENTICATED", message);
    }

    public MissingPrincipalException(String message, Throwable cause) {
        super("UNAUTHENTICATED", message, cause);
    }
}
