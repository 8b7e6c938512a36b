package com.storefront.orders.api;

/**
 * Thrown when a payment gateway cannot be reached or its circuit is open. Handler returns HTTP 503 so the client retries later.
 */
public class GatewayUnavailableException extends OrderProcessingException {

    public GatewayUnavailableException(String message) {
        super("GATEWAY_UNAVAILABLE", message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super("GATEWAY_UNAVAILABLE", message, cause);
    }
}
