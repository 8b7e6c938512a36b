package com.storefront.orders.api;

/**
 * Thrown when a payment is attempted against an intent whose window has passed. The order has been cancelled.
 */
public class PaymentExpiredException extends OrderProcessingException {

    public PaymentExpiredException(String message) {
        super("PAYMENT_EXPIRED", message);
    }

    public PaymentExpiredException(String message, Throwable cause) {
        super("PAYMENT_EXPIRED", message, cause);
    }
}
