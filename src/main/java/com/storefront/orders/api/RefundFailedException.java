package com.storefront.orders.api;

/**
 * Thrown when the gateway rejects or cannot process a refund. The order status is left unchanged.
 */
public class RefundFailedException extends OrderProcessingException {

    public RefundFailedException(String message) {
        super("REFUND_FAILED", message);
    }

    public RefundFailedException(String message, Throwable cause) {
        super("REFUND_FAILED", message, cause);
    }
}
