package com.storefront.orders.api;

/**
 * Thrown when a webhook body does not carry a valid HMAC signature.
 */
public class InvalidWebhookSignatureException extends OrderProcessingException {

    public InvalidWebhookSignatureException(String message) {
        super("INVALID_SIGNATURE", message);
    }

    public InvalidWebhookSignatureException(String message, Throwable cause) {
        super("INVALID_SIGNATURE", message, cause);
    }
}
