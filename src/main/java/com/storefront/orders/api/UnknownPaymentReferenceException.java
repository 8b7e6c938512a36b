package com.storefront.orders.api;

/**
 * Thrown when a payment signal references no known payment intent of the signalling gateway.
 */
public class UnknownPaymentReferenceException extends OrderProcessingException {

    public UnknownPaymentReferenceException(String message) {
        super("NOT_FOUND", message);
    }

    public UnknownPaymentReferenceException(String message, Throwable cause) {
        super("NOT_FOUND", message, cause);
    }
}
