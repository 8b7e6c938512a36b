package com.storefront.orders.api;

/**
 * Thrown when a capture cannot be performed (unknown reference, method without capture, intent not capturable).
 */
public class CaptureException extends OrderProcessingException {

    public CaptureException(String message) {
        super("CAPTURE_FAILED", message);
    }

    public CaptureException(String message, Throwable cause) {
        super("CAPTURE_FAILED", message, cause);
    }
}
