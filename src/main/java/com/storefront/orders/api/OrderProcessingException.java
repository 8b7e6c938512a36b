package com.storefront.orders.api;

/**
 * Base for business errors raised while processing orders and payments. The error code is
 * stable and is what API clients branch on; {@link GlobalExceptionHandler} maps each subtype
 * to an HTTP status.
 */
public abstract class OrderProcessingException extends RuntimeException {

    private final String errorCode;

    protected OrderProcessingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected OrderProcessingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
