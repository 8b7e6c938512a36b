package com.storefront.orders.api;

/**
 * Thrown when a cart line asks for more units than the catalog has in stock.
 */
public class InsufficientStockException extends OrderProcessingException {

    public InsufficientStockException(String message) {
        super("INSUFFICIENT_STOCK", message);
    }

    public InsufficientStockException(String message, Throwable cause) {
        super("INSUFFICIENT_STOCK", message, cause);
    }
}
