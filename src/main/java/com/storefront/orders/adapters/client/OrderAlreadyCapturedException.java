package com.storefront.orders.adapters.client;

/**
 * The redirect gateway refused a capture because the order was captured before.
 */
public class OrderAlreadyCapturedException extends RuntimeException {

    public OrderAlreadyCapturedException(String gatewayOrderId) {
        super("Gateway order " + gatewayOrderId + " is already captured");
    }
}
