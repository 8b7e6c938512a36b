package com.storefront.orders.domain;

/**
 * How the customer pays. Each method is served by exactly one gateway adapter.
 */
public enum PaymentMethod {
    /** PayPal-style redirect: buyer approves on the gateway, we capture when they come back. */
    CARD_REDIRECT,
    /** On-chain Bitcoin to a one-time deposit address. */
    BITCOIN,
    /** Monero through a third-party processor's hosted payment page. */
    MONERO
}
