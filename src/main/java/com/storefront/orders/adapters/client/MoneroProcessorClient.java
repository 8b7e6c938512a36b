package com.storefront.orders.adapters.client;

import java.math.BigDecimal;

/**
 * REST client for the third-party processor that hosts Monero payment pages.
 */
public interface MoneroProcessorClient {

    MoneroPaymentRequest createPaymentRequest(String orderReference, BigDecimal fiatTotal, String currency,
                                              String customerEmail);

    MoneroPaymentRequest getPaymentRequest(String id);
}
