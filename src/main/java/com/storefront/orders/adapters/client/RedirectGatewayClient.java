package com.storefront.orders.adapters.client;

import java.math.BigDecimal;

/**
 * REST client for a PayPal-style checkout API.
 */
public interface RedirectGatewayClient {

    RedirectOrder createOrder(String referenceId, BigDecimal amount, String currencyCode);

    /**
     * @throws OrderAlreadyCapturedException when the gateway says the order was captured already
     */
    RedirectOrder captureOrder(String gatewayOrderId);

    RedirectOrder getOrder(String gatewayOrderId);

    /**
     * @param requestId sent as the gateway's request id so a retried call cannot refund twice
     */
    RedirectRefund refundCapture(String captureId, BigDecimal amount, String currencyCode, String note, String requestId);
}
