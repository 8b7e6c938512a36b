package com.storefront.orders.adapters;

import com.storefront.orders.domain.CryptoAsset;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.RefundStatus;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Refunds for crypto payments are sent by hand from the merchant wallet; the ledger entry is
 * PENDING until someone does.
 */
final class ManualRefunds {

    private ManualRefunds() {}

    static RefundResult pending(RefundRequest request, CryptoAsset asset, Instant now) {
        return RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .providerRefundId("manual-" + asset.name().toLowerCase(Locale.ROOT) + "-" + request.getIdempotencyKey())
                .status(RefundStatus.PENDING)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .message("Manual " + asset + " refund required; payment reference " + request.getExternalReference())
                .timestamp(now)
                .metadata(Map.of("manual", true, "asset", asset.name()))
                .build();
    }
}
