package com.storefront.orders.adapters.client;

import com.storefront.orders.domain.CryptoAsset;

import java.math.BigDecimal;

/**
 * Spot prices for crypto assets.
 */
public interface PriceFeedClient {

    /** Price of one unit of {@code asset} in {@code fiatCurrency}. */
    BigDecimal fetchPrice(CryptoAsset asset, String fiatCurrency);
}
