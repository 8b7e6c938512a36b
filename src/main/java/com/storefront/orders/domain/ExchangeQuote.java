package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Conversion rate from a fiat currency into a crypto asset at a point in time.
 */
@Value
@Builder(toBuilder = true)
public class ExchangeQuote {

    CryptoAsset asset;
    String fiatCurrency;
    /** Units of {@link #asset} per one unit of fiat. */
    BigDecimal rate;
    Instant fetchedAt;
    /** True when served from an expired cache entry because the price feed failed. */
    boolean stale;

    public BigDecimal convert(BigDecimal fiatAmount) {
        return fiatAmount.multiply(rate).setScale(asset.getScale(), RoundingMode.HALF_UP);
    }
}
