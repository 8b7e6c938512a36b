package com.storefront.orders.adapters;

import com.storefront.orders.adapters.client.PriceFeedClient;
import com.storefront.orders.api.GatewayUnavailableException;
import com.storefront.orders.domain.CryptoAsset;
import com.storefront.orders.domain.ExchangeQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fiat to crypto conversion rates with a per-asset cache. When the price feed is down a cached
 * rate up to {@code stale-fallback-minutes} old is still served, flagged as stale.
 */
@Slf4j
@Service
public class ExchangeRateService {

    private static final int RATE_SCALE = 12;

    private final PriceFeedClient priceFeedClient;
    private final Clock clock;
    private final Duration bitcoinTtl;
    private final Duration moneroTtl;
    private final Duration staleFallback;

    private final Map<String, ExchangeQuote> cache = new ConcurrentHashMap<>();

    public ExchangeRateService(
            PriceFeedClient priceFeedClient,
            Clock clock,
            @Value("${orders.payment.exchange.btc-cache-minutes:15}") long bitcoinTtlMinutes,
            @Value("${orders.payment.exchange.xmr-cache-minutes:5}") long moneroTtlMinutes,
            @Value("${orders.payment.exchange.stale-fallback-minutes:60}") long staleFallbackMinutes) {
        this.priceFeedClient = priceFeedClient;
        this.clock = clock;
        this.bitcoinTtl = Duration.ofMinutes(bitcoinTtlMinutes);
        this.moneroTtl = Duration.ofMinutes(moneroTtlMinutes);
        this.staleFallback = Duration.ofMinutes(staleFallbackMinutes);
    }

    public ExchangeQuote quote(CryptoAsset asset, String fiatCurrency) {
        String key = asset + ":" + fiatCurrency.toUpperCase(Locale.ROOT);
        Instant now = clock.instant();
        ExchangeQuote cached = cache.get(key);
        if (cached != null && !now.isAfter(cached.getFetchedAt().plus(ttlFor(asset)))) {
            return cached;
        }

        try {
            BigDecimal price = priceFeedClient.fetchPrice(asset, fiatCurrency);
            if (price == null || price.signum() <= 0) {
                throw new IllegalStateException("Non-positive " + asset + " price: " + price);
            }
            ExchangeQuote fresh = ExchangeQuote.builder()
                    .asset(asset)
                    .fiatCurrency(fiatCurrency.toUpperCase(Locale.ROOT))
                    .rate(BigDecimal.ONE.divide(price, RATE_SCALE, RoundingMode.HALF_UP))
                    .fetchedAt(now)
                    .stale(false)
                    .build();
            cache.put(key, fresh);
            log.debug("Exchange rate refreshed: asset={} fiat={} price={} rate={}", asset, fiatCurrency, price, fresh.getRate());
            return fresh;
        } catch (RuntimeException e) {
            if (cached != null && !now.isAfter(cached.getFetchedAt().plus(staleFallback))) {
                log.warn("Price feed failed for asset={} fiat={}, using cached rate from {}: {}",
                        asset, fiatCurrency, cached.getFetchedAt(), e.getMessage());
                return cached.toBuilder().stale(true).build();
            }
            log.error("Price feed failed for asset={} fiat={} and no usable cached rate", asset, fiatCurrency, e);
            throw new GatewayUnavailableException("Exchange rate unavailable for " + asset + "/" + fiatCurrency, e);
        }
    }

    private Duration ttlFor(CryptoAsset asset) {
        return asset == CryptoAsset.BTC ? bitcoinTtl : moneroTtl;
    }
}
