package com.storefront.orders.adapters.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.orders.domain.CryptoAsset;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * CoinGecko {@code simple/price} lookup.
 */
@Component
public class HttpPriceFeedClient implements PriceFeedClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpPriceFeedClient(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            @Value("${orders.payment.exchange.base-url:https://api.coingecko.com/api/v3}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
    }

    @Override
    public BigDecimal fetchPrice(CryptoAsset asset, String fiatCurrency) {
        String fiat = fiatCurrency.toLowerCase(Locale.ROOT);
        try {
            JsonNode response = restTemplate.getForObject(baseUrl + "/simple/price?ids={ids}&vs_currencies={fiat}",
                    JsonNode.class, asset.getPriceFeedId(), fiat);
            JsonNode price = response == null ? null : response.path(asset.getPriceFeedId()).get(fiat);
            if (price == null || !price.isNumber()) {
                throw new IllegalStateException("No " + asset + "/" + fiatCurrency + " price in feed response");
            }
            return price.decimalValue();
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable("Price feed", "price lookup", asset + "/" + fiatCurrency, e);
        }
    }
}
