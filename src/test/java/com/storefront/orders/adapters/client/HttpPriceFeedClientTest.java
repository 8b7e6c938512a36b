package com.storefront.orders.adapters.client;

import com.storefront.orders.api.GatewayUnavailableException;
import com.storefront.orders.domain.CryptoAsset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpPriceFeedClientTest {

    private MockRestServiceServer server;
    private HttpPriceFeedClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpPriceFeedClient(restTemplate, "https://prices.example/api/v3");
    }

    @Test
    void priceIsReadForAssetAndLowercasedCurrency() {
        server.expect(requestTo("https://prices.example/api/v3/simple/price?ids=monero&vs_currencies=gbp"))
                .andRespond(withSuccess("{\"monero\":{\"gbp\":166.67}}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchPrice(CryptoAsset.XMR, "GBP")).isEqualByComparingTo("166.67");
    }

    @Test
    void missingPriceIsRejected() {
        server.expect(requestTo("https://prices.example/api/v3/simple/price?ids=bitcoin&vs_currencies=gbp"))
                .andRespond(withSuccess("{\"bitcoin\":{}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchPrice(CryptoAsset.BTC, "GBP"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BTC/GBP");
    }

    @Test
    void rateLimitedFeedIsGatewayUnavailable() {
        server.expect(requestTo("https://prices.example/api/v3/simple/price?ids=bitcoin&vs_currencies=gbp"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.fetchPrice(CryptoAsset.BTC, "GBP"))
                .isInstanceOf(GatewayUnavailableException.class);
    }
}
