package com.storefront.orders.adapters.client;

import com.storefront.orders.api.GatewayUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpBitcoinNetworkClientTest {

    private static final String ADDRESS = "bc1qxy2kgdygjrsqtzq2n0yrf2493p83kkfjhx0wlh";

    private MockRestServiceServer server;
    private HttpBitcoinNetworkClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HttpBitcoinNetworkClient(restTemplate, "https://wallet.example", "wallet-key", "https://explorer.example/api");
    }

    @Test
    void newAddressUsesWalletApi() {
        server.expect(requestTo("https://wallet.example/api/new_address"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer wallet-key"))
                .andRespond(withSuccess("{\"address\":\"" + ADDRESS + "\"}", MediaType.APPLICATION_JSON));

        assertThat(client.newAddress()).isEqualTo(ADDRESS);
    }

    @Test
    void activitySumsOutputsToAddressAndCountsConfirmations() {
        server.expect(requestTo("https://explorer.example/api/address/" + ADDRESS + "/txs"))
                .andRespond(withSuccess("""
                        [
                          {"txid":"newest","status":{"confirmed":true,"block_height":840001},
                           "vout":[{"scriptpubkey_address":"%1$s","value":1000000},{"scriptpubkey_address":"bc1qother","value":5}]},
                          {"txid":"older","status":{"confirmed":true,"block_height":839990},
                           "vout":[{"scriptpubkey_address":"%1$s","value":774950}]},
                          {"txid":"unrelated","status":{"confirmed":false},
                           "vout":[{"scriptpubkey_address":"bc1qother","value":99}]}
                        ]
                        """.formatted(ADDRESS), MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://explorer.example/api/blocks/tip/height"))
                .andRespond(withSuccess("840002", MediaType.TEXT_PLAIN));

        AddressActivity activity = client.getAddressActivity(ADDRESS);

        assertThat(activity.getReceivedSatoshis()).isEqualTo(1_774_950L);
        assertThat(activity.getConfirmations()).isEqualTo(2);
        assertThat(activity.getLatestTransactionHash()).isEqualTo("newest");
    }

    @Test
    void explorerOutageIsGatewayUnavailable() {
        server.expect(requestTo("https://explorer.example/api/address/" + ADDRESS + "/txs"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> client.getAddressActivity(ADDRESS))
                .isInstanceOf(GatewayUnavailableException.class);
    }
}
