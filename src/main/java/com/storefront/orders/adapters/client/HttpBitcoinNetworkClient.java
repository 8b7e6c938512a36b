package com.storefront.orders.adapters.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Issues addresses through a Blockonomics-style wallet API and reads confirmations from an
 * Esplora-style block explorer.
 */
@Slf4j
@Component
public class HttpBitcoinNetworkClient implements BitcoinNetworkClient {

    private static final String GATEWAY = "Bitcoin network";

    private final RestTemplate restTemplate;
    private final String walletBaseUrl;
    private final String apiKey;
    private final String explorerBaseUrl;

    public HttpBitcoinNetworkClient(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            @Value("${orders.payment.bitcoin.wallet-base-url:https://www.blockonomics.co}") String walletBaseUrl,
            @Value("${orders.payment.bitcoin.api-key:}") String apiKey,
            @Value("${orders.payment.bitcoin.explorer-base-url:https://blockstream.info/api}") String explorerBaseUrl) {
        this.restTemplate = restTemplate;
        this.walletBaseUrl = walletBaseUrl;
        this.apiKey = apiKey;
        this.explorerBaseUrl = explorerBaseUrl;
    }

    @Override
    public String newAddress() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        try {
            JsonNode response = restTemplate.exchange(walletBaseUrl + "/api/new_address", HttpMethod.POST,
                    new HttpEntity<>(headers), JsonNode.class).getBody();
            if (response == null || !response.hasNonNull("address")) {
                throw new IllegalStateException("Wallet API returned no address");
            }
            return response.get("address").asText();
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "new address", "-", e);
        }
    }

    @Override
    public AddressActivity getAddressActivity(String address) {
        try {
            JsonNode txs = restTemplate.getForObject(explorerBaseUrl + "/address/{address}/txs", JsonNode.class, address);
            String tip = restTemplate.getForObject(explorerBaseUrl + "/blocks/tip/height", String.class);
            long tipHeight = tip != null ? Long.parseLong(tip.trim()) : 0L;

            long received = 0;
            Integer minConfirmations = null;
            String latestHash = null;
            if (txs != null) {
                for (JsonNode tx : txs) {
                    long paidToAddress = 0;
                    for (JsonNode out : tx.path("vout")) {
                        if (address.equals(out.path("scriptpubkey_address").asText())) {
                            paidToAddress += out.path("value").asLong();
                        }
                    }
                    if (paidToAddress == 0) {
                        continue;
                    }
                    received += paidToAddress;
                    JsonNode status = tx.path("status");
                    int confirmations = status.path("confirmed").asBoolean(false)
                            ? (int) Math.max(0, tipHeight - status.path("block_height").asLong() + 1)
                            : 0;
                    minConfirmations = minConfirmations == null ? confirmations : Math.min(minConfirmations, confirmations);
                    if (latestHash == null) {
                        // explorer lists newest first
                        latestHash = tx.path("txid").asText(null);
                    }
                }
            }
            return AddressActivity.builder()
                    .address(address)
                    .receivedSatoshis(received)
                    .confirmations(minConfirmations != null ? minConfirmations : 0)
                    .latestTransactionHash(latestHash)
                    .build();
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "address lookup", address, e);
        }
    }
}
