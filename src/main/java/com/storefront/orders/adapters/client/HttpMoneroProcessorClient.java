package com.storefront.orders.adapters.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * GloBee-style processor API: {@code POST /payment-request} and {@code GET /payment-request/{id}}.
 * Responses wrap the payload in {@code data}.
 */
@Slf4j
@Component
public class HttpMoneroProcessorClient implements MoneroProcessorClient {

    private static final String GATEWAY = "Monero processor";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;
    private final String notificationUrl;
    private final String successUrl;

    public HttpMoneroProcessorClient(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            @Value("${orders.payment.monero.base-url:https://globee.com/payment-api/v1}") String baseUrl,
            @Value("${orders.payment.monero.api-key:}") String apiKey,
            @Value("${orders.payment.monero.notification-url:http://localhost:8080/api/v1/webhooks/payments/monero}") String notificationUrl,
            @Value("${orders.payment.monero.success-url:http://localhost:3000/checkout/success}") String successUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.notificationUrl = notificationUrl;
        this.successUrl = successUrl;
    }

    @Override
    public MoneroPaymentRequest createPaymentRequest(String orderReference, BigDecimal fiatTotal, String currency,
                                                     String customerEmail) {
        Map<String, Object> body = new HashMap<>();
        body.put("total", fiatTotal.setScale(2, RoundingMode.HALF_UP));
        body.put("currency", currency);
        body.put("custom_payment_id", orderReference);
        body.put("payment_methods", new String[]{"XMR"});
        body.put("notification_url", notificationUrl);
        body.put("success_url", successUrl);
        if (customerEmail != null) {
            body.put("customer", Map.of("email", customerEmail));
        }
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/payment-request", HttpMethod.POST,
                    new HttpEntity<>(body, headers()), JsonNode.class).getBody();
            MoneroPaymentRequest request = toRequest(response);
            log.info("Monero payment request created: id={} reference={} status={}",
                    request.getId(), orderReference, request.getStatus());
            return request;
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "create payment request", orderReference, e);
        }
    }

    @Override
    public MoneroPaymentRequest getPaymentRequest(String id) {
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/payment-request/" + id, HttpMethod.GET,
                    new HttpEntity<>(headers()), JsonNode.class).getBody();
            return toRequest(response);
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "get payment request", id, e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-AUTH-KEY", apiKey);
        return headers;
    }

    private static MoneroPaymentRequest toRequest(JsonNode response) {
        if (response == null) {
            throw new IllegalStateException("Monero processor returned an empty body");
        }
        JsonNode data = response.has("data") ? response.get("data") : response;
        return MoneroPaymentRequest.builder()
                .id(text(data, "id"))
                .status(text(data, "status"))
                .paymentAddress(text(data, "payment_address"))
                .total(decimal(data, "total"))
                .paymentUrl(text(data, "payment_url"))
                .expiresAt(instant(text(data, "expiration_time")))
                .confirmations(data.hasNonNull("confirmations") ? data.get("confirmations").asInt() : null)
                .paidAmount(decimal(data, "paid_amount"))
                .transactionHash(text(data, "transaction_hash"))
                .build();
    }

    private static String text(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        return node.hasNonNull(field) ? new BigDecimal(node.get(field).asText()) : null;
    }

    private static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable expiration_time from Monero processor: {}", value);
            return null;
        }
    }
}
