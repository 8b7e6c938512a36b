package com.storefront.orders.adapters.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Talks to the redirect gateway's v2 checkout API. OAuth client-credentials tokens are cached
 * until shortly before they expire.
 */
@Slf4j
@Component
public class HttpRedirectGatewayClient implements RedirectGatewayClient {

    private static final String GATEWAY = "Redirect gateway";
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;
    private static final ObjectMapper ERROR_READER = new ObjectMapper();

    private final RestTemplate restTemplate;
    private final Clock clock;
    private final String baseUrl;
    private final String clientId;
    private final String clientSecret;
    private final String returnUrl;
    private final String cancelUrl;

    private volatile String accessToken;
    private volatile Instant accessTokenExpiresAt = Instant.EPOCH;

    public HttpRedirectGatewayClient(
            @Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
            Clock clock,
            @Value("${orders.payment.redirect.base-url:https://api-m.sandbox.paypal.com}") String baseUrl,
            @Value("${orders.payment.redirect.client-id:}") String clientId,
            @Value("${orders.payment.redirect.client-secret:}") String clientSecret,
            @Value("${orders.payment.redirect.return-url:http://localhost:3000/checkout/success}") String returnUrl,
            @Value("${orders.payment.redirect.cancel-url:http://localhost:3000/checkout/cancel}") String cancelUrl) {
        this.restTemplate = restTemplate;
        this.clock = clock;
        this.baseUrl = baseUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.returnUrl = returnUrl;
        this.cancelUrl = cancelUrl;
    }

    @Override
    public RedirectOrder createOrder(String referenceId, BigDecimal amount, String currencyCode) {
        Map<String, Object> body = new HashMap<>();
        body.put("intent", "CAPTURE");
        body.put("purchase_units", List.of(Map.of(
                "reference_id", referenceId,
                "amount", money(amount, currencyCode))));
        body.put("application_context", Map.of(
                "return_url", returnUrl,
                "cancel_url", cancelUrl,
                "user_action", "PAY_NOW"));
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/v2/checkout/orders", HttpMethod.POST,
                    new HttpEntity<>(body, authorizedHeaders()), JsonNode.class).getBody();
            RedirectOrder order = toOrder(response);
            log.info("Redirect gateway order created: gatewayOrderId={} reference={} status={}",
                    order.getId(), referenceId, order.getStatus());
            return order;
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "create order", referenceId, e);
        }
    }

    @Override
    public RedirectOrder captureOrder(String gatewayOrderId) {
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/v2/checkout/orders/" + gatewayOrderId + "/capture",
                    HttpMethod.POST, new HttpEntity<>(Map.of(), authorizedHeaders()), JsonNode.class).getBody();
            return toOrder(response);
        } catch (HttpClientErrorException e) {
            String responseBody = e.getResponseBodyAsString();
            if (responseBody.contains("ORDER_ALREADY_CAPTURED")) {
                throw new OrderAlreadyCapturedException(gatewayOrderId);
            }
            if (e.getStatusCode().value() == 422) {
                // declined instrument, order not approved, ...
                log.warn("Redirect gateway declined capture: gatewayOrderId={} status={}",
                        gatewayOrderId, e.getStatusCode().value());
                return RedirectOrder.builder()
                        .id(gatewayOrderId)
                        .status("DECLINED")
                        .failureReason(issueOf(responseBody))
                        .build();
            }
            throw GatewayCallFailures.unavailable(GATEWAY, "capture", gatewayOrderId, e);
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "capture", gatewayOrderId, e);
        }
    }

    @Override
    public RedirectOrder getOrder(String gatewayOrderId) {
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/v2/checkout/orders/" + gatewayOrderId,
                    HttpMethod.GET, new HttpEntity<>(authorizedHeaders()), JsonNode.class).getBody();
            return toOrder(response);
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "get order", gatewayOrderId, e);
        }
    }

    @Override
    public RedirectRefund refundCapture(String captureId, BigDecimal amount, String currencyCode, String note, String requestId) {
        Map<String, Object> body = new HashMap<>();
        body.put("amount", money(amount, currencyCode));
        if (note != null) {
            body.put("note_to_payer", note);
        }
        HttpHeaders headers = authorizedHeaders();
        if (requestId != null) {
            headers.set("PayPal-Request-Id", requestId);
        }
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/v2/payments/captures/" + captureId + "/refund",
                    HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class).getBody();
            return RedirectRefund.builder()
                    .id(text(response, "id"))
                    .status(text(response, "status"))
                    .build();
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "refund", captureId, e);
        }
    }

    private HttpHeaders authorizedHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(accessToken());
        return headers;
    }

    private synchronized String accessToken() {
        Instant now = clock.instant();
        if (accessToken != null && now.isBefore(accessTokenExpiresAt)) {
            return accessToken;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(clientId, clientSecret);
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        try {
            JsonNode response = restTemplate.exchange(baseUrl + "/v1/oauth2/token", HttpMethod.POST,
                    new HttpEntity<>(form, headers), JsonNode.class).getBody();
            if (response == null || !response.hasNonNull("access_token")) {
                throw new IllegalStateException("Redirect gateway token response has no access_token");
            }
            long expiresIn = response.path("expires_in").asLong(300);
            accessToken = response.get("access_token").asText();
            accessTokenExpiresAt = now.plusSeconds(Math.max(0, expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS));
            log.debug("Redirect gateway access token refreshed, expiresIn={}s", expiresIn);
            return accessToken;
        } catch (RestClientException e) {
            throw GatewayCallFailures.unavailable(GATEWAY, "authenticate", clientId, e);
        }
    }

    private static Map<String, String> money(BigDecimal amount, String currencyCode) {
        return Map.of(
                "currency_code", currencyCode,
                "value", amount.setScale(2, RoundingMode.HALF_UP).toPlainString());
    }

    private static RedirectOrder toOrder(JsonNode node) {
        if (node == null) {
            throw new IllegalStateException("Redirect gateway returned an empty body");
        }
        String approvalUrl = null;
        for (JsonNode link : node.path("links")) {
            String rel = link.path("rel").asText();
            if ("approve".equals(rel) || "payer-action".equals(rel)) {
                approvalUrl = link.path("href").asText();
            }
        }
        JsonNode capture = node.path("purchase_units").path(0).path("payments").path("captures").path(0);
        BigDecimal capturedAmount = capture.path("amount").hasNonNull("value")
                ? new BigDecimal(capture.path("amount").get("value").asText())
                : null;
        return RedirectOrder.builder()
                .id(text(node, "id"))
                .status(text(node, "status"))
                .approvalUrl(approvalUrl)
                .captureId(capture.isMissingNode() ? null : text(capture, "id"))
                .capturedAmount(capturedAmount)
                .currencyCode(capture.path("amount").hasNonNull("currency_code")
                        ? capture.path("amount").get("currency_code").asText() : null)
                .build();
    }

    private static String issueOf(String responseBody) {
        try {
            JsonNode error = ERROR_READER.readTree(responseBody);
            return error.path("details").path(0).path("issue").asText("CAPTURE_DECLINED");
        } catch (JsonProcessingException e) {
            return "CAPTURE_DECLINED";
        }
    }

    private static String text(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
