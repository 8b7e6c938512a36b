package com.storefront.orders.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.orders.compliance.WebhookSignatureVerifier;
import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentSignal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Gateway callbacks. The raw body is verified against the HMAC signature before it is parsed,
 * then handed to the confirmation tracker like any poll result.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/payments")
@RequiredArgsConstructor
@Tag(name = "Payment webhooks", description = "Asynchronous payment notifications from gateways")
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";

    private final OrderLifecycleService lifecycleService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PostMapping("/bitcoin")
    @Operation(summary = "Bitcoin address activity", description = "Deposit address callback with received satoshis and confirmations.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signal applied or ignored as a duplicate"),
            @ApiResponse(responseCode = "401", description = "Signature missing or invalid. Body: { \"error\": \"INVALID_SIGNATURE\" }"),
            @ApiResponse(responseCode = "404", description = "Unknown deposit address")
    })
    public ResponseEntity<Map<String, Object>> bitcoin(
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        signatureVerifier.verify(PaymentMethod.BITCOIN, rawBody, signature);
        return apply(PaymentMethod.BITCOIN, WebhookPayloads.bitcoin(parse(rawBody), clock.instant()));
    }

    @PostMapping("/monero")
    @Operation(summary = "Monero processor notification", description = "Payment request status change from the Monero processor.")
    public ResponseEntity<Map<String, Object>> monero(
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = "X-Globee-Signature", required = false) String processorSignature) {
        signatureVerifier.verify(PaymentMethod.MONERO, rawBody, signature != null ? signature : processorSignature);
        return apply(PaymentMethod.MONERO, WebhookPayloads.monero(parse(rawBody), clock.instant()));
    }

    @PostMapping("/redirect")
    @Operation(summary = "Redirect gateway event", description = "Order approved, capture completed or denied. Approval never completes a payment; capture does.")
    public ResponseEntity<Map<String, Object>> redirect(
            @RequestBody String rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        signatureVerifier.verify(PaymentMethod.CARD_REDIRECT, rawBody, signature);
        return apply(PaymentMethod.CARD_REDIRECT, WebhookPayloads.redirect(parse(rawBody), clock.instant()));
    }

    private ResponseEntity<Map<String, Object>> apply(PaymentMethod method, PaymentSignal signal) {
        if (signal == null) {
            log.info("Webhook for method={} carries no payment state, ignored", method);
            return ResponseEntity.ok(Map.of("received", true));
        }
        PaymentIntent intent = lifecycleService.handlePaymentSignal(method, signal.getExternalReference(), signal);
        return ResponseEntity.ok(Map.of("received", true, "status", intent.getStatus().name()));
    }

    private JsonNode parse(String rawBody) {
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook body is not valid JSON", e);
        }
    }
}
