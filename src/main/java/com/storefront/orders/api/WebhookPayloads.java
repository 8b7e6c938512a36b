package com.storefront.orders.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.orders.domain.PaymentSignal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Locale;

/**
 * Turns gateway webhook bodies into {@link PaymentSignal}s. Returns null for event types that
 * carry nothing about a payment's state.
 */
final class WebhookPayloads {

    private static final BigDecimal SATOSHIS_PER_BTC = new BigDecimal("100000000");

    private WebhookPayloads() {}

    /** Blockonomics-style callback: {@code addr}, {@code value} in satoshis, {@code txid}, {@code confirmations}. */
    static PaymentSignal bitcoin(JsonNode body, Instant receivedAt) {
        String address = text(body, "addr");
        if (address == null) {
            throw new IllegalArgumentException("Bitcoin webhook without addr");
        }
        BigDecimal received = body.hasNonNull("value")
                ? new BigDecimal(body.get("value").asText()).divide(SATOSHIS_PER_BTC, 8, RoundingMode.DOWN)
                : null;
        return PaymentSignal.builder()
                .externalReference(address)
                .confirmations(body.hasNonNull("confirmations") ? body.get("confirmations").asInt() : null)
                .amountReceived(received)
                .transactionHash(text(body, "txid"))
                .source("webhook")
                .receivedAt(receivedAt)
                .build();
    }

    /** Processor notification: {@code id}, {@code status}, {@code confirmations}, {@code paid_amount}, {@code transaction_hash}. */
    static PaymentSignal monero(JsonNode body, Instant receivedAt) {
        JsonNode data = body.has("data") ? body.get("data") : body;
        String requestId = text(data, "id");
        if (requestId == null) {
            throw new IllegalArgumentException("Monero webhook without payment request id");
        }
        String status = text(data, "status");
        return PaymentSignal.builder()
                .externalReference(requestId)
                .statusCode(status != null ? status.toLowerCase(Locale.ROOT) : null)
                .confirmations(data.hasNonNull("confirmations") ? data.get("confirmations").asInt() : null)
                .amountReceived(data.hasNonNull("paid_amount") ? new BigDecimal(data.get("paid_amount").asText()) : null)
                .transactionHash(text(data, "transaction_hash"))
                .source("webhook")
                .receivedAt(receivedAt)
                .build();
    }

    /**
     * Redirect gateway events. Approval and capture events reference the gateway order id;
     * a completed capture observed from outside never completes the intent on its own.
     */
    static PaymentSignal redirect(JsonNode body, Instant receivedAt) {
        String eventType = text(body, "event_type");
        JsonNode resource = body.path("resource");
        String reference;
        String statusCode;
        if ("CHECKOUT.ORDER.APPROVED".equals(eventType)) {
            reference = text(resource, "id");
            statusCode = "approved";
        } else if ("PAYMENT.CAPTURE.COMPLETED".equals(eventType)) {
            reference = resource.path("supplementary_data").path("related_ids").path("order_id").asText(null);
            statusCode = "completed";
        } else if ("PAYMENT.CAPTURE.DENIED".equals(eventType)) {
            reference = resource.path("supplementary_data").path("related_ids").path("order_id").asText(null);
            statusCode = "denied";
        } else if ("CHECKOUT.ORDER.VOIDED".equals(eventType)) {
            reference = text(resource, "id");
            statusCode = "voided";
        } else {
            return null;
        }
        if (reference == null) {
            throw new IllegalArgumentException("Redirect webhook " + eventType + " without order id");
        }
        return PaymentSignal.builder()
                .externalReference(reference)
                .statusCode(statusCode)
                .source("webhook")
                .receivedAt(receivedAt)
                .build();
    }

    private static String text(JsonNode node, String field) {
        return node != null && node.hasNonNull(field) ? node.get(field).asText() : null;
    }
}
