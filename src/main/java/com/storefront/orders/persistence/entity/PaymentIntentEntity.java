package com.storefront.orders.persistence.entity;

import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentMethod;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persistent payment intent. Looked up by {@code external_reference} when a webhook or poll
 * result comes in.
 */
@Entity
@Table(name = "payment_intents", indexes = {
    @Index(name = "idx_intent_external_ref", columnList = "external_reference", unique = true),
    @Index(name = "idx_intent_order", columnList = "order_id"),
    @Index(name = "idx_intent_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentEntity {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 32)
    private PaymentMethod method;

    @Column(name = "external_reference", nullable = false)
    private String externalReference;

    @Column(name = "expected_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal expectedAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "crypto_amount", precision = 30, scale = 12)
    private BigDecimal cryptoAmount;

    @Column(name = "exchange_rate", precision = 30, scale = 12)
    private BigDecimal exchangeRate;

    @Column(name = "exchange_rate_at")
    private Instant exchangeRateTimestamp;

    @Column(name = "presentation_url", length = 1000)
    private String presentationUrl;

    @Column(name = "deposit_address")
    private String depositAddress;

    @Column(name = "qr_payload", length = 1000)
    private String qrPayload;

    @Column(name = "expiration_time")
    private Instant expirationTime;

    @Column(name = "required_confirmations", nullable = false)
    private int requiredConfirmations;

    @Column(name = "observed_confirmations", nullable = false)
    private int observedConfirmations;

    @Column(name = "provider_transaction_id")
    private String providerTransactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private IntentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
