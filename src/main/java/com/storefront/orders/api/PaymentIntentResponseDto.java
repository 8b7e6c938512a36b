package com.storefront.orders.api;

import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What the storefront needs to present a payment: approval URL for the redirect gateway,
 * deposit address and QR payload for Bitcoin, hosted payment page for Monero.
 */
@Value
@Builder
public class PaymentIntentResponseDto {

    String intentId;
    String orderId;
    PaymentMethod method;
    String externalReference;
    IntentStatus status;
    BigDecimal amount;
    String currency;
    BigDecimal cryptoAmount;
    BigDecimal exchangeRate;
    Instant exchangeRateTimestamp;
    String presentationUrl;
    String depositAddress;
    String qrPayload;
    Instant expirationTime;
    int requiredConfirmations;
    int confirmations;

    public static PaymentIntentResponseDto from(PaymentIntent intent) {
        return PaymentIntentResponseDto.builder()
                .intentId(intent.getId())
                .orderId(intent.getOrderId())
                .method(intent.getMethod())
                .externalReference(intent.getExternalReference())
                .status(intent.getStatus())
                .amount(intent.getExpectedAmount())
                .currency(intent.getCurrency())
                .cryptoAmount(intent.getCryptoAmount())
                .exchangeRate(intent.getExchangeRate())
                .exchangeRateTimestamp(intent.getExchangeRateTimestamp())
                .presentationUrl(intent.getPresentationUrl())
                .depositAddress(intent.getDepositAddress())
                .qrPayload(intent.getQrPayload())
                .expirationTime(intent.getExpirationTime())
                .requiredConfirmations(intent.getRequiredConfirmations())
                .confirmations(intent.getObservedConfirmations())
                .build();
    }
}
