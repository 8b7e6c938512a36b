package com.storefront.orders.persistence.service;

import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.RefundStatus;
import com.storefront.orders.persistence.entity.RefundEntity;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(PaymentPersistenceService.class)
class PaymentPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    @Autowired
    private PaymentPersistenceService persistenceService;

    @Test
    void openIntentIsTheLatestNonTerminalOne() {
        persistenceService.saveIntent(intent("order-1", "ref-old", IntentStatus.FAILED, NOW));
        persistenceService.saveIntent(intent("order-1", "ref-new", IntentStatus.AWAITING_CONFIRMATION, NOW.plusSeconds(60)));
        persistenceService.saveIntent(intent("order-2", "ref-other", IntentStatus.INITIATED, NOW.plusSeconds(120)));

        assertThat(persistenceService.findOpenIntent("order-1")).map(PaymentIntent::getExternalReference).contains("ref-new");
        assertThat(persistenceService.findCompletedIntent("order-1")).isEmpty();
        assertThat(persistenceService.findIntentsByOrder("order-1")).extracting(PaymentIntent::getExternalReference)
                .containsExactly("ref-new", "ref-old");
    }

    @Test
    void intentIsFoundByExternalReferenceWithCryptoQuote() {
        PaymentIntent saved = persistenceService.saveIntent(intent("order-1", "bc1qdeposit", IntentStatus.INITIATED, NOW).toBuilder()
                .method(PaymentMethod.BITCOIN)
                .cryptoAmount(new BigDecimal("0.01774950"))
                .exchangeRate(new BigDecimal("0.000025000000"))
                .requiredConfirmations(2)
                .build());

        PaymentIntent loaded = persistenceService.findIntentByExternalReference("bc1qdeposit").orElseThrow();

        assertThat(loaded.getId()).isEqualTo(saved.getId());
        assertThat(loaded.getCryptoAmount()).isEqualByComparingTo("0.01774950");
        assertThat(loaded.getRequiredConfirmations()).isEqualTo(2);
    }

    @Test
    void failedRefundRowIsOverwrittenByRetryUnderSameKey() {
        RefundRequest request = refund("return-r1", "order-1", "100.00");
        persistenceService.persistRefund(request, result(request, RefundStatus.FAILED, null));
        persistenceService.persistRefund(request, result(request, RefundStatus.SUCCESS, "3FX12345"));

        RefundEntity row = persistenceService.getRefund("return-r1").orElseThrow();
        assertThat(row.getStatus()).isEqualTo(RefundStatus.SUCCESS);
        assertThat(row.getProviderRefundId()).isEqualTo("3FX12345");
        assertThat(row.getFailureCode()).isNull();
    }

    @Test
    void committedRefundsIncludeManualCryptoRefunds() {
        RefundRequest returned = refund("return-r1", "order-1", "100.00");
        RefundRequest cancelled = refund("cancel-order-1", "order-1", "50.00");
        RefundRequest failed = refund("return-r2", "order-1", "25.00");
        persistenceService.persistRefund(returned, result(returned, RefundStatus.SUCCESS, "3FX12345"));
        persistenceService.persistRefund(cancelled, result(cancelled, RefundStatus.PENDING, "manual-btc-cancel-order-1"));
        persistenceService.persistRefund(failed, result(failed, RefundStatus.FAILED, null));

        assertThat(persistenceService.sumCommittedRefunds("order-1")).isEqualByComparingTo("150.00");
        assertThat(persistenceService.sumCommittedRefunds("order-9")).isEqualByComparingTo(BigDecimal.ZERO);
    }

    private static PaymentIntent intent(String orderId, String reference, IntentStatus status, Instant createdAt) {
        return PaymentIntent.builder()
                .id(UUID.randomUUID().toString())
                .orderId(orderId)
                .method(PaymentMethod.CARD_REDIRECT)
                .externalReference(reference)
                .expectedAmount(new BigDecimal("709.98"))
                .currency("GBP")
                .status(status)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }

    private static RefundRequest refund(String key, String orderId, String amount) {
        return RefundRequest.builder()
                .idempotencyKey(key)
                .orderId(orderId)
                .paymentMethod(PaymentMethod.CARD_REDIRECT)
                .amount(new BigDecimal(amount))
                .currencyCode("GBP")
                .reason("test")
                .build();
    }

    private static RefundResult result(RefundRequest request, RefundStatus status, String providerRefundId) {
        return RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .providerRefundId(providerRefundId)
                .status(status)
                .failureCode(status == RefundStatus.FAILED ? "GATEWAY_ERROR" : null)
                .message(status == RefundStatus.FAILED ? "HTTP 503" : null)
                .timestamp(NOW)
                .build();
    }
}
