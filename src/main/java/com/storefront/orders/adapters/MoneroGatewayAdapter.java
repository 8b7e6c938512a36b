package com.storefront.orders.adapters;

import com.storefront.orders.adapters.client.MoneroPaymentRequest;
import com.storefront.orders.adapters.client.MoneroProcessorClient;
import com.storefront.orders.core.PaymentGatewayAdapter;
import com.storefront.orders.domain.CryptoAsset;
import com.storefront.orders.domain.ExchangeQuote;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Monero through a third-party processor. The customer pays on the processor's hosted page;
 * the processor reports progress by webhook, and we can poll it as well.
 */
@Slf4j
@Component
public class MoneroGatewayAdapter implements PaymentGatewayAdapter {

    private final MoneroProcessorClient processorClient;
    private final ExchangeRateService exchangeRateService;
    private final Clock clock;
    private final int requiredConfirmations;
    private final Duration expiry;

    public MoneroGatewayAdapter(
            MoneroProcessorClient processorClient,
            ExchangeRateService exchangeRateService,
            Clock clock,
            @Value("${orders.payment.monero.required-confirmations:10}") int requiredConfirmations,
            @Value("${orders.payment.monero.expiry-hours:24}") long expiryHours) {
        this.processorClient = processorClient;
        this.exchangeRateService = exchangeRateService;
        this.clock = clock;
        this.requiredConfirmations = requiredConfirmations;
        this.expiry = Duration.ofHours(expiryHours);
    }

    @Override
    public PaymentMethod getPaymentMethod() {
        return PaymentMethod.MONERO;
    }

    @Override
    public PaymentIntent initiate(Order order) {
        PaymentGatewayAdapter.requirePayable(order);
        ExchangeQuote quote = exchangeRateService.quote(CryptoAsset.XMR, order.getCurrency());
        BigDecimal xmrAmount = quote.convert(order.getTotalAmount());
        MoneroPaymentRequest request = processorClient.createPaymentRequest(
                order.getOrderNumber(), order.getTotalAmount(), order.getCurrency(), order.getCustomerEmail());
        if (request.getId() == null || request.getPaymentUrl() == null) {
            throw new IllegalStateException("Monero processor returned no request id or payment URL for order " + order.getId());
        }
        Instant now = clock.instant();
        Instant expiresAt = request.getExpiresAt() != null ? request.getExpiresAt() : now.plus(expiry);
        String qrPayload = request.getPaymentAddress() != null
                ? CryptoAsset.XMR.getUriScheme() + ":" + request.getPaymentAddress() + "?tx_amount=" + xmrAmount.toPlainString()
                : null;
        log.info("Monero payment request opened: orderId={} requestId={} xmrAmount={} expiresAt={}",
                order.getId(), request.getId(), xmrAmount, expiresAt);
        return PaymentIntent.builder()
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .method(PaymentMethod.MONERO)
                .externalReference(request.getId())
                .expectedAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .cryptoAmount(xmrAmount)
                .exchangeRate(quote.getRate())
                .exchangeRateTimestamp(quote.getFetchedAt())
                .presentationUrl(request.getPaymentUrl())
                .depositAddress(request.getPaymentAddress())
                .qrPayload(qrPayload)
                .expirationTime(expiresAt)
                .requiredConfirmations(requiredConfirmations)
                .observedConfirmations(0)
                .status(IntentStatus.INITIATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Override
    public PaymentSignal poll(PaymentIntent intent) {
        MoneroPaymentRequest request = processorClient.getPaymentRequest(intent.getExternalReference());
        return PaymentSignal.builder()
                .externalReference(intent.getExternalReference())
                .statusCode(request.getStatus())
                .confirmations(request.getConfirmations())
                .amountReceived(request.getPaidAmount())
                .transactionHash(request.getTransactionHash())
                .source("poll")
                .receivedAt(clock.instant())
                .build();
    }

    @Override
    public IntentStatus evaluate(PaymentIntent intent, PaymentSignal signal) {
        int confirmations = signal.getConfirmations() != null ? signal.getConfirmations() : 0;
        int required = intent.getRequiredConfirmations() > 0 ? intent.getRequiredConfirmations() : requiredConfirmations;
        String code = signal.getStatusCode() == null ? "" : signal.getStatusCode().toLowerCase(Locale.ROOT);
        switch (code) {
            case "paid":
            case "overpaid":
            case "confirmed":
            case "completed":
                return confirmations >= required ? IntentStatus.COMPLETED : IntentStatus.AWAITING_CONFIRMATION;
            case "underpaid":
                return IntentStatus.AWAITING_CONFIRMATION;
            case "cancelled":
            case "canceled":
            case "failed":
                return IntentStatus.FAILED;
            case "expired":
                return IntentStatus.EXPIRED;
            case "":
                if (confirmations >= required) {
                    return IntentStatus.COMPLETED;
                }
                return confirmations > 0 ? IntentStatus.AWAITING_CONFIRMATION : currentOrInitiated(intent);
            default:
                return currentOrInitiated(intent);
        }
    }

    @Override
    public Optional<RefundResult> refund(RefundRequest request) {
        return Optional.of(ManualRefunds.pending(request, CryptoAsset.XMR, clock.instant()));
    }

    private static IntentStatus currentOrInitiated(PaymentIntent intent) {
        return intent.getStatus() != null && !intent.getStatus().isTerminal() ? intent.getStatus() : IntentStatus.INITIATED;
    }
}
