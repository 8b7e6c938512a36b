package com.storefront.orders.adapters;

import com.storefront.orders.adapters.client.AddressActivity;
import com.storefront.orders.adapters.client.BitcoinNetworkClient;
import com.storefront.orders.compliance.SecretMasker;
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
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * On-chain Bitcoin payments to a one-time deposit address. The amount due is fixed in BTC at
 * initiation; the intent completes once the address has received it (within the underpayment
 * tolerance) with enough confirmations.
 */
@Slf4j
@Component
public class BitcoinGatewayAdapter implements PaymentGatewayAdapter {

    private static final BigDecimal SATOSHIS_PER_BTC = new BigDecimal("100000000");

    private final BitcoinNetworkClient networkClient;
    private final ExchangeRateService exchangeRateService;
    private final Clock clock;
    private final int requiredConfirmations;
    private final Duration expiry;
    private final BigDecimal underpaymentTolerance;

    public BitcoinGatewayAdapter(
            BitcoinNetworkClient networkClient,
            ExchangeRateService exchangeRateService,
            Clock clock,
            @Value("${orders.payment.bitcoin.required-confirmations:2}") int requiredConfirmations,
            @Value("${orders.payment.bitcoin.expiry-hours:24}") long expiryHours,
            @Value("${orders.payment.bitcoin.underpayment-tolerance:0.01}") BigDecimal underpaymentTolerance) {
        this.networkClient = networkClient;
        this.exchangeRateService = exchangeRateService;
        this.clock = clock;
        this.requiredConfirmations = requiredConfirmations;
        this.expiry = Duration.ofHours(expiryHours);
        this.underpaymentTolerance = underpaymentTolerance;
    }

    @Override
    public PaymentMethod getPaymentMethod() {
        return PaymentMethod.BITCOIN;
    }

    @Override
    public PaymentIntent initiate(Order order) {
        PaymentGatewayAdapter.requirePayable(order);
        ExchangeQuote quote = exchangeRateService.quote(CryptoAsset.BTC, order.getCurrency());
        BigDecimal btcAmount = quote.convert(order.getTotalAmount());
        String address = networkClient.newAddress();
        Instant now = clock.instant();
        log.info("Bitcoin deposit address issued: orderId={} address={} btcAmount={} rate={} staleRate={}",
                order.getId(), SecretMasker.maskAddress(address), btcAmount, quote.getRate(), quote.isStale());
        return PaymentIntent.builder()
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .method(PaymentMethod.BITCOIN)
                .externalReference(address)
                .expectedAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .cryptoAmount(btcAmount)
                .exchangeRate(quote.getRate())
                .exchangeRateTimestamp(quote.getFetchedAt())
                .depositAddress(address)
                .qrPayload(CryptoAsset.BTC.getUriScheme() + ":" + address + "?amount=" + btcAmount.toPlainString())
                .expirationTime(now.plus(expiry))
                .requiredConfirmations(requiredConfirmations)
                .observedConfirmations(0)
                .status(IntentStatus.INITIATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Override
    public PaymentSignal poll(PaymentIntent intent) {
        AddressActivity activity = networkClient.getAddressActivity(intent.getDepositAddress());
        return PaymentSignal.builder()
                .externalReference(intent.getExternalReference())
                .confirmations(activity.getConfirmations())
                .amountReceived(satoshisToBtc(activity.getReceivedSatoshis()))
                .transactionHash(activity.getLatestTransactionHash())
                .source("poll")
                .receivedAt(clock.instant())
                .build();
    }

    /**
     * A signal without an amount is judged on confirmations alone. Underpayment beyond the
     * tolerance keeps the intent waiting for a top-up until it expires.
     */
    @Override
    public IntentStatus evaluate(PaymentIntent intent, PaymentSignal signal) {
        int confirmations = signal.getConfirmations() != null ? signal.getConfirmations() : 0;
        BigDecimal received = signal.getAmountReceived();

        if (received != null) {
            if (received.signum() <= 0) {
                return IntentStatus.INITIATED;
            }
            if (intent.getCryptoAmount() != null && received.compareTo(minimumAcceptable(intent.getCryptoAmount())) < 0) {
                log.warn("Bitcoin underpayment: reference={} expected={} received={}",
                        SecretMasker.maskAddress(intent.getExternalReference()), intent.getCryptoAmount(), received);
                return IntentStatus.AWAITING_CONFIRMATION;
            }
        } else if (confirmations <= 0) {
            return intent.getStatus() == IntentStatus.AWAITING_CONFIRMATION
                    ? IntentStatus.AWAITING_CONFIRMATION
                    : IntentStatus.INITIATED;
        }

        int required = intent.getRequiredConfirmations() > 0 ? intent.getRequiredConfirmations() : requiredConfirmations;
        return confirmations >= required ? IntentStatus.COMPLETED : IntentStatus.AWAITING_CONFIRMATION;
    }

    /**
     * Bitcoin cannot be pulled back; the refund is recorded for an operator to send manually.
     */
    @Override
    public Optional<RefundResult> refund(RefundRequest request) {
        return Optional.of(ManualRefunds.pending(request, CryptoAsset.BTC, clock.instant()));
    }

    private BigDecimal minimumAcceptable(BigDecimal expected) {
        return expected.multiply(BigDecimal.ONE.subtract(underpaymentTolerance));
    }

    private static BigDecimal satoshisToBtc(long satoshis) {
        return BigDecimal.valueOf(satoshis).divide(SATOSHIS_PER_BTC, CryptoAsset.BTC.getScale(), RoundingMode.UNNECESSARY);
    }
}
