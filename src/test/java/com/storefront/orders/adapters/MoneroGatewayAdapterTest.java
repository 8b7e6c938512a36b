package com.storefront.orders.adapters;

import com.storefront.orders.adapters.client.MoneroPaymentRequest;
import com.storefront.orders.adapters.client.MoneroProcessorClient;
import com.storefront.orders.domain.CryptoAsset;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.storefront.orders.adapters.AdapterFixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MoneroGatewayAdapterTest {

    private static final String REQUEST_ID = "a1b2c3d4e5f6";
    private static final String XMR_ADDRESS =
            "44AFFq5kSiGBoZ4NMDwYtN18obc8AemS33DBLWs3H7otXft3XjrpDtQGv7SqSsaBYBb98uNbr2VBBEt7f2wfn3RVGQBEP3A";

    @Mock
    private MoneroProcessorClient processorClient;

    @Mock
    private ExchangeRateService exchangeRateService;

    private MoneroGatewayAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new MoneroGatewayAdapter(processorClient, exchangeRateService, Clock.fixed(NOW, ZoneOffset.UTC), 10, 24);
    }

    private PaymentIntent initiated(Instant processorExpiry) {
        when(exchangeRateService.quote(CryptoAsset.XMR, "GBP")).thenReturn(AdapterFixtures.quote(CryptoAsset.XMR, "0.006"));
        when(processorClient.createPaymentRequest("ORD-46530123-042", new BigDecimal("709.98"), "GBP", "ada@example.com"))
                .thenReturn(MoneroPaymentRequest.builder()
                        .id(REQUEST_ID)
                        .status("unpaid")
                        .paymentAddress(XMR_ADDRESS)
                        .total(new BigDecimal("709.98"))
                        .paymentUrl("https://globee.com/payment-request/" + REQUEST_ID)
                        .expiresAt(processorExpiry)
                        .build());
        return adapter.initiate(AdapterFixtures.order(PaymentMethod.MONERO));
    }

    private static PaymentSignal signal(String status, Integer confirmations) {
        return PaymentSignal.builder()
                .externalReference(REQUEST_ID)
                .statusCode(status)
                .confirmations(confirmations)
                .source("webhook")
                .receivedAt(NOW)
                .build();
    }

    @Test
    void initiateOpensHostedPaymentRequest() {
        Instant processorExpiry = NOW.plus(Duration.ofHours(2));

        PaymentIntent intent = initiated(processorExpiry);

        assertThat(intent.getExternalReference()).isEqualTo(REQUEST_ID);
        assertThat(intent.getCryptoAmount()).isEqualByComparingTo("4.25988");
        assertThat(intent.getCryptoAmount().scale()).isEqualTo(12);
        assertThat(intent.getPresentationUrl()).endsWith(REQUEST_ID);
        assertThat(intent.getQrPayload()).isEqualTo("monero:" + XMR_ADDRESS + "?tx_amount=4.259880000000");
        assertThat(intent.getExpirationTime()).isEqualTo(processorExpiry);
        assertThat(intent.getRequiredConfirmations()).isEqualTo(10);
    }

    @Test
    void expiryDefaultsWhenProcessorGivesNone() {
        PaymentIntent intent = initiated(null);

        assertThat(intent.getExpirationTime()).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    void initiateFailsWithoutPaymentUrl() {
        when(exchangeRateService.quote(CryptoAsset.XMR, "GBP")).thenReturn(AdapterFixtures.quote(CryptoAsset.XMR, "0.006"));
        when(processorClient.createPaymentRequest("ORD-46530123-042", new BigDecimal("709.98"), "GBP", "ada@example.com"))
                .thenReturn(MoneroPaymentRequest.builder().id(REQUEST_ID).build());

        assertThatThrownBy(() -> adapter.initiate(AdapterFixtures.order(PaymentMethod.MONERO)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void evaluateMapsProcessorStatuses() {
        PaymentIntent intent = initiated(null);

        assertThat(adapter.evaluate(intent, signal("paid", 3))).isEqualTo(IntentStatus.AWAITING_CONFIRMATION);
        assertThat(adapter.evaluate(intent, signal("paid", 10))).isEqualTo(IntentStatus.COMPLETED);
        assertThat(adapter.evaluate(intent, signal("confirmed", 12))).isEqualTo(IntentStatus.COMPLETED);
        assertThat(adapter.evaluate(intent, signal("underpaid", 12))).isEqualTo(IntentStatus.AWAITING_CONFIRMATION);
        assertThat(adapter.evaluate(intent, signal("cancelled", null))).isEqualTo(IntentStatus.FAILED);
        assertThat(adapter.evaluate(intent, signal("expired", null))).isEqualTo(IntentStatus.EXPIRED);
        assertThat(adapter.evaluate(intent, signal("unpaid", null))).isEqualTo(IntentStatus.INITIATED);
    }

    @Test
    void unknownStatusKeepsCurrentStatus() {
        PaymentIntent awaiting = initiated(null).toBuilder().status(IntentStatus.AWAITING_CONFIRMATION).build();

        assertThat(adapter.evaluate(awaiting, signal("processing", null))).isEqualTo(IntentStatus.AWAITING_CONFIRMATION);
    }

    @Test
    void pollReadsProcessorState() {
        PaymentIntent intent = initiated(null);
        when(processorClient.getPaymentRequest(REQUEST_ID)).thenReturn(MoneroPaymentRequest.builder()
                .id(REQUEST_ID)
                .status("paid")
                .confirmations(4)
                .paidAmount(new BigDecimal("4.259880000000"))
                .transactionHash("9f2b1c")
                .build());

        PaymentSignal signal = adapter.poll(intent);

        assertThat(signal.getStatusCode()).isEqualTo("paid");
        assertThat(signal.getConfirmations()).isEqualTo(4);
        assertThat(adapter.evaluate(intent, signal)).isEqualTo(IntentStatus.AWAITING_CONFIRMATION);
    }
}
