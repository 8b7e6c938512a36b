package com.storefront.orders.core;

import com.storefront.orders.api.CaptureException;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * Contract every payment gateway implements. One adapter per {@link PaymentMethod};
 * {@link PaymentGatewayRegistry} picks it by the order's method. Network calls
 * ({@link #initiate}, {@link #capture}, {@link #poll}, {@link #refund}) are invoked through
 * {@link PaymentOrchestrator} so they run under the adapter's circuit breaker and retry.
 */
public interface PaymentGatewayAdapter {

    PaymentMethod getPaymentMethod();

    /** Name of the circuit breaker instance guarding this adapter. */
    default String getAdapterName() {
        return getClass().getSimpleName();
    }

    /**
     * Opens a payment at the gateway and returns presentation data for the customer.
     * The order must have items and a positive total.
     */
    PaymentIntent initiate(Order order);

    /**
     * Finalizes a synchronous payment. Only the redirect gateway supports this.
     */
    default PaymentResult capture(PaymentIntent intent) {
        throw new CaptureException("Capture is not applicable to " + getPaymentMethod()
                + " payments (reference=" + intent.getExternalReference() + ")");
    }

    /** Reads the current state from the gateway without changing anything there. */
    PaymentSignal poll(PaymentIntent intent);

    /** Maps a signal to the intent status it implies. Pure: no I/O. */
    IntentStatus evaluate(PaymentIntent intent, PaymentSignal signal);

    /**
     * Status of the intent as of {@code now} given the latest signal: EXPIRED once past its
     * window whatever the signal says, otherwise {@link #evaluate}. Pure, so it is safe to
     * repeat for the same signal.
     */
    default IntentStatus queryStatus(PaymentIntent intent, PaymentSignal signal, Instant now) {
        if (intent.isExpiredAt(now)) {
            return IntentStatus.EXPIRED;
        }
        return evaluate(intent, signal);
    }

    /** Empty when the gateway cannot refund at all. */
    Optional<RefundResult> refund(RefundRequest request);

    static void requirePayable(Order order) {
        if (order.getItems() == null || order.getItems().isEmpty()) {
            throw new IllegalArgumentException("Order " + order.getId() + " has no items to pay for");
        }
        if (order.getTotalAmount() == null || order.getTotalAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Order " + order.getId() + " total must be positive");
        }
    }
}
