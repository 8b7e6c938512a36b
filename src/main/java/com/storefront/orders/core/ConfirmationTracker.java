package com.storefront.orders.core;

import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.api.OrderNotFoundException;
import com.storefront.orders.api.UnknownPaymentReferenceException;
import com.storefront.orders.compliance.PaymentAuditLogger;
import com.storefront.orders.compliance.SecretMasker;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Single consumer of payment signals, whether they arrive as webhooks or come from a poll.
 * Expiry is checked lazily here before any evaluation; there is no background sweeper.
 *
 * <p>An order moves to PROCESSING at most once per payment: if two signals race, the loser's
 * compare-and-set fails, the order is re-read and the completion is skipped.
 *
 * <p>Funds that arrive for an intent that was already closed, or for an order that no longer
 * waits for them, are never applied to the order. They are logged at ERROR, written to the
 * audit trail and kept on the intent for a manual refund.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfirmationTracker {

    private final PaymentPersistenceService persistenceService;
    private final PaymentGatewayRegistry gatewayRegistry;
    private final PaymentOrchestrator paymentOrchestrator;
    private final OrderRepository orderRepository;
    private final OrderStateMachine stateMachine;
    private final InventoryService inventoryService;
    private final PaymentAuditLogger auditLogger;
    private final Clock clock;

    /**
     * Applies a signal to the intent it references and, where the outcome calls for it, to
     * the order. The intent must belong to {@code method}: a reference is only ever resolved
     * within the gateway whose credentials vouched for the signal.
     *
     * @return the intent after the signal was applied
     * @throws UnknownPaymentReferenceException if no intent of {@code method} has the reference
     */
    public PaymentIntent handlePaymentSignal(PaymentMethod method, String externalReference, PaymentSignal signal) {
        String masked = SecretMasker.maskAddress(externalReference);
        PaymentIntent intent = persistenceService.findIntentByExternalReference(externalReference)
                .orElseThrow(() -> new UnknownPaymentReferenceException("No payment intent for reference " + masked));
        if (intent.getMethod() != method) {
            log.warn("Signal rejected, method mismatch: reference={} signalMethod={} intentMethod={} source={}",
                    masked, method, intent.getMethod(), signal.getSource());
            throw new UnknownPaymentReferenceException("No " + method + " payment intent for reference " + masked);
        }

        if (!intent.isOpen()) {
            if (intent.getStatus() == IntentStatus.FAILED || intent.getStatus() == IntentStatus.EXPIRED) {
                IntentStatus late = gatewayRegistry.require(method).evaluate(intent, signal);
                if (late == IntentStatus.COMPLETED) {
                    auditLogger.logSignal(intent, signal, late);
                    return recordUnappliedPayment(intent, loadOrder(intent.getOrderId()), signal, clock.instant());
                }
            }
            log.info("Signal ignored, intent already {}: intentId={} reference={} source={}",
                    intent.getStatus(), intent.getId(), masked, signal.getSource());
            return intent;
        }

        Instant now = clock.instant();
        IntentStatus outcome = gatewayRegistry.require(method).queryStatus(intent, signal, now);
        auditLogger.logSignal(intent, signal, outcome);

        switch (outcome) {
            case COMPLETED:
                return complete(intent, signal, now);
            case FAILED:
                return fail(intent, signal, now);
            case EXPIRED:
                return expire(intent);
            default:
                return track(intent, signal, outcome, now);
        }
    }

    /**
     * Asks the gateway for the current state of the order's open payment and applies the
     * answer. The gateway call happens before any write.
     */
    public PaymentIntent pollPayment(String orderId) {
        PaymentIntent intent = persistenceService.findOpenIntent(orderId)
                .orElseGet(() -> persistenceService.findIntentsByOrder(orderId).stream()
                        .findFirst()
                        .orElseThrow(() -> new UnknownPaymentReferenceException("Order " + orderId + " has no payment")));
        if (!intent.isOpen()) {
            return intent;
        }
        if (intent.isExpiredAt(clock.instant())) {
            return expire(intent);
        }
        PaymentSignal signal = paymentOrchestrator.poll(intent);
        return handlePaymentSignal(intent.getMethod(), intent.getExternalReference(), signal);
    }

    /**
     * Expires the intent and cancels its order if the order is still waiting for payment.
     * Safe to call again for an intent that is already expired.
     */
    public PaymentIntent expire(PaymentIntent intent) {
        Instant now = clock.instant();
        PaymentIntent expired = intent;
        if (intent.isOpen()) {
            expired = persistenceService.saveIntent(intent.toBuilder()
                    .status(IntentStatus.EXPIRED)
                    .updatedAt(now)
                    .build());
            log.info("Payment intent expired: intentId={} orderId={} expiredAt={}",
                    intent.getId(), intent.getOrderId(), intent.getExpirationTime());
        }

        Order order = loadOrder(intent.getOrderId());
        if (order.getStatus() == OrderStatus.PENDING) {
            try {
                Order cancelled = stateMachine.cancel(order, PaymentStatus.FAILED, "Payment window expired");
                inventoryService.release(cancelled);
            } catch (OrderConcurrentModificationException e) {
                Order current = loadOrder(intent.getOrderId());
                if (current.getStatus() == OrderStatus.PENDING) {
                    throw e;
                }
                log.info("Order {} left PENDING concurrently ({}), expiry cancellation skipped",
                        current.getId(), current.getStatus());
            }
        }
        return expired;
    }

    private PaymentIntent complete(PaymentIntent intent, PaymentSignal signal, Instant now) {
        Order order = loadOrder(intent.getOrderId());
        if (order.getPaymentStatus() == PaymentStatus.COMPLETED) {
            log.info("Order {} already shows payment COMPLETED, completion skipped", order.getId());
        } else if (order.getStatus() != OrderStatus.PENDING || order.getPaymentStatus() != PaymentStatus.PENDING) {
            PaymentIntent closed = persistenceService.saveIntent(intent.toBuilder()
                    .status(IntentStatus.COMPLETED)
                    .updatedAt(now)
                    .build());
            return recordUnappliedPayment(closed, order, signal, now);
        } else {
            try {
                stateMachine.completePayment(order, "Payment confirmed (" + intent.getMethod() + ")");
            } catch (OrderConcurrentModificationException e) {
                Order current = loadOrder(intent.getOrderId());
                if (current.getPaymentStatus() != PaymentStatus.COMPLETED) {
                    throw e;
                }
                log.info("Order {} was completed by a concurrent signal", current.getId());
            }
        }
        return persistenceService.saveIntent(intent.toBuilder()
                .status(IntentStatus.COMPLETED)
                .observedConfirmations(confirmations(intent, signal))
                .providerTransactionId(signal.getTransactionHash() != null
                        ? signal.getTransactionHash() : intent.getProviderTransactionId())
                .updatedAt(now)
                .build());
    }

    /**
     * Keeps the on-chain evidence of a payment the order will not take. The intent status is
     * left as given; repeated signals with nothing new are dropped quietly.
     */
    private PaymentIntent recordUnappliedPayment(PaymentIntent intent, Order order, PaymentSignal signal, Instant now) {
        int confirmations = confirmations(intent, signal);
        String transaction = signal.getTransactionHash() != null ? signal.getTransactionHash() : intent.getProviderTransactionId();
        if (confirmations == intent.getObservedConfirmations()
                && Objects.equals(transaction, intent.getProviderTransactionId())) {
            log.debug("Unapplied payment already recorded: intentId={}", intent.getId());
            return intent;
        }
        log.error("Payment received for order {} in status {}/{} with intent {}; manual refund required: reference={} transaction={} amount={}",
                order.getId(), order.getStatus(), order.getPaymentStatus(), intent.getStatus(),
                SecretMasker.maskAddress(intent.getExternalReference()), transaction, signal.getAmountReceived());
        auditLogger.logUnappliedPayment(intent, signal, order);
        return persistenceService.saveIntent(intent.toBuilder()
                .observedConfirmations(confirmations)
                .providerTransactionId(transaction)
                .updatedAt(now)
                .build());
    }

    private PaymentIntent fail(PaymentIntent intent, PaymentSignal signal, Instant now) {
        PaymentIntent failed = persistenceService.saveIntent(intent.toBuilder()
                .status(IntentStatus.FAILED)
                .updatedAt(now)
                .build());
        Order order = loadOrder(intent.getOrderId());
        if (order.getStatus() == OrderStatus.PENDING && order.getPaymentStatus() == PaymentStatus.PENDING) {
            stateMachine.failPayment(order, "Payment failed (" + signal.getStatusCode() + ")");
        }
        return failed;
    }

    private PaymentIntent track(PaymentIntent intent, PaymentSignal signal, IntentStatus outcome, Instant now) {
        int confirmations = confirmations(intent, signal);
        if (outcome == intent.getStatus() && confirmations == intent.getObservedConfirmations()) {
            log.debug("Payment pending, nothing changed: intentId={} status={}", intent.getId(), outcome);
            return intent;
        }
        log.info("Payment pending: intentId={} status={} confirmations={}/{}",
                intent.getId(), outcome, confirmations, intent.getRequiredConfirmations());
        return persistenceService.saveIntent(intent.toBuilder()
                .status(outcome)
                .observedConfirmations(confirmations)
                .updatedAt(now)
                .build());
    }

    private static int confirmations(PaymentIntent intent, PaymentSignal signal) {
        return signal.getConfirmations() != null ? signal.getConfirmations() : intent.getObservedConfirmations();
    }

    private Order loadOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException("Order not found: " + orderId));
    }
}
