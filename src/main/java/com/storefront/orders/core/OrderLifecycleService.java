package com.storefront.orders.core;

import com.storefront.orders.api.CaptureException;
import com.storefront.orders.api.ForbiddenActionException;
import com.storefront.orders.api.InvalidTransitionException;
import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.api.OrderNotFoundException;
import com.storefront.orders.api.PaymentExpiredException;
import com.storefront.orders.api.RefundFailedException;
import com.storefront.orders.api.UnknownPaymentReferenceException;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.Checkout;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.ReturnDecision;
import com.storefront.orders.domain.ReturnItem;
import com.storefront.orders.domain.ReturnRequest;
import com.storefront.orders.domain.TrackingInfo;
import com.storefront.orders.messaging.OrderEventProducer;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for everything that happens to an order after the cart: checkout, payment,
 * cancellation, fulfillment and returns. Gateway calls always happen before the order
 * commit they lead to, and no lock is held while they run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleService {

    private final CheckoutService checkoutService;
    private final InventoryService inventoryService;
    private final OrderRepository orderRepository;
    private final OrderStateMachine stateMachine;
    private final PaymentOrchestrator paymentOrchestrator;
    private final RefundOrchestrator refundOrchestrator;
    private final ConfirmationTracker confirmationTracker;
    private final ReturnWorkflow returnWorkflow;
    private final PaymentPersistenceService paymentPersistence;
    private final OrderEventProducer eventProducer;
    private final Clock clock;

    /**
     * Prices the checkout from the catalog, reserves stock and stores the order as
     * PENDING/PENDING. Stock is given back if the order cannot be stored.
     */
    public Order createOrder(AuthenticatedPrincipal principal, Checkout checkout) {
        requirePrincipal(principal);
        Order draft = checkoutService.price(principal, checkout);
        inventoryService.reserveAll(draft.getItems());
        try {
            return stateMachine.create(draft);
        } catch (RuntimeException e) {
            log.error("Order creation failed after stock was reserved: orderNumber={}", draft.getOrderNumber(), e);
            inventoryService.release(draft);
            throw e;
        }
    }

    public Order getOrder(AuthenticatedPrincipal principal, String orderId) {
        Order order = loadOrder(orderId);
        requireOwnerOrAdmin(principal, order);
        if (order.getStatus() == OrderStatus.PENDING) {
            Optional<PaymentIntent> open = paymentPersistence.findOpenIntent(orderId);
            if (open.isPresent() && open.get().isExpiredAt(clock.instant())) {
                confirmationTracker.expire(open.get());
                return loadOrder(orderId);
            }
        }
        return order;
    }

    /**
     * Starts (or resumes) payment for a PENDING order. An intent that is still open is returned
     * as is, so a double click never opens a second gateway payment.
     */
    public PaymentIntent initiatePayment(AuthenticatedPrincipal principal, String orderId) {
        Order order = loadOrder(orderId);
        requireOwnerOrAdmin(principal, order);
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new InvalidTransitionException("Order " + orderId + " is " + order.getStatus() + ", payment is closed");
        }
        if (order.getPaymentStatus() != PaymentStatus.PENDING && order.getPaymentStatus() != PaymentStatus.FAILED) {
            throw new InvalidTransitionException("Order " + orderId + " payment is already " + order.getPaymentStatus());
        }

        Optional<PaymentIntent> open = paymentPersistence.findOpenIntent(orderId);
        if (open.isPresent()) {
            PaymentIntent intent = open.get();
            if (!intent.isExpiredAt(clock.instant())) {
                log.info("Returning open payment intent: orderId={} intentId={} status={}", orderId, intent.getId(), intent.getStatus());
                return intent;
            }
            confirmationTracker.expire(intent);
            throw new PaymentExpiredException("Payment window for order " + order.getOrderNumber() + " expired; the order was cancelled");
        }

        if (order.getPaymentStatus() == PaymentStatus.FAILED) {
            order = stateMachine.reopenPayment(order);
        }
        PaymentIntent intent = paymentOrchestrator.initiate(order);
        eventProducer.publish("PAYMENT_INITIATED", order, intent.getExternalReference(), intent.getMethod().name());
        return intent;
    }

    /**
     * Captures an approved redirect payment and completes the order. Capturing again returns the
     * order unchanged.
     */
    public Order capturePayment(AuthenticatedPrincipal principal, String orderId, String externalReference) {
        Order order = loadOrder(orderId);
        requireOwnerOrAdmin(principal, order);
        PaymentIntent intent = paymentPersistence.findIntentByExternalReference(externalReference)
                .filter(found -> found.getOrderId().equals(orderId))
                .orElseThrow(() -> new UnknownPaymentReferenceException(
                        "No payment " + externalReference + " for order " + orderId));
        if (intent.getMethod() != PaymentMethod.CARD_REDIRECT) {
            throw new CaptureException("Capture is not applicable to " + intent.getMethod() + " payments");
        }

        if (intent.getStatus() == IntentStatus.COMPLETED && order.getPaymentStatus() == PaymentStatus.COMPLETED) {
            log.info("Capture repeated for completed order {}, returning it unchanged", orderId);
            return order;
        }
        if (intent.getStatus() == IntentStatus.EXPIRED || intent.isExpiredAt(clock.instant())) {
            confirmationTracker.expire(intent);
            throw new PaymentExpiredException("Payment approval for order " + order.getOrderNumber() + " expired; the order was cancelled");
        }
        if (intent.getStatus() == IntentStatus.FAILED) {
            throw new CaptureException("Payment " + externalReference + " already failed; start a new payment");
        }
        if (order.getStatus() != OrderStatus.PENDING) {
            throw new InvalidTransitionException("Order " + orderId + " is " + order.getStatus() + ", nothing to capture");
        }

        PaymentResult result = paymentOrchestrator.capture(intent);
        Instant now = clock.instant();
        if (!result.isSuccess()) {
            paymentPersistence.saveIntent(intent.toBuilder().status(IntentStatus.FAILED).updatedAt(now).build());
            Order current = loadOrder(orderId);
            if (current.getStatus() == OrderStatus.PENDING && current.getPaymentStatus() == PaymentStatus.PENDING) {
                stateMachine.failPayment(current, "Capture declined (" + result.getFailureCode() + ")");
            }
            throw new CaptureException("Capture declined for order " + order.getOrderNumber() + ": " + result.getFailureCode());
        }

        paymentPersistence.saveIntent(intent.toBuilder()
                .status(IntentStatus.COMPLETED)
                .providerTransactionId(result.getProviderTransactionId())
                .updatedAt(now)
                .build());
        Order current = loadOrder(orderId);
        if (current.getPaymentStatus() == PaymentStatus.COMPLETED) {
            return current;
        }
        try {
            return stateMachine.completePayment(current, "Payment captured (" + result.getProviderTransactionId() + ")");
        } catch (OrderConcurrentModificationException e) {
            Order latest = loadOrder(orderId);
            if (latest.getPaymentStatus() == PaymentStatus.COMPLETED) {
                return latest;
            }
            throw e;
        }
    }

    public PaymentIntent handlePaymentSignal(PaymentMethod method, String externalReference, PaymentSignal signal) {
        return confirmationTracker.handlePaymentSignal(method, externalReference, signal);
    }

    public PaymentIntent pollPayment(AuthenticatedPrincipal principal, String orderId) {
        requireOwnerOrAdmin(principal, loadOrder(orderId));
        return confirmationTracker.pollPayment(orderId);
    }

    /**
     * Cancels the whole order. A captured payment is refunded first, with the order marked as
     * cancelling for the duration so fulfillment cannot overtake the refund. If the refund
     * fails the marker is cleared and the order is otherwise left as it was.
     */
    public Order cancelOrder(String orderId, AuthenticatedPrincipal principal) {
        Order order = loadOrder(orderId);
        requireOwnerOrAdmin(principal, order);
        stateMachine.assertCancellable(order);

        PaymentStatus paymentOutcome = null;
        String note = principal.isAdmin() ? "Cancelled by admin" : "Cancelled by customer";
        if (order.getPaymentStatus() == PaymentStatus.COMPLETED) {
            order = stateMachine.beginCancellation(order);
            RefundResult refund = refundOrchestrator.execute(RefundRequest.builder()
                    .idempotencyKey("cancel-" + order.getId())
                    .orderId(order.getId())
                    .paymentMethod(order.getPaymentMethod())
                    .amount(order.getTotalAmount())
                    .currencyCode(order.getCurrency())
                    .reason("Order " + order.getOrderNumber() + " cancelled")
                    .correlationId(order.getOrderNumber())
                    .build());
            if (!refund.isSuccess()) {
                stateMachine.abortCancellation(order);
                throw new RefundFailedException("Refund for order " + order.getOrderNumber() + " failed: "
                        + refund.getFailureCode() + " " + refund.getMessage());
            }
            paymentOutcome = PaymentStatus.REFUNDED;
            note = note + ", refund " + refund.getStatus();
        }

        Order cancelled = stateMachine.cancel(order, paymentOutcome, note);
        paymentPersistence.findOpenIntent(orderId).ifPresent(intent -> {
            paymentPersistence.saveIntent(intent.toBuilder().status(IntentStatus.FAILED).updatedAt(clock.instant()).build());
            log.info("Closed open payment intent {} of cancelled order {}", intent.getId(), orderId);
        });
        inventoryService.release(cancelled);
        return cancelled;
    }

    /**
     * Admin fulfillment step. Without an explicit tracking URL one is built from the carrier.
     */
    public Order advanceFulfillment(AuthenticatedPrincipal principal, String orderId, OrderStatus newStatus, TrackingInfo tracking) {
        requireAdmin(principal);
        Order order = loadOrder(orderId);
        TrackingInfo resolved = tracking;
        if (tracking != null && tracking.getTrackingUrl() == null && tracking.getCarrier() != null) {
            resolved = TrackingInfo.builder()
                    .trackingNumber(tracking.getTrackingNumber())
                    .carrier(tracking.getCarrier())
                    .trackingUrl(tracking.getCarrier().trackingUrl(tracking.getTrackingNumber()))
                    .build();
        }
        return stateMachine.advance(order, newStatus, resolved);
    }

    public ReturnRequest requestReturn(AuthenticatedPrincipal principal, String orderId, List<ReturnItem> items) {
        requirePrincipal(principal);
        return returnWorkflow.requestReturn(principal, orderId, items);
    }

    public ReturnRequest resolveReturn(AuthenticatedPrincipal principal, String returnId, ReturnDecision decision, String notes) {
        requirePrincipal(principal);
        return returnWorkflow.resolveReturn(principal, returnId, decision, notes);
    }

    private Order loadOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException("Order not found: " + orderId));
    }

    private static void requirePrincipal(AuthenticatedPrincipal principal) {
        if (principal == null) {
            throw new ForbiddenActionException("No authenticated user");
        }
    }

    private static void requireAdmin(AuthenticatedPrincipal principal) {
        requirePrincipal(principal);
        if (!principal.isAdmin()) {
            throw new ForbiddenActionException("Administrator role required");
        }
    }

    private static void requireOwnerOrAdmin(AuthenticatedPrincipal principal, Order order) {
        requirePrincipal(principal);
        if (!principal.isAdmin() && !order.isOwnedBy(principal.getId())) {
            throw new ForbiddenActionException("Order " + order.getId() + " belongs to another customer");
        }
    }
}
