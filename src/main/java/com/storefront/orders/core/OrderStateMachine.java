package com.storefront.orders.core;

import com.storefront.orders.api.InvalidTransitionException;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.domain.StatusHistoryEntry;
import com.storefront.orders.domain.TrackingInfo;
import com.storefront.orders.messaging.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The only place order and payment status change. Each operation checks the transition
 * against the tables below, builds a new snapshot with exactly one appended history entry
 * (return and cancellation flags excepted), and commits it with a compare-and-set. An illegal transition
 * throws before anything is written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderStateMachine {

    private static final Map<OrderStatus, Set<OrderStatus>> ORDER_TRANSITIONS = new EnumMap<>(OrderStatus.class);
    private static final Map<PaymentStatus, Set<PaymentStatus>> PAYMENT_TRANSITIONS = new EnumMap<>(PaymentStatus.class);

    static {
        ORDER_TRANSITIONS.put(OrderStatus.PENDING, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED));
        ORDER_TRANSITIONS.put(OrderStatus.PROCESSING, EnumSet.of(OrderStatus.SHIPPED, OrderStatus.CANCELLED));
        ORDER_TRANSITIONS.put(OrderStatus.SHIPPED, EnumSet.of(OrderStatus.OUT_FOR_DELIVERY, OrderStatus.DELIVERED));
        ORDER_TRANSITIONS.put(OrderStatus.OUT_FOR_DELIVERY, EnumSet.of(OrderStatus.DELIVERED));
        ORDER_TRANSITIONS.put(OrderStatus.DELIVERED, EnumSet.of(OrderStatus.RETURNED));
        ORDER_TRANSITIONS.put(OrderStatus.CANCELLED, EnumSet.noneOf(OrderStatus.class));
        ORDER_TRANSITIONS.put(OrderStatus.RETURNED, EnumSet.noneOf(OrderStatus.class));

        PAYMENT_TRANSITIONS.put(PaymentStatus.PENDING, EnumSet.of(PaymentStatus.COMPLETED, PaymentStatus.FAILED));
        PAYMENT_TRANSITIONS.put(PaymentStatus.FAILED, EnumSet.of(PaymentStatus.PENDING));
        PAYMENT_TRANSITIONS.put(PaymentStatus.COMPLETED, EnumSet.of(PaymentStatus.REFUNDED));
        PAYMENT_TRANSITIONS.put(PaymentStatus.REFUNDED, EnumSet.noneOf(PaymentStatus.class));
    }

    private static final Set<OrderStatus> FULFILLMENT_TARGETS =
            EnumSet.of(OrderStatus.SHIPPED, OrderStatus.OUT_FOR_DELIVERY, OrderStatus.DELIVERED);

    private final OrderRepository orderRepository;
    private final OrderEventProducer eventProducer;
    private final Clock clock;

    public static boolean canTransition(OrderStatus from, OrderStatus to) {
        return ORDER_TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public static boolean canTransition(PaymentStatus from, PaymentStatus to) {
        return PAYMENT_TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    /**
     * Stores a freshly priced order as PENDING/PENDING with its first history entry.
     */
    public Order create(Order draft) {
        Instant now = clock.instant();
        Order order = draft.toBuilder()
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .clearStatusHistory()
                .statusHistoryEntry(entry(OrderStatus.PENDING, now, "Order placed"))
                .hasReturnRequest(false)
                .cancellationPending(false)
                .createdAt(now)
                .updatedAt(now)
                .version(0L)
                .build();
        Order saved = orderRepository.insert(order);
        log.info("Order created: orderId={} orderNumber={} total={} method={}",
                saved.getId(), saved.getOrderNumber(), saved.getTotalAmount(), saved.getPaymentMethod());
        eventProducer.publish("ORDER_CREATED", saved);
        return saved;
    }

    /**
     * PENDING/PENDING to PROCESSING/COMPLETED. The two fields always move together.
     */
    public Order completePayment(Order current, String note) {
        requireOrderTransition(current, OrderStatus.PROCESSING);
        requirePaymentTransition(current, PaymentStatus.COMPLETED);
        Instant now = clock.instant();
        Order next = next(current, OrderStatus.PROCESSING, now, note != null ? note : "Payment completed")
                .paymentStatus(PaymentStatus.COMPLETED)
                .build();
        return commit(current, next, "PAYMENT_COMPLETED");
    }

    /**
     * Marks the payment FAILED. The order stays PENDING so the customer can pay again.
     */
    public Order failPayment(Order current, String note) {
        if (current.getStatus() != OrderStatus.PENDING) {
            throw invalid(current, "payment can only fail while the order is PENDING");
        }
        requirePaymentTransition(current, PaymentStatus.FAILED);
        Instant now = clock.instant();
        Order next = next(current, OrderStatus.PENDING, now, note != null ? note : "Payment failed")
                .paymentStatus(PaymentStatus.FAILED)
                .build();
        return commit(current, next, "PAYMENT_FAILED");
    }

    /**
     * FAILED back to PENDING before a new payment attempt.
     */
    public Order reopenPayment(Order current) {
        if (current.getStatus() != OrderStatus.PENDING) {
            throw invalid(current, "payment can only be retried while the order is PENDING");
        }
        requirePaymentTransition(current, PaymentStatus.PENDING);
        Instant now = clock.instant();
        Order next = next(current, OrderStatus.PENDING, now, "Payment retry started")
                .paymentStatus(PaymentStatus.PENDING)
                .build();
        return commit(current, next, "PAYMENT_REOPENED");
    }

    /**
     * Admin-driven fulfillment: SHIPPED, OUT_FOR_DELIVERY or DELIVERED. Shipping needs a
     * tracking number; delivery stamps {@code deliveryDate}.
     */
    public Order advance(Order current, OrderStatus target, TrackingInfo tracking) {
        if (!FULFILLMENT_TARGETS.contains(target)) {
            throw new InvalidTransitionException("Fulfillment cannot move an order to " + target);
        }
        if (current.isCancellationPending()) {
            throw invalid(current, "cancellation is in progress");
        }
        requireOrderTransition(current, target);
        Instant now = clock.instant();
        Order.OrderBuilder builder;
        if (target == OrderStatus.SHIPPED) {
            if (tracking == null || tracking.getTrackingNumber() == null || tracking.getTrackingNumber().isBlank()) {
                throw new IllegalArgumentException("trackingNumber is required to ship an order");
            }
            builder = next(current, target, now, "Shipped with tracking " + tracking.getTrackingNumber())
                    .trackingNumber(tracking.getTrackingNumber().trim())
                    .carrier(tracking.getCarrier())
                    .trackingUrl(tracking.getTrackingUrl());
        } else if (target == OrderStatus.DELIVERED) {
            builder = next(current, target, now, "Delivered").deliveryDate(now);
        } else {
            builder = next(current, target, now, "Out for delivery");
        }
        return commit(current, builder.build(), "ORDER_STATUS_CHANGED");
    }

    /**
     * Throws unless the order may still be cancelled. Called before any refund is attempted.
     */
    public void assertCancellable(Order current) {
        requireOrderTransition(current, OrderStatus.CANCELLED);
    }

    /**
     * Commits the cancellation marker ahead of a refund, so that fulfillment started while the
     * gateway call runs is rejected. Already marked orders are returned unchanged, which lets a
     * cancellation interrupted after its refund be retried. No history entry is added.
     */
    public Order beginCancellation(Order current) {
        assertCancellable(current);
        if (current.isCancellationPending()) {
            return current;
        }
        Order next = current.toBuilder()
                .cancellationPending(true)
                .updatedAt(clock.instant())
                .version(current.getVersion() + 1)
                .build();
        return commit(current, next, "CANCELLATION_REQUESTED");
    }

    /**
     * Clears the cancellation marker after the refund was refused.
     */
    public Order abortCancellation(Order current) {
        if (!current.isCancellationPending()) {
            return current;
        }
        Order next = current.toBuilder()
                .cancellationPending(false)
                .updatedAt(clock.instant())
                .version(current.getVersion() + 1)
                .build();
        return commit(current, next, "CANCELLATION_ABORTED");
    }

    /**
     * Moves the order to CANCELLED. {@code paymentOutcome} is the payment status to record:
     * REFUNDED after a captured payment was refunded, FAILED for an expired payment, or the
     * current status when nothing was paid.
     */
    public Order cancel(Order current, PaymentStatus paymentOutcome, String note) {
        assertCancellable(current);
        PaymentStatus payment = paymentOutcome != null ? paymentOutcome : current.getPaymentStatus();
        if (payment == PaymentStatus.COMPLETED) {
            throw invalid(current, "a captured payment must be refunded before cancelling");
        }
        if (payment != current.getPaymentStatus()) {
            requirePaymentTransition(current, payment);
        }
        Instant now = clock.instant();
        Order next = next(current, OrderStatus.CANCELLED, now, note != null ? note : "Order cancelled")
                .paymentStatus(payment)
                .cancellationPending(false)
                .build();
        return commit(current, next, "ORDER_CANCELLED");
    }

    /**
     * Sets {@code hasReturnRequest}. Not a status change, so no history entry is added.
     */
    public Order flagReturnRequest(Order current) {
        if (current.getStatus() != OrderStatus.DELIVERED) {
            throw invalid(current, "only delivered orders can carry a return request");
        }
        if (current.isHasReturnRequest()) {
            throw invalid(current, "order already has an open return request");
        }
        Order next = current.toBuilder()
                .hasReturnRequest(true)
                .updatedAt(clock.instant())
                .version(current.getVersion() + 1)
                .build();
        return commit(current, next, "RETURN_REQUESTED");
    }

    public Order clearReturnRequest(Order current) {
        if (!current.isHasReturnRequest()) {
            throw invalid(current, "order has no open return request");
        }
        Order next = current.toBuilder()
                .hasReturnRequest(false)
                .updatedAt(clock.instant())
                .version(current.getVersion() + 1)
                .build();
        return commit(current, next, "RETURN_RESOLVED");
    }

    /**
     * DELIVERED to RETURNED once the return refund has been issued.
     */
    public Order markReturned(Order current, String note) {
        requireOrderTransition(current, OrderStatus.RETURNED);
        requirePaymentTransition(current, PaymentStatus.REFUNDED);
        Instant now = clock.instant();
        Order next = next(current, OrderStatus.RETURNED, now, note != null ? note : "Return refunded")
                .paymentStatus(PaymentStatus.REFUNDED)
                .build();
        return commit(current, next, "ORDER_RETURNED");
    }

    private Order commit(Order current, Order next, String eventType) {
        Order saved = orderRepository.compareAndSet(current, next);
        log.info("Order transition committed: orderId={} status={}->{} paymentStatus={}->{} version={}",
                saved.getId(), current.getStatus(), saved.getStatus(),
                current.getPaymentStatus(), saved.getPaymentStatus(), saved.getVersion());
        eventProducer.publish(eventType, saved);
        return saved;
    }

    private Order.OrderBuilder next(Order current, OrderStatus status, Instant now, String note) {
        return current.toBuilder()
                .status(status)
                .statusHistoryEntry(entry(status, now, note))
                .updatedAt(now)
                .version(current.getVersion() + 1);
    }

    private static StatusHistoryEntry entry(OrderStatus status, Instant now, String note) {
        return StatusHistoryEntry.builder().status(status).timestamp(now).note(note).build();
    }

    private static void requireOrderTransition(Order current, OrderStatus target) {
        if (!canTransition(current.getStatus(), target)) {
            throw invalid(current, "order status " + current.getStatus() + " -> " + target + " is not allowed");
        }
    }

    private static void requirePaymentTransition(Order current, PaymentStatus target) {
        if (!canTransition(current.getPaymentStatus(), target)) {
            throw invalid(current, "payment status " + current.getPaymentStatus() + " -> " + target + " is not allowed");
        }
    }

    private static InvalidTransitionException invalid(Order current, String reason) {
        return new InvalidTransitionException("Order " + current.getId() + ": " + reason);
    }
}
