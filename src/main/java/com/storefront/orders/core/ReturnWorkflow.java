package com.storefront.orders.core;

import com.storefront.orders.api.ForbiddenActionException;
import com.storefront.orders.api.InvalidTransitionException;
import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.api.OrderNotFoundException;
import com.storefront.orders.api.RefundFailedException;
import com.storefront.orders.api.ReturnNotEligibleException;
import com.storefront.orders.api.ReturnRequestNotFoundException;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.ReturnDecision;
import com.storefront.orders.domain.ReturnItem;
import com.storefront.orders.domain.ReturnRequest;
import com.storefront.orders.domain.ReturnStatus;
import com.storefront.orders.persistence.service.ReturnPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Customer return requests and their admin resolution. Approval refunds through the gateway
 * that took the payment; only a successful refund moves the order to RETURNED.
 */
@Slf4j
@Service
public class ReturnWorkflow {

    private final OrderRepository orderRepository;
    private final OrderStateMachine stateMachine;
    private final ReturnPersistenceService returnPersistence;
    private final RefundOrchestrator refundOrchestrator;
    private final Clock clock;
    private final Duration returnWindow;

    public ReturnWorkflow(
            OrderRepository orderRepository,
            OrderStateMachine stateMachine,
            ReturnPersistenceService returnPersistence,
            RefundOrchestrator refundOrchestrator,
            Clock clock,
            @Value("${orders.returns.window-days:30}") long windowDays) {
        this.orderRepository = orderRepository;
        this.stateMachine = stateMachine;
        this.returnPersistence = returnPersistence;
        this.refundOrchestrator = refundOrchestrator;
        this.clock = clock;
        this.returnWindow = Duration.ofDays(windowDays);
    }

    /**
     * Opens a return for some or all items of a delivered order. Nothing is stored when the
     * order or the items are not eligible.
     *
     * @param requestedItems product id, quantity, reason and optional description per line
     */
    public ReturnRequest requestReturn(AuthenticatedPrincipal principal, String orderId, List<ReturnItem> requestedItems) {
        Order order = loadOrder(orderId);
        Instant now = clock.instant();
        checkEligible(principal, order, now);

        ReturnRequest.ReturnRequestBuilder builder = ReturnRequest.builder();
        BigDecimal total = BigDecimal.ZERO;
        Set<String> seen = new HashSet<>();
        if (requestedItems == null || requestedItems.isEmpty()) {
            throw new ReturnNotEligibleException("A return must contain at least one item");
        }
        for (ReturnItem requested : requestedItems) {
            if (!seen.add(requested.getProductId())) {
                throw new ReturnNotEligibleException("Product " + requested.getProductId() + " listed twice");
            }
            OrderItem ordered = order.findItem(requested.getProductId())
                    .orElseThrow(() -> new ReturnNotEligibleException(
                            "Product " + requested.getProductId() + " is not part of order " + order.getOrderNumber()));
            if (requested.getQuantity() < 1 || requested.getQuantity() > ordered.getQuantity()) {
                throw new ReturnNotEligibleException("Return quantity for product " + requested.getProductId()
                        + " must be between 1 and " + ordered.getQuantity());
            }
            if (requested.getReason() == null) {
                throw new ReturnNotEligibleException("A reason is required for product " + requested.getProductId());
            }
            ReturnItem item = ReturnItem.builder()
                    .productId(ordered.getProductId())
                    .productName(ordered.getProductName())
                    .unitPrice(ordered.getUnitPrice())
                    .quantity(requested.getQuantity())
                    .reason(requested.getReason())
                    .description(requested.getDescription())
                    .build();
            builder.item(item);
            total = total.add(item.lineTotal());
        }

        // the flag is the lock: a concurrent second request loses the compare-and-set
        Order flagged = stateMachine.flagReturnRequest(order);
        ReturnRequest request = builder
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .requestNumber(returnPersistence.nextRequestNumber(LocalDate.ofInstant(now, ZoneOffset.UTC)))
                .requestDate(now)
                .totalRefundAmount(total)
                .status(ReturnStatus.REQUESTED)
                .updatedAt(now)
                .build();
        try {
            ReturnRequest saved = returnPersistence.save(request);
            log.info("Return requested: returnId={} requestNumber={} orderId={} amount={}",
                    saved.getId(), saved.getRequestNumber(), order.getId(), total);
            return saved;
        } catch (RuntimeException e) {
            log.error("Saving return request for orderId={} failed, clearing the return flag", order.getId(), e);
            stateMachine.clearReturnRequest(flagged);
            throw e;
        }
    }

    /**
     * Admin decision on a return. APPROVE refunds {@code totalRefundAmount}; if the refund fails
     * the request stays APPROVED and resolving it with APPROVE again retries the refund.
     */
    public ReturnRequest resolveReturn(AuthenticatedPrincipal principal, String returnId, ReturnDecision decision, String notes) {
        if (!principal.isAdmin()) {
            throw new ForbiddenActionException("Only administrators can resolve returns");
        }
        ReturnRequest request = returnPersistence.findById(returnId)
                .orElseThrow(() -> new ReturnRequestNotFoundException("Return request not found: " + returnId));
        Instant now = clock.instant();

        switch (decision) {
            case REJECT:
                return reject(principal, request, notes, now);
            case APPROVE:
                return approve(principal, request, notes, now);
            default:
                throw new IllegalArgumentException("Unknown decision " + decision);
        }
    }

    private ReturnRequest reject(AuthenticatedPrincipal admin, ReturnRequest request, String notes, Instant now) {
        requireTransition(request, ReturnStatus.REJECTED);
        ReturnRequest rejected = returnPersistence.save(request.toBuilder()
                .status(ReturnStatus.REJECTED)
                .adminNotes(notes)
                .resolvedBy(admin.getId())
                .updatedAt(now)
                .build());
        Order order = loadOrder(request.getOrderId());
        if (order.isHasReturnRequest()) {
            stateMachine.clearReturnRequest(order);
        }
        log.info("Return rejected: returnId={} orderId={} by={}", request.getId(), request.getOrderId(), admin.getId());
        return rejected;
    }

    private ReturnRequest approve(AuthenticatedPrincipal admin, ReturnRequest request, String notes, Instant now) {
        requireTransition(request, ReturnStatus.APPROVED);
        ReturnRequest approved = returnPersistence.save(request.toBuilder()
                .status(ReturnStatus.APPROVED)
                .adminNotes(notes != null ? notes : request.getAdminNotes())
                .resolvedBy(admin.getId())
                .approvedAt(request.getApprovedAt() != null ? request.getApprovedAt() : now)
                .updatedAt(now)
                .build());

        Order order = loadOrder(request.getOrderId());
        RefundResult refund = refundOrchestrator.execute(RefundRequest.builder()
                .idempotencyKey("return-" + request.getId())
                .orderId(order.getId())
                .paymentMethod(order.getPaymentMethod())
                .amount(request.getTotalRefundAmount())
                .currencyCode(order.getCurrency())
                .reason("Return " + request.getRequestNumber())
                .correlationId(request.getRequestNumber())
                .build());
        if (!refund.isSuccess()) {
            log.error("Return refund failed: returnId={} orderId={} failureCode={}",
                    request.getId(), order.getId(), refund.getFailureCode());
            throw new RefundFailedException("Refund for return " + request.getRequestNumber() + " failed: "
                    + refund.getFailureCode() + " " + refund.getMessage());
        }

        markReturned(order, request);
        ReturnRequest issued = returnPersistence.save(approved.toBuilder()
                .status(ReturnStatus.REFUND_ISSUED)
                .refundId(refund.getProviderRefundId())
                .refundIssuedAt(clock.instant())
                .updatedAt(clock.instant())
                .build());
        log.info("Return refunded: returnId={} orderId={} refundId={} status={}",
                issued.getId(), order.getId(), refund.getProviderRefundId(), refund.getStatus());
        return issued;
    }

    private void markReturned(Order order, ReturnRequest request) {
        if (order.getStatus() == OrderStatus.RETURNED) {
            return;
        }
        try {
            stateMachine.markReturned(order, "Return " + request.getRequestNumber() + " refunded");
        } catch (OrderConcurrentModificationException e) {
            Order current = loadOrder(order.getId());
            if (current.getStatus() != OrderStatus.RETURNED) {
                throw e;
            }
        }
    }

    /**
     * The window is inclusive: exactly {@code deliveryDate + window} is still eligible.
     */
    void checkEligible(AuthenticatedPrincipal principal, Order order, Instant now) {
        if (principal == null || !order.isOwnedBy(principal.getId())) {
            throw new ReturnNotEligibleException("Order " + order.getOrderNumber() + " does not belong to the requester");
        }
        if (order.getStatus() != OrderStatus.DELIVERED) {
            throw new ReturnNotEligibleException("Only delivered orders can be returned (status " + order.getStatus() + ")");
        }
        if (order.getDeliveryDate() == null) {
            throw new ReturnNotEligibleException("Order " + order.getOrderNumber() + " has no delivery date");
        }
        if (now.isAfter(order.getDeliveryDate().plus(returnWindow))) {
            throw new ReturnNotEligibleException("Return window of " + returnWindow.toDays() + " days has passed");
        }
        if (order.isHasReturnRequest()) {
            throw new ReturnNotEligibleException("Order " + order.getOrderNumber() + " already has a return request");
        }
    }

    private static void requireTransition(ReturnRequest request, ReturnStatus target) {
        if (!request.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException("Return " + request.getRequestNumber() + ": "
                    + request.getStatus() + " -> " + target + " is not allowed");
        }
    }

    private Order loadOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException("Order not found: " + orderId));
    }
}
