package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of an order. Status fields only change through the order state
 * machine, which builds a new snapshot and commits it with a conditional update on
 * {@code version}.
 */
@Value
@Builder(toBuilder = true)
public class Order {

    String id;
    String orderNumber;
    String customerId;
    String customerEmail;
    @Singular
    List<OrderItem> items;
    BigDecimal subtotal;
    BigDecimal shippingCost;
    BigDecimal tax;
    /** subtotal + shippingCost + tax, fixed at creation. */
    BigDecimal totalAmount;
    String currency;
    Address shippingAddress;
    Address billingAddress;
    ShippingMethod shippingMethod;
    OrderStatus status;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;
    @Singular("statusHistoryEntry")
    List<StatusHistoryEntry> statusHistory;
    String trackingNumber;
    Carrier carrier;
    String trackingUrl;
    Instant deliveryDate;
    boolean hasReturnRequest;
    /** Set while a paid order is being refunded for cancellation; blocks fulfillment. */
    boolean cancellationPending;
    Instant createdAt;
    Instant updatedAt;
    long version;

    public boolean isOwnedBy(String userId) {
        return customerId != null && customerId.equals(userId);
    }

    public Optional<OrderItem> findItem(String productId) {
        return items.stream().filter(item -> item.getProductId().equals(productId)).findFirst();
    }
}
