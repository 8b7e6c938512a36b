package com.storefront.orders.api;

import com.storefront.orders.domain.Address;
import com.storefront.orders.domain.Carrier;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.domain.ShippingMethod;
import com.storefront.orders.domain.StatusHistoryEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * REST view of an order. The concurrency version is internal and not exposed.
 */
@Value
@Builder
public class OrderResponseDto {

    String id;
    String orderNumber;
    String customerId;
    List<OrderItem> items;
    BigDecimal subtotal;
    BigDecimal shippingCost;
    BigDecimal tax;
    BigDecimal totalAmount;
    String currency;
    Address shippingAddress;
    Address billingAddress;
    ShippingMethod shippingMethod;
    OrderStatus status;
    PaymentMethod paymentMethod;
    PaymentStatus paymentStatus;
    List<StatusHistoryEntry> statusHistory;
    String trackingNumber;
    Carrier carrier;
    String trackingUrl;
    Instant deliveryDate;
    boolean hasReturnRequest;
    boolean cancellationPending;
    Instant createdAt;
    Instant updatedAt;

    public static OrderResponseDto from(Order order) {
        if (order == null) {
            throw new IllegalArgumentException("Order cannot be null");
        }
        return OrderResponseDto.builder()
                .id(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .items(order.getItems())
                .subtotal(order.getSubtotal())
                .shippingCost(order.getShippingCost())
                .tax(order.getTax())
                .totalAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .shippingAddress(order.getShippingAddress())
                .billingAddress(order.getBillingAddress())
                .shippingMethod(order.getShippingMethod())
                .status(order.getStatus())
                .paymentMethod(order.getPaymentMethod())
                .paymentStatus(order.getPaymentStatus())
                .statusHistory(order.getStatusHistory())
                .trackingNumber(order.getTrackingNumber())
                .carrier(order.getCarrier())
                .trackingUrl(order.getTrackingUrl())
                .deliveryDate(order.getDeliveryDate())
                .hasReturnRequest(order.isHasReturnRequest())
                .cancellationPending(order.isCancellationPending())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .build();
    }
}
