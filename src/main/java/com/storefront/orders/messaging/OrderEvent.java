package com.storefront.orders.messaging;

import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted to Kafka for every committed order change. Keyed by order id so consumers
 * (fulfilment, notifications, analytics) see one order's events in order.
 */
@Value
@Builder
@Jacksonized
public class OrderEvent {

    String eventId;
    /** ORDER_CREATED, PAYMENT_INITIATED, PAYMENT_COMPLETED, PAYMENT_FAILED, ORDER_STATUS_CHANGED, ORDER_CANCELLED, RETURN_REQUESTED, RETURN_RESOLVED, ORDER_RETURNED */
    String eventType;
    String orderId;
    String orderNumber;
    String customerId;
    OrderStatus status;
    PaymentStatus paymentStatus;
    PaymentMethod paymentMethod;
    BigDecimal totalAmount;
    String currency;
    String reference;
    String note;
    long version;
    Instant timestamp;
}
