package com.storefront.orders.persistence.entity;

import com.storefront.orders.domain.Carrier;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent order. {@code version} backs the compare-and-set in
 * {@link com.storefront.orders.persistence.service.JpaOrderRepository}.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_order_number", columnList = "order_number", unique = true),
    @Index(name = "idx_order_customer", columnList = "customer_id"),
    @Index(name = "idx_order_status", columnList = "status"),
    @Index(name = "idx_order_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderEntity {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "order_number", nullable = false, length = 32)
    private String orderNumber;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "customer_email")
    private String customerEmail;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_items", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<OrderItemEmbeddable> items = new ArrayList<>();

    @Column(name = "subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "shipping_cost", nullable = false, precision = 19, scale = 2)
    private BigDecimal shippingCost;

    @Column(name = "tax", nullable = false, precision = 19, scale = 2)
    private BigDecimal tax;

    @Column(name = "total_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "fullName", column = @Column(name = "ship_full_name")),
        @AttributeOverride(name = "line1", column = @Column(name = "ship_line1")),
        @AttributeOverride(name = "line2", column = @Column(name = "ship_line2")),
        @AttributeOverride(name = "city", column = @Column(name = "ship_city")),
        @AttributeOverride(name = "postalCode", column = @Column(name = "ship_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "ship_country", length = 2)),
        @AttributeOverride(name = "phone", column = @Column(name = "ship_phone", length = 40))
    })
    private AddressEmbeddable shippingAddress;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "fullName", column = @Column(name = "bill_full_name")),
        @AttributeOverride(name = "line1", column = @Column(name = "bill_line1")),
        @AttributeOverride(name = "line2", column = @Column(name = "bill_line2")),
        @AttributeOverride(name = "city", column = @Column(name = "bill_city")),
        @AttributeOverride(name = "postalCode", column = @Column(name = "bill_postal_code", length = 20)),
        @AttributeOverride(name = "country", column = @Column(name = "bill_country", length = 2)),
        @AttributeOverride(name = "phone", column = @Column(name = "bill_phone", length = 40))
    })
    private AddressEmbeddable billingAddress;

    @Column(name = "shipping_method_id", length = 32)
    private String shippingMethodId;

    @Column(name = "shipping_method_name")
    private String shippingMethodName;

    @Column(name = "shipping_method_cost", precision = 19, scale = 2)
    private BigDecimal shippingMethodCost;

    @Column(name = "shipping_estimated_delivery")
    private String shippingEstimatedDelivery;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 32)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 32)
    private PaymentStatus paymentStatus;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_status_history", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "entry_no")
    @Builder.Default
    private List<StatusHistoryEmbeddable> statusHistory = new ArrayList<>();

    @Column(name = "tracking_number")
    private String trackingNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "carrier", length = 32)
    private Carrier carrier;

    @Column(name = "tracking_url", length = 1000)
    private String trackingUrl;

    @Column(name = "delivery_date")
    private Instant deliveryDate;

    @Column(name = "has_return_request", nullable = false)
    private boolean hasReturnRequest;

    @Column(name = "cancellation_pending", nullable = false)
    private boolean cancellationPending;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
