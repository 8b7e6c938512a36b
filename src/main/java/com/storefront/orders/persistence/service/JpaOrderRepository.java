package com.storefront.orders.persistence.service;

import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.api.OrderNotFoundException;
import com.storefront.orders.core.OrderRepository;
import com.storefront.orders.domain.Address;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import com.storefront.orders.domain.ShippingMethod;
import com.storefront.orders.domain.StatusHistoryEntry;
import com.storefront.orders.persistence.entity.AddressEmbeddable;
import com.storefront.orders.persistence.entity.OrderEntity;
import com.storefront.orders.persistence.entity.OrderItemEmbeddable;
import com.storefront.orders.persistence.entity.StatusHistoryEmbeddable;
import com.storefront.orders.persistence.repository.OrderJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link OrderRepository} on PostgreSQL via Hibernate. The compare-and-set checks status and
 * version in the loaded row, and the {@code @Version} column makes the final UPDATE fail if
 * another transaction committed in between.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaOrderRepository implements OrderRepository {

    private final OrderJpaRepository jpaRepository;

    @Override
    @Transactional
    public Order insert(Order order) {
        OrderEntity entity = toEntity(order);
        entity.setVersion(null);
        OrderEntity saved = jpaRepository.saveAndFlush(entity);
        log.debug("Inserted order: orderId={} orderNumber={}", saved.getId(), saved.getOrderNumber());
        return toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(String orderId) {
        return jpaRepository.findById(orderId).map(JpaOrderRepository::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return jpaRepository.findByOrderNumber(orderNumber).map(JpaOrderRepository::toDomain);
    }

    @Override
    @Transactional
    public Order compareAndSet(Order expected, Order next) {
        OrderEntity entity = jpaRepository.findById(expected.getId())
                .orElseThrow(() -> new OrderNotFoundException("Order not found: " + expected.getId()));
        if (entity.getStatus() != expected.getStatus()
                || entity.getVersion() == null
                || entity.getVersion() != expected.getVersion()) {
            log.warn("Stale order snapshot: orderId={} expectedStatus={} expectedVersion={} storedStatus={} storedVersion={}",
                    expected.getId(), expected.getStatus(), expected.getVersion(), entity.getStatus(), entity.getVersion());
            throw new OrderConcurrentModificationException("Order " + expected.getId()
                    + " was modified concurrently (expected " + expected.getStatus() + " v" + expected.getVersion()
                    + ", found " + entity.getStatus() + " v" + entity.getVersion() + ")");
        }

        entity.setStatus(next.getStatus());
        entity.setPaymentStatus(next.getPaymentStatus());
        entity.setTrackingNumber(next.getTrackingNumber());
        entity.setCarrier(next.getCarrier());
        entity.setTrackingUrl(next.getTrackingUrl());
        entity.setDeliveryDate(next.getDeliveryDate());
        entity.setHasReturnRequest(next.isHasReturnRequest());
        entity.setCancellationPending(next.isCancellationPending());
        entity.setUpdatedAt(next.getUpdatedAt());
        List<StatusHistoryEntry> history = next.getStatusHistory();
        for (int i = entity.getStatusHistory().size(); i < history.size(); i++) {
            entity.getStatusHistory().add(toEmbeddable(history.get(i)));
        }

        try {
            return toDomain(jpaRepository.saveAndFlush(entity));
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new OrderConcurrentModificationException("Order " + expected.getId() + " was modified concurrently", e);
        }
    }

    static OrderEntity toEntity(Order order) {
        ShippingMethod method = order.getShippingMethod();
        return OrderEntity.builder()
                .id(order.getId())
                .orderNumber(order.getOrderNumber())
                .customerId(order.getCustomerId())
                .customerEmail(order.getCustomerEmail())
                .items(order.getItems().stream().map(JpaOrderRepository::toEmbeddable).collect(Collectors.toCollection(ArrayList::new)))
                .subtotal(order.getSubtotal())
                .shippingCost(order.getShippingCost())
                .tax(order.getTax())
                .totalAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .shippingAddress(toEmbeddable(order.getShippingAddress()))
                .billingAddress(toEmbeddable(order.getBillingAddress()))
                .shippingMethodId(method != null ? method.getId() : null)
                .shippingMethodName(method != null ? method.getName() : null)
                .shippingMethodCost(method != null ? method.getCost() : null)
                .shippingEstimatedDelivery(method != null ? method.getEstimatedDelivery() : null)
                .status(order.getStatus())
                .paymentMethod(order.getPaymentMethod())
                .paymentStatus(order.getPaymentStatus())
                .statusHistory(order.getStatusHistory().stream().map(JpaOrderRepository::toEmbeddable).collect(Collectors.toCollection(ArrayList::new)))
                .trackingNumber(order.getTrackingNumber())
                .carrier(order.getCarrier())
                .trackingUrl(order.getTrackingUrl())
                .deliveryDate(order.getDeliveryDate())
                .hasReturnRequest(order.isHasReturnRequest())
                .cancellationPending(order.isCancellationPending())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .version(order.getVersion())
                .build();
    }

    static Order toDomain(OrderEntity entity) {
        Order.OrderBuilder builder = Order.builder()
                .id(entity.getId())
                .orderNumber(entity.getOrderNumber())
                .customerId(entity.getCustomerId())
                .customerEmail(entity.getCustomerEmail())
                .subtotal(entity.getSubtotal())
                .shippingCost(entity.getShippingCost())
                .tax(entity.getTax())
                .totalAmount(entity.getTotalAmount())
                .currency(entity.getCurrency())
                .shippingAddress(toDomain(entity.getShippingAddress()))
                .billingAddress(toDomain(entity.getBillingAddress()))
                .status(entity.getStatus())
                .paymentMethod(entity.getPaymentMethod())
                .paymentStatus(entity.getPaymentStatus())
                .trackingNumber(entity.getTrackingNumber())
                .carrier(entity.getCarrier())
                .trackingUrl(entity.getTrackingUrl())
                .deliveryDate(entity.getDeliveryDate())
                .hasReturnRequest(entity.isHasReturnRequest())
                .cancellationPending(entity.isCancellationPending())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion() != null ? entity.getVersion() : 0L);
        if (entity.getShippingMethodId() != null) {
            builder.shippingMethod(ShippingMethod.builder()
                    .id(entity.getShippingMethodId())
                    .name(entity.getShippingMethodName())
                    .cost(entity.getShippingMethodCost())
                    .estimatedDelivery(entity.getShippingEstimatedDelivery())
                    .build());
        }
        for (OrderItemEmbeddable item : entity.getItems()) {
            builder.item(OrderItem.builder()
                    .productId(item.getProductId())
                    .productName(item.getProductName())
                    .unitPrice(item.getUnitPrice())
                    .quantity(item.getQuantity())
                    .lineTotal(item.getLineTotal())
                    .build());
        }
        for (StatusHistoryEmbeddable entry : entity.getStatusHistory()) {
            builder.statusHistoryEntry(StatusHistoryEntry.builder()
                    .status(entry.getStatus())
                    .timestamp(entry.getChangedAt())
                    .note(entry.getNote())
                    .build());
        }
        return builder.build();
    }

    private static OrderItemEmbeddable toEmbeddable(OrderItem item) {
        return OrderItemEmbeddable.builder()
                .productId(item.getProductId())
                .productName(item.getProductName())
                .unitPrice(item.getUnitPrice())
                .quantity(item.getQuantity())
                .lineTotal(item.getLineTotal())
                .build();
    }

    private static StatusHistoryEmbeddable toEmbeddable(StatusHistoryEntry entry) {
        return StatusHistoryEmbeddable.builder()
                .status(entry.getStatus())
                .changedAt(entry.getTimestamp())
                .note(entry.getNote())
                .build();
    }

    private static AddressEmbeddable toEmbeddable(Address address) {
        if (address == null) {
            return null;
        }
        return AddressEmbeddable.builder()
                .fullName(address.getFullName())
                .line1(address.getLine1())
                .line2(address.getLine2())
                .city(address.getCity())
                .postalCode(address.getPostalCode())
                .country(address.getCountry())
                .phone(address.getPhone())
                .build();
    }

    private static Address toDomain(AddressEmbeddable address) {
        if (address == null) {
            return null;
        }
        return Address.builder()
                .fullName(address.getFullName())
                .line1(address.getLine1())
                .line2(address.getLine2())
                .city(address.getCity())
                .postalCode(address.getPostalCode())
                .country(address.getCountry())
                .phone(address.getPhone())
                .build();
    }
}
