package com.storefront.orders.core;

import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.api.OrderNotFoundException;
import com.storefront.orders.domain.Order;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Order store with the same compare-and-set contract as the JPA repository.
 */
class InMemoryOrderRepository implements OrderRepository {

    private final Map<String, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Order insert(Order order) {
        if (orders.putIfAbsent(order.getId(), order) != null) {
            throw new IllegalStateException("Duplicate order id " + order.getId());
        }
        return order;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public Optional<Order> findByOrderNumber(String orderNumber) {
        return orders.values().stream().filter(order -> order.getOrderNumber().equals(orderNumber)).findFirst();
    }

    @Override
    public synchronized Order compareAndSet(Order expected, Order next) {
        Order stored = orders.get(expected.getId());
        if (stored == null) {
            throw new OrderNotFoundException("Order not found: " + expected.getId());
        }
        if (stored.getStatus() != expected.getStatus() || stored.getVersion() != expected.getVersion()) {
            throw new OrderConcurrentModificationException("Order " + expected.getId() + " was modified concurrently");
        }
        orders.put(next.getId(), next);
        return next;
    }

    /** Stores an order as is, bypassing the state machine. */
    Order put(Order order) {
        orders.put(order.getId(), order);
        return order;
    }

    Order get(String orderId) {
        return orders.get(orderId);
    }
}
