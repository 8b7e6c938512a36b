package com.storefront.orders.core;

import com.storefront.orders.api.OrderConcurrentModificationException;
import com.storefront.orders.domain.Order;

import java.util.Optional;

/**
 * Storage port for order snapshots. Every change after creation goes through
 * {@link #compareAndSet}, which commits only if nobody else committed in between.
 */
public interface OrderRepository {

    Order insert(Order order);

    Optional<Order> findById(String orderId);

    Optional<Order> findByOrderNumber(String orderNumber);

    /**
     * Replaces {@code expected} with {@code next} if the stored order still has the status and
     * version of {@code expected}.
     *
     * @return the stored snapshot after the write
     * @throws OrderConcurrentModificationException if the stored order has moved on
     */
    Order compareAndSet(Order expected, Order next);
}
