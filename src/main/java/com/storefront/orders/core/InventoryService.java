package com.storefront.orders.core;

import com.storefront.orders.api.InsufficientStockException;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Reserves stock for all lines of an order or none of them, and gives it back when an order is
 * cancelled.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final ProductCatalog productCatalog;

    public void reserveAll(List<OrderItem> items) {
        List<OrderItem> reserved = new ArrayList<>();
        for (OrderItem item : items) {
            if (!productCatalog.reserve(item.getProductId(), item.getQuantity())) {
                log.warn("Insufficient stock: productId={} requested={}", item.getProductId(), item.getQuantity());
                releaseAll(reserved);
                throw new InsufficientStockException("Insufficient stock for product " + item.getProductId());
            }
            reserved.add(item);
        }
    }

    /**
     * Returns an order's stock. A failure for one line is logged and does not stop the others:
     * the order is already cancelled at this point.
     */
    public void release(Order order) {
        log.info("Releasing stock for orderId={} lines={}", order.getId(), order.getItems().size());
        releaseAll(order.getItems());
    }

    private void releaseAll(List<OrderItem> items) {
        for (OrderItem item : items) {
            try {
                productCatalog.release(item.getProductId(), item.getQuantity());
            } catch (RuntimeException e) {
                log.error("Stock release failed: productId={} quantity={}", item.getProductId(), item.getQuantity(), e);
            }
        }
    }
}
