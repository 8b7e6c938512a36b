package com.storefront.orders.core;

import com.storefront.orders.domain.ProductSnapshot;

import java.util.Optional;

/**
 * Read access to products plus stock reservation. Reserve and release are atomic per product.
 */
public interface ProductCatalog {

    Optional<ProductSnapshot> findProduct(String productId);

    /** @return false when fewer than {@code quantity} units are in stock; nothing is changed then */
    boolean reserve(String productId, int quantity);

    void release(String productId, int quantity);
}
