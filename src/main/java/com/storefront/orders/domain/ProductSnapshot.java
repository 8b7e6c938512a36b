package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What the catalog says about a product right now. Copied into order items at checkout.
 */
@Value
@Builder
public class ProductSnapshot {

    String productId;
    String name;
    BigDecimal price;
    int stock;
}
