package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A line on an order. Name and unit price are copied from the catalog when the order
 * is placed and never change afterwards.
 */
@Value
@Builder
public class OrderItem {

    String productId;
    String productName;
    BigDecimal unitPrice;
    int quantity;
    BigDecimal lineTotal;
}
