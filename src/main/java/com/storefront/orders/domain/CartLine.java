package com.storefront.orders.domain;

import lombok.Value;

@Value
public class CartLine {

    String productId;
    int quantity;
}
