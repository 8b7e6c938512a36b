package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What the customer submits to place an order. Prices are not part of it: they are read from
 * the catalog at checkout time.
 */
@Value
@Builder
public class Checkout {

    @Singular
    List<CartLine> lines;
    Address shippingAddress;
    /** Null means bill to the shipping address. */
    Address billingAddress;
    String shippingMethodId;
    PaymentMethod paymentMethod;
    String customerEmail;
}
