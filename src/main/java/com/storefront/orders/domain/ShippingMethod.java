package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ShippingMethod {

    String id;
    String name;
    BigDecimal cost;
    String estimatedDelivery;
}
