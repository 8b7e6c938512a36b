package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ReturnItem {

    String productId;
    String productName;
    BigDecimal unitPrice;
    int quantity;
    ReturnReason reason;
    String description;

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
