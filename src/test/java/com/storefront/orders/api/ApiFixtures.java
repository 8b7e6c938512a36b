package com.storefront.orders.api;

import com.storefront.orders.domain.Address;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderItem;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.domain.StatusHistoryEntry;

import java.math.BigDecimal;
import java.time.Instant;

final class ApiFixtures {

    static final Instant NOW = Instant.parse("2026-03-02T10:15:30Z");

    static final String CHECKOUT_JSON = """
            {
              "items": [{"productId": "prod-laptop", "quantity": 1}],
              "shippingAddress": {
                "fullName": "Ada Lovelace",
                "line1": "12 St James's Square",
                "city": "London",
                "postalCode": "SW1Y 4JH",
                "country": "GB"
              },
              "shippingMethodId": "standard",
              "paymentMethod": "CARD_REDIRECT",
              "customerEmail": "ada@example.com"
            }
            """;

    private ApiFixtures() {}

    static Order order(OrderStatus status, PaymentStatus paymentStatus) {
        Address address = Address.builder()
                .fullName("Ada Lovelace")
                .line1("12 St James's Square")
                .city("London")
                .postalCode("SW1Y 4JH")
                .country("GB")
                .build();
        return Order.builder()
                .id("order-1")
                .orderNumber("ORD-46530123-042")
                .customerId("user-1")
                .item(OrderItem.builder()
                        .productId("prod-laptop")
                        .productName("Laptop")
                        .unitPrice(new BigDecimal("699.99"))
                        .quantity(1)
                        .lineTotal(new BigDecimal("699.99"))
                        .build())
                .subtotal(new BigDecimal("699.99"))
                .shippingCost(new BigDecimal("15.99"))
                .tax(new BigDecimal("0.00"))
                .totalAmount(new BigDecimal("715.98"))
                .currency("GBP")
                .shippingAddress(address)
                .billingAddress(address)
                .status(status)
                .paymentMethod(PaymentMethod.CARD_REDIRECT)
                .paymentStatus(paymentStatus)
                .statusHistoryEntry(StatusHistoryEntry.builder().status(OrderStatus.PENDING).timestamp(NOW).note("Order placed").build())
                .createdAt(NOW)
                .updatedAt(NOW)
                .version(4)
                .build();
    }
}
