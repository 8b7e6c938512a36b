package com.storefront.orders.api;

import com.storefront.orders.domain.CartLine;
import com.storefront.orders.domain.Checkout;
import com.storefront.orders.domain.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Checkout submission. Only product ids and quantities are accepted from the client; prices
 * come from the catalog.
 */
@Data
public class CreateOrderRequestDto {

    @NotEmpty(message = "items must not be empty")
    @Valid
    private List<Line> items;

    @NotNull(message = "shippingAddress is required")
    @Valid
    private AddressDto shippingAddress;

    /** Omit to bill to the shipping address. */
    @Valid
    private AddressDto billingAddress;

    @NotBlank(message = "shippingMethodId is required")
    private String shippingMethodId;

    @NotNull(message = "paymentMethod is required")
    private PaymentMethod paymentMethod;

    @Email
    private String customerEmail;

    @Data
    public static class Line {

        @NotBlank(message = "productId is required")
        private String productId;

        @Min(1)
        @Max(99)
        private int quantity;
    }

    public Checkout toCheckout() {
        return Checkout.builder()
                .lines(items.stream()
                        .map(line -> new CartLine(line.getProductId(), line.getQuantity()))
                        .collect(Collectors.toList()))
                .shippingAddress(shippingAddress.toDomain())
                .billingAddress(billingAddress != null ? billingAddress.toDomain() : null)
                .shippingMethodId(shippingMethodId)
                .paymentMethod(paymentMethod)
                .customerEmail(customerEmail)
                .build();
    }
}
