package com.storefront.orders.api;

import com.storefront.orders.domain.ReturnItem;
import com.storefront.orders.domain.ReturnReason;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

@Data
public class ReturnRequestDto {

    @NotEmpty(message = "items must not be empty")
    @Valid
    private List<Item> items;

    @Data
    public static class Item {

        @NotBlank(message = "productId is required")
        private String productId;

        @Min(1)
        private int quantity;

        @NotNull(message = "reason is required")
        private ReturnReason reason;

        @Size(max = 500)
        private String description;
    }

    public List<ReturnItem> toItems() {
        return items.stream()
                .map(item -> ReturnItem.builder()
                        .productId(item.getProductId())
                        .quantity(item.getQuantity())
                        .reason(item.getReason())
                        .description(item.getDescription())
                        .build())
                .collect(Collectors.toList());
    }
}
