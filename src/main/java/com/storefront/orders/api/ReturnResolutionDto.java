package com.storefront.orders.api;

import com.storefront.orders.domain.ReturnDecision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ReturnResolutionDto {

    @NotNull(message = "decision is required")
    private ReturnDecision decision;

    @Size(max = 1000)
    private String notes;
}
