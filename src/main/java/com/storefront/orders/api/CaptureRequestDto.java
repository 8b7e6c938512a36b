package com.storefront.orders.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CaptureRequestDto {

    /** Gateway order id the buyer approved (the redirect gateway returns it as {@code token}). */
    @NotBlank(message = "externalReference is required")
    private String externalReference;
}
