package com.storefront.orders.api;

import com.storefront.orders.domain.Carrier;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.TrackingInfo;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class FulfillmentRequestDto {

    @NotNull(message = "status is required")
    private OrderStatus status;

    /** Required when status is SHIPPED. */
    @Size(max = 64)
    private String trackingNumber;

    private Carrier carrier;

    @Size(max = 500)
    private String trackingUrl;

    public TrackingInfo toTracking() {
        if (trackingNumber == null && carrier == null && trackingUrl == null) {
            return null;
        }
        return TrackingInfo.builder()
                .trackingNumber(trackingNumber)
                .carrier(carrier)
                .trackingUrl(trackingUrl)
                .build();
    }
}
