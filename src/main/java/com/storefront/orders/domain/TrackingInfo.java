package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Tracking details an admin supplies when an order ships. When {@code trackingUrl} is
 * absent it is derived from the carrier.
 */
@Value
@Builder
public class TrackingInfo {

    String trackingNumber;
    Carrier carrier;
    String trackingUrl;
}
