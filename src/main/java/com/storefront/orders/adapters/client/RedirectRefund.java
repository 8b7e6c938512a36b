package com.storefront.orders.adapters.client;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RedirectRefund {

    String id;
    /** COMPLETED, PENDING, FAILED or CANCELLED. */
    String status;
}
