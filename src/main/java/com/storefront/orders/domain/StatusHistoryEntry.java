package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class StatusHistoryEntry {

    OrderStatus status;
    Instant timestamp;
    String note;
}
