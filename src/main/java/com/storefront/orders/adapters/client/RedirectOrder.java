package com.storefront.orders.adapters.client;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A checkout order as the redirect gateway reports it.
 */
@Value
@Builder
public class RedirectOrder {

    String id;
    /** CREATED, APPROVED, COMPLETED, VOIDED, DECLINED ... as sent by the gateway. */
    String status;
    String approvalUrl;
    String captureId;
    BigDecimal capturedAmount;
    String currencyCode;
    String failureReason;
}
