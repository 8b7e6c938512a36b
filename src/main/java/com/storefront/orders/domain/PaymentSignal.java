package com.storefront.orders.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An observation about a payment from outside: a webhook body or the result of a poll.
 * Either producer yields the same shape so the confirmation tracker handles both alike.
 */
@Value
@Builder
public class PaymentSignal {

    String externalReference;
    /** Gateway or processor status code, lower case (e.g. "paid", "approved"). May be null for on-chain polls. */
    String statusCode;
    Integer confirmations;
    /** Amount seen so far, in the intent's crypto asset (or order currency for redirect). */
    BigDecimal amountReceived;
    String transactionHash;
    /** "webhook" or "poll". */
    String source;
    Instant receivedAt;
}
