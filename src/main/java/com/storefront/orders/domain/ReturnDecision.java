package com.storefront.orders.domain;

public enum ReturnDecision {
    APPROVE,
    REJECT
}
