package com.storefront.orders.domain;

/**
 * Why the customer is sending an item back.
 */
public enum ReturnReason {
    DAMAGED_RECEIVED,
    WRONG_ITEM_SENT,
    NOT_AS_DESCRIBED,
    CHANGED_MIND,
    WRONG_SIZE,
    QUALITY_ISSUES,
    DEFECTIVE_ITEM,
    OTHER
}
