package com.storefront.orders.domain;

public enum ReturnStatus {
    REQUESTED,
    APPROVED,
    REJECTED,
    REFUND_ISSUED;

    /**
     * APPROVED may be resolved again when its refund failed, so APPROVED -> APPROVED is allowed.
     */
    public boolean canTransitionTo(ReturnStatus target) {
        switch (this) {
            case REQUESTED:
                return target == APPROVED || target == REJECTED;
            case APPROVED:
                return target == APPROVED || target == REFUND_ISSUED;
            default:
                return false;
        }
    }
}
