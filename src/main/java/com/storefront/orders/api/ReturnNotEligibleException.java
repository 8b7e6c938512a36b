package com.storefront.orders.api;

/**
 * Thrown when a return request fails an eligibility rule. No return record is created.
 */
public class ReturnNotEligibleException extends OrderProcessingException {

    public ReturnNotEligibleException(String message) {
        super("RETURN_NOT_ELIGIBLE", message);
    }

    public ReturnNotEligibleException(String message, Throwable cause) {
        super("RETURN_NOT_ELIGIBLE", message, cause);
    }
}
