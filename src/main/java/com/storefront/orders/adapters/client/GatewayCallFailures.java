package com.storefront.orders.adapters.client;

import com.storefront.orders.api.GatewayUnavailableException;
import com.storefront.orders.compliance.SecretMasker;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Turns transport and HTTP errors from gateway clients into {@link GatewayUnavailableException}
 * with the secrets stripped from the message.
 */
final class GatewayCallFailures {

    private GatewayCallFailures() {}

    static GatewayUnavailableException unavailable(String gateway, String operation, String reference, RestClientException e) {
        String detail;
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            detail = "HTTP " + response.getStatusCode().value() + " " + response.getResponseBodyAsString();
        } else {
            detail = e.getMessage();
        }
        String message = gateway + " " + operation + " failed (reference=" + reference + "): "
                + SecretMasker.maskMessage(truncate(detail));
        return new GatewayUnavailableException(message, e);
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > 500 ? s.substring(0, 500) : s;
    }
}
