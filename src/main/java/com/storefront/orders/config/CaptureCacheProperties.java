package com.storefront.orders.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Redis cache of successful redirect captures, bound from {@code orders.capture-cache}.
 */
@Data
@ConfigurationProperties(prefix = "orders.capture-cache")
public class CaptureCacheProperties {

    /** Prepended to the gateway order id to form the Redis key. */
    private String keyPrefix = "orders:capture:";

    /** How long a capture stays cached; the database answers after that. */
    private Duration ttl = Duration.ofHours(24);

    public String key(String externalReference) {
        return keyPrefix + externalReference;
    }
}
