package com.storefront.orders.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shipping methods offered at checkout, bound from {@code orders.shipping.methods}.
 */
@Data
@ConfigurationProperties(prefix = "orders.shipping")
public class ShippingProperties {

    private List<Method> methods = new ArrayList<>();

    public Optional<Method> findMethod(String id) {
        return methods.stream().filter(method -> method.getId().equals(id)).findFirst();
    }

    @Data
    public static class Method {
        private String id;
        private String name;
        private BigDecimal cost = BigDecimal.ZERO;
        private String estimatedDelivery;
        /** Subtotal at or above which this method is free. Null disables free shipping. */
        private BigDecimal freeShippingThreshold;
        /** ISO country codes served; empty means everywhere. */
        private List<String> supportedCountries = new ArrayList<>();

        public boolean serves(String country) {
            return supportedCountries.isEmpty() || (country != null && supportedCountries.contains(country));
        }

        public BigDecimal costFor(BigDecimal subtotal) {
            if (freeShippingThreshold != null && subtotal.compareTo(freeShippingThreshold) >= 0) {
                return BigDecimal.ZERO;
            }
            return cost;
        }
    }
}
