package com.storefront.orders;

import com.storefront.orders.config.CaptureCacheProperties;
import com.storefront.orders.config.ShippingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the storefront order and payment service:
 * <ul>
 *   <li>Order lifecycle with a compare-and-set state machine</li>
 *   <li>Redirect, Bitcoin and Monero gateways behind circuit breaker and retry (Resilience4j)</li>
 *   <li>Capture idempotency in Redis, order events on Kafka</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({ShippingProperties.class, CaptureCacheProperties.class})
public class OrderPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderPaymentApplication.class, args);
    }
}
