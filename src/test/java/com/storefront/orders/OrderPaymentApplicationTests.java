package com.storefront.orders;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

/**
 * Verifies that the application context loads against local infrastructure.
 * Requires PostgreSQL, Kafka and Redis (e.g. docker-compose up -d). Run with:
 *   mvn test -Dgroups=integration -Dsurefire.excludedGroups=none
 */
@Tag("integration")
@SpringBootTest(classes = OrderPaymentApplication.class)
@TestPropertySource(properties = {
        "spring.kafka.bootstrap-servers=localhost:9092",
        "spring.data.redis.host=localhost",
        "spring.data.redis.port=6379"
})
class OrderPaymentApplicationTests {

    @Test
    void contextLoads() {
    }
}
