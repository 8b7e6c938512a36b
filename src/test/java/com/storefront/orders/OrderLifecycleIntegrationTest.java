package com.storefront.orders;

import com.jayway.jsonpath.JsonPath;
import com.storefront.orders.adapters.client.RedirectGatewayClient;
import com.storefront.orders.adapters.client.RedirectOrder;
import com.storefront.orders.adapters.client.RedirectRefund;
import com.storefront.orders.compliance.WebhookSignatureVerifier;
import com.storefront.orders.persistence.entity.ProductEntity;
import com.storefront.orders.persistence.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Drives one redirect-paid order from checkout to a refunded return over HTTP.
 * Uses Testcontainers PostgreSQL and Redis with Embedded Kafka; the redirect gateway is mocked.
 * Excluded from the default build; run with
 * {@code mvn test -Dgroups=integration -Dsurefire.excludedGroups=none} (Docker required).
 */
@Tag("integration")
@SpringBootTest(classes = OrderPaymentApplication.class)
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = { "order-events" },
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
@Testcontainers
class OrderLifecycleIntegrationTest {

    private static final String WEBHOOK_SECRET = "redirect-it-secret";
    private static final String GATEWAY_ORDER = "5O190127TN364715T";
    private static final String CUSTOMER = "user-it-1";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ProductRepository productRepository;

    @MockitoBean
    private RedirectGatewayClient redirectClient;

    @DynamicPropertySource
    static void infrastructureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("orders.webhook.redirect-secret", () -> WEBHOOK_SECRET);
    }

    @BeforeEach
    void stockShelf() {
        productRepository.save(ProductEntity.builder()
                .id("prod-laptop").name("Laptop").price(new BigDecimal("699.99")).stock(5).build());
    }

    @Test
    @DisplayName("Redirect order is paid, shipped, delivered and partly refunded through a return")
    void redirectOrderRunsToRefundedReturn() throws Exception {
        String created = mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", CUSTOMER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "items": [{"productId": "prod-laptop", "quantity": 1}],
                                  "shippingAddress": {
                                    "fullName": "Ada Lovelace",
                                    "line1": "12 St James's Square",
                                    "city": "London",
                                    "postalCode": "SW1Y 4JH",
                                    "country": "GB"
                                  },
                                  "shippingMethodId": "express",
                                  "paymentMethod": "CARD_REDIRECT"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.totalAmount").value(715.98))
                .andReturn().getResponse().getContentAsString();
        String orderId = JsonPath.read(created, "$.id");
        assertThat(productRepository.findById("prod-laptop")).get().extracting(ProductEntity::getStock).isEqualTo(4);

        when(redirectClient.createOrder(anyString(), eq(new BigDecimal("715.98")), eq("GBP"))).thenReturn(RedirectOrder.builder()
                .id(GATEWAY_ORDER).status("CREATED").approvalUrl("https://www.sandbox.paypal.com/checkoutnow?token=" + GATEWAY_ORDER).build());
        mockMvc.perform(post("/api/v1/orders/{orderId}/payment", orderId).header("X-User-Id", CUSTOMER))
                .andExpect(status().is2xxSuccessful())
                .andExpect(jsonPath("$.externalReference").value(GATEWAY_ORDER));

        String approval = "{\"event_type\":\"CHECKOUT.ORDER.APPROVED\",\"resource\":{\"id\":\"" + GATEWAY_ORDER + "\"}}";
        mockMvc.perform(post("/api/v1/webhooks/payments/redirect")
                        .header("X-Webhook-Signature", "sha256=" + WebhookSignatureVerifier.sign(WEBHOOK_SECRET, approval))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approval))
                .andExpect(status().isOk());

        when(redirectClient.captureOrder(GATEWAY_ORDER)).thenReturn(RedirectOrder.builder()
                .id(GATEWAY_ORDER).status("COMPLETED").captureId("3C679366HH908993F")
                .capturedAmount(new BigDecimal("715.98")).currencyCode("GBP").build());
        mockMvc.perform(post("/api/v1/orders/{orderId}/payment/capture", orderId)
                        .header("X-User-Id", CUSTOMER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalReference\":\"" + GATEWAY_ORDER + "\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/orders/{orderId}", orderId).header("X-User-Id", CUSTOMER))
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.paymentStatus").value("COMPLETED"));

        mockMvc.perform(post("/api/v1/admin/orders/{orderId}/fulfillment", orderId)
                        .header("X-User-Id", "admin-1").header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"SHIPPED\",\"trackingNumber\":\"1Z999AA10123456784\",\"carrier\":\"UPS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trackingUrl").value("https://www.ups.com/track?tracknum=1Z999AA10123456784"));
        mockMvc.perform(post("/api/v1/admin/orders/{orderId}/fulfillment", orderId)
                        .header("X-User-Id", "admin-1").header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"DELIVERED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DELIVERED"));

        String requested = mockMvc.perform(post("/api/v1/orders/{orderId}/returns", orderId)
                        .header("X-User-Id", CUSTOMER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"items\":[{\"productId\":\"prod-laptop\",\"quantity\":1,\"reason\":\"DAMAGED_RECEIVED\"}]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("REQUESTED"))
                .andReturn().getResponse().getContentAsString();
        String returnId = JsonPath.read(requested, "$.id");

        when(redirectClient.refundCapture(eq("3C679366HH908993F"), any(BigDecimal.class), eq("GBP"), anyString(), anyString()))
                .thenReturn(RedirectRefund.builder().id("1JU08902781691411").status("COMPLETED").build());
        mockMvc.perform(post("/api/v1/admin/returns/{returnId}/resolution", returnId)
                        .header("X-User-Id", "admin-1").header("X-User-Role", "admin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"APPROVE\",\"notes\":\"Screen cracked on arrival\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REFUND_ISSUED"))
                .andExpect(jsonPath("$.refundId").value("1JU08902781691411"));

        mockMvc.perform(get("/api/v1/orders/{orderId}", orderId).header("X-User-Id", CUSTOMER))
                .andExpect(jsonPath("$.hasReturnRequest").value(true));
    }
}
