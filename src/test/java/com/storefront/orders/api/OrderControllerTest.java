package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.Checkout;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for OrderController using MockMvc.
 */
@WebMvcTest(controllers = OrderController.class)
class OrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrderLifecycleService lifecycleService;

    @Test
    void createReturnsCreatedOrder() throws Exception {
        when(lifecycleService.createOrder(any(), any()))
                .thenReturn(ApiFixtures.order(OrderStatus.PENDING, PaymentStatus.PENDING));

        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ApiFixtures.CHECKOUT_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("order-1"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.paymentStatus").value("PENDING"))
                .andExpect(jsonPath("$.totalAmount").value(715.98))
                .andExpect(jsonPath("$.statusHistory[0].note").value("Order placed"))
                .andExpect(jsonPath("$.version").doesNotExist());

        ArgumentCaptor<Checkout> checkout = ArgumentCaptor.forClass(Checkout.class);
        verify(lifecycleService).createOrder(eq(AuthenticatedPrincipal.customer("user-1")), checkout.capture());
        assertThat(checkout.getValue().getLines()).hasSize(1);
        assertThat(checkout.getValue().getPaymentMethod()).isEqualTo(PaymentMethod.CARD_REDIRECT);
        assertThat(checkout.getValue().getBillingAddress()).isNull();
    }

    @Test
    void createWithoutUserIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/v1/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ApiFixtures.CHECKOUT_JSON))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"));

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void createValidatesBody() throws Exception {
        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "items": [],
                                  "shippingMethodId": "standard",
                                  "paymentMethod": "BITCOIN"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.items").value("items must not be empty"))
                .andExpect(jsonPath("$.details.shippingAddress").value("shippingAddress is required"));
    }

    @Test
    void insufficientStockIsConflict() throws Exception {
        when(lifecycleService.createOrder(any(), any()))
                .thenThrow(new InsufficientStockException("Insufficient stock for product prod-laptop"));

        mockMvc.perform(post("/api/v1/orders")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ApiFixtures.CHECKOUT_JSON))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_STOCK"));
    }

    @Test
    void getPassesAdminRole() throws Exception {
        when(lifecycleService.getOrder(AuthenticatedPrincipal.admin("admin-1"), "order-1"))
                .thenReturn(ApiFixtures.order(OrderStatus.PROCESSING, PaymentStatus.COMPLETED));

        mockMvc.perform(get("/api/v1/orders/order-1")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andExpect(jsonPath("$.trackingNumber").value(nullValue()));
    }

    @Test
    void getOtherCustomersOrderIsForbidden() throws Exception {
        when(lifecycleService.getOrder(any(), eq("order-1")))
                .thenThrow(new ForbiddenActionException("Order order-1 belongs to another customer"));

        mockMvc.perform(get("/api/v1/orders/order-1").header("X-User-Id", "user-2"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        when(lifecycleService.getOrder(any(), eq("missing")))
                .thenThrow(new OrderNotFoundException("Order not found: missing"));

        mockMvc.perform(get("/api/v1/orders/missing").header("X-User-Id", "user-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void cancelReturnsCancelledOrder() throws Exception {
        when(lifecycleService.cancelOrder("order-1", AuthenticatedPrincipal.customer("user-1")))
                .thenReturn(ApiFixtures.order(OrderStatus.CANCELLED, PaymentStatus.REFUNDED));

        mockMvc.perform(post("/api/v1/orders/order-1/cancel").header("X-User-Id", "user-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.paymentStatus").value("REFUNDED"));
    }

    @Test
    void cancelMapsRefundFailureAndLateCancel() throws Exception {
        when(lifecycleService.cancelOrder(eq("order-1"), any()))
                .thenThrow(new RefundFailedException("Refund for order ORD-46530123-042 failed: GATEWAY_REFUND_FAILED"));
        when(lifecycleService.cancelOrder(eq("order-2"), any()))
                .thenThrow(new InvalidTransitionException("Order order-2: order status SHIPPED -> CANCELLED is not allowed"));

        mockMvc.perform(post("/api/v1/orders/order-1/cancel").header("X-User-Id", "user-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("REFUND_FAILED"));
        mockMvc.perform(post("/api/v1/orders/order-2/cancel").header("X-User-Id", "user-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"));
    }
}
