package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.Carrier;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.OrderStatus;
import com.storefront.orders.domain.PaymentStatus;
import com.storefront.orders.domain.TrackingInfo;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminOrderController.class)
class AdminOrderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrderLifecycleService lifecycleService;

    @Test
    void shipPassesTrackingToService() throws Exception {
        Order shipped = ApiFixtures.order(OrderStatus.SHIPPED, PaymentStatus.COMPLETED).toBuilder()
                .trackingNumber("1Z999AA10123456784")
                .carrier(Carrier.UPS)
                .trackingUrl("https://www.ups.com/track?tracknum=1Z999AA10123456784")
                .build();
        when(lifecycleService.advanceFulfillment(eq(AuthenticatedPrincipal.admin("admin-1")), eq("order-1"),
                eq(OrderStatus.SHIPPED), any())).thenReturn(shipped);

        mockMvc.perform(post("/api/v1/admin/orders/order-1/fulfillment")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"SHIPPED\", \"trackingNumber\": \"1Z999AA10123456784\", \"carrier\": \"UPS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SHIPPED"))
                .andExpect(jsonPath("$.trackingUrl").value("https://www.ups.com/track?tracknum=1Z999AA10123456784"));

        ArgumentCaptor<TrackingInfo> tracking = ArgumentCaptor.forClass(TrackingInfo.class);
        verify(lifecycleService).advanceFulfillment(any(), eq("order-1"), eq(OrderStatus.SHIPPED), tracking.capture());
        assertThat(tracking.getValue().getCarrier()).isEqualTo(Carrier.UPS);
        assertThat(tracking.getValue().getTrackingUrl()).isNull();
    }

    @Test
    void customerCannotAdvanceFulfillment() throws Exception {
        when(lifecycleService.advanceFulfillment(eq(AuthenticatedPrincipal.customer("user-1")), any(), any(), any()))
                .thenThrow(new ForbiddenActionException("Administrator role required"));

        mockMvc.perform(post("/api/v1/admin/orders/order-1/fulfillment")
                        .header("X-User-Id", "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"DELIVERED\"}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void shippingWithoutTrackingIsBadRequest() throws Exception {
        when(lifecycleService.advanceFulfillment(any(), eq("order-1"), eq(OrderStatus.SHIPPED), any()))
                .thenThrow(new IllegalArgumentException("trackingNumber is required to ship an order"));

        mockMvc.perform(post("/api/v1/admin/orders/order-1/fulfillment")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"SHIPPED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("trackingNumber is required to ship an order"));
    }

    @Test
    void unknownStatusValueIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/admin/orders/order-1/fulfillment")
                        .header("X-User-Id", "admin-1")
                        .header("X-User-Role", "ADMIN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"TELEPORTED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }
}
