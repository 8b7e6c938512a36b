package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.Order;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Customer order endpoints: checkout, lookup and cancellation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
@Tag(name = "Orders", description = "Place, view and cancel orders")
public class OrderController {

    private final OrderLifecycleService lifecycleService;

    @PostMapping
    @Operation(
            summary = "Place an order",
            description = "Prices the cart from the catalog, reserves stock and creates the order as PENDING/PENDING. "
                    + "Start payment with POST /api/v1/orders/{id}/payment.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order created",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = OrderResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed, unknown product or shipping method"),
            @ApiResponse(responseCode = "409", description = "Insufficient stock. Body: { \"error\": \"INSUFFICIENT_STOCK\" }")
    })
    public ResponseEntity<OrderResponseDto> create(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                   @Valid @RequestBody CreateOrderRequestDto dto) {
        Order order = lifecycleService.createOrder(principal, dto.toCheckout());
        log.debug("Order placed via API: orderId={} customerId={}", order.getId(), principal.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponseDto.from(order));
    }

    @GetMapping("/{orderId}")
    @Operation(summary = "Get an order", description = "Owner or admin only. An expired unpaid order is cancelled on read.")
    public ResponseEntity<OrderResponseDto> get(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                @PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponseDto.from(lifecycleService.getOrder(principal, orderId)));
    }

    @PostMapping("/{orderId}/cancel")
    @Operation(summary = "Cancel an order",
            description = "Allowed while PENDING or PROCESSING. A captured payment is refunded first; if the refund fails the order is unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order cancelled"),
            @ApiResponse(responseCode = "409", description = "Order can no longer be cancelled"),
            @ApiResponse(responseCode = "502", description = "Refund failed; order unchanged. Body: { \"error\": \"REFUND_FAILED\" }")
    })
    public ResponseEntity<OrderResponseDto> cancel(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                   @PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponseDto.from(lifecycleService.cancelOrder(orderId, principal)));
    }
}
