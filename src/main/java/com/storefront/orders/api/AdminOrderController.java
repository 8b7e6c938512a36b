package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/orders")
@RequiredArgsConstructor
@Tag(name = "Admin orders", description = "Fulfillment updates")
public class AdminOrderController {

    private final OrderLifecycleService lifecycleService;

    @PostMapping("/{orderId}/fulfillment")
    @Operation(summary = "Advance fulfillment",
            description = "SHIPPED (tracking number required), OUT_FOR_DELIVERY or DELIVERED. "
                    + "The tracking URL is derived from the carrier when not supplied.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order updated"),
            @ApiResponse(responseCode = "400", description = "Tracking number missing for SHIPPED"),
            @ApiResponse(responseCode = "403", description = "Not an administrator"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed from the current status")
    })
    public ResponseEntity<OrderResponseDto> advance(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                    @PathVariable String orderId,
                                                    @Valid @RequestBody FulfillmentRequestDto dto) {
        return ResponseEntity.ok(OrderResponseDto.from(
                lifecycleService.advanceFulfillment(principal, orderId, dto.getStatus(), dto.toTracking())));
    }
}
