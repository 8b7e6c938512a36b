package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
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

/**
 * Payment endpoints for an order: start, capture (redirect gateway) and poll (crypto).
 */
@RestController
@RequestMapping("/api/v1/orders/{orderId}/payment")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Pay for an order through the redirect gateway, Bitcoin or Monero")
public class PaymentController {

    private final OrderLifecycleService lifecycleService;

    @PostMapping
    @Operation(
            summary = "Start payment",
            description = "Opens a payment with the order's gateway and returns what to show the customer: an approval URL, "
                    + "or a deposit address with QR payload and crypto amount. An open payment is returned instead of creating a second one.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment intent",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentIntentResponseDto.class))),
            @ApiResponse(responseCode = "409", description = "Order not awaiting payment"),
            @ApiResponse(responseCode = "410", description = "Open payment expired; order cancelled"),
            @ApiResponse(responseCode = "503", description = "Gateway or price feed unavailable. Retry later.")
    })
    public ResponseEntity<PaymentIntentResponseDto> initiate(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                             @PathVariable String orderId) {
        return ResponseEntity.ok(PaymentIntentResponseDto.from(lifecycleService.initiatePayment(principal, orderId)));
    }

    @PostMapping("/capture")
    @Operation(summary = "Capture an approved redirect payment",
            description = "Idempotent: capturing again returns the same order without a new history entry.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order with payment COMPLETED"),
            @ApiResponse(responseCode = "410", description = "Approval expired; order cancelled"),
            @ApiResponse(responseCode = "422", description = "Capture declined; order stays PENDING with payment FAILED"),
            @ApiResponse(responseCode = "503", description = "Gateway unavailable. Retry later.")
    })
    public ResponseEntity<OrderResponseDto> capture(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                    @PathVariable String orderId,
                                                    @Valid @RequestBody CaptureRequestDto dto) {
        return ResponseEntity.ok(OrderResponseDto.from(
                lifecycleService.capturePayment(principal, orderId, dto.getExternalReference())));
    }

    @PostMapping("/poll")
    @Operation(summary = "Refresh payment status", description = "Reads the gateway state of the open payment and applies it.")
    public ResponseEntity<PaymentIntentResponseDto> poll(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                         @PathVariable String orderId) {
        return ResponseEntity.ok(PaymentIntentResponseDto.from(lifecycleService.pollPayment(principal, orderId)));
    }
}
