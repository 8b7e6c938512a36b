package com.storefront.orders.api;

import com.storefront.orders.core.OrderLifecycleService;
import com.storefront.orders.domain.AuthenticatedPrincipal;
import com.storefront.orders.domain.ReturnRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Returns", description = "Return requests and their resolution")
public class ReturnController {

    private final OrderLifecycleService lifecycleService;

    @PostMapping("/orders/{orderId}/returns")
    @Operation(summary = "Request a return",
            description = "Delivered orders only, within the return window, one open request per order.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Return requested"),
            @ApiResponse(responseCode = "422", description = "Not eligible. Body: { \"error\": \"RETURN_NOT_ELIGIBLE\" }")
    })
    public ResponseEntity<ReturnResponseDto> request(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                     @PathVariable String orderId,
                                                     @Valid @RequestBody ReturnRequestDto dto) {
        ReturnRequest request = lifecycleService.requestReturn(principal, orderId, dto.toItems());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReturnResponseDto.from(request));
    }

    @PostMapping("/admin/returns/{returnId}/resolution")
    @Operation(summary = "Approve or reject a return",
            description = "Admin only. APPROVE refunds through the original gateway; on refund failure the request stays APPROVED and can be approved again.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Return resolved"),
            @ApiResponse(responseCode = "403", description = "Not an administrator"),
            @ApiResponse(responseCode = "502", description = "Refund failed; request stays APPROVED")
    })
    public ResponseEntity<ReturnResponseDto> resolve(@CurrentPrincipal AuthenticatedPrincipal principal,
                                                     @PathVariable String returnId,
                                                     @Valid @RequestBody ReturnResolutionDto dto) {
        return ResponseEntity.ok(ReturnResponseDto.from(
                lifecycleService.resolveReturn(principal, returnId, dto.getDecision(), dto.getNotes())));
    }
}
