package com.storefront.orders.api;

import com.storefront.orders.domain.ReturnItem;
import com.storefront.orders.domain.ReturnRequest;
import com.storefront.orders.domain.ReturnStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReturnResponseDto {

    String id;
    String requestNumber;
    String orderId;
    String orderNumber;
    Instant requestDate;
    List<ReturnItem> items;
    BigDecimal totalRefundAmount;
    ReturnStatus status;
    String adminNotes;
    String resolvedBy;
    Instant approvedAt;
    String refundId;
    Instant refundIssuedAt;

    public static ReturnResponseDto from(ReturnRequest request) {
        return ReturnResponseDto.builder()
                .id(request.getId())
                .requestNumber(request.getRequestNumber())
                .orderId(request.getOrderId())
                .orderNumber(request.getOrderNumber())
                .requestDate(request.getRequestDate())
                .items(request.getItems())
                .totalRefundAmount(request.getTotalRefundAmount())
                .status(request.getStatus())
                .adminNotes(request.getAdminNotes())
                .resolvedBy(request.getResolvedBy())
                .approvedAt(request.getApprovedAt())
                .refundId(request.getRefundId())
                .refundIssuedAt(request.getRefundIssuedAt())
                .build();
    }
}
