package com.storefront.orders.persistence.service;

import com.storefront.orders.domain.ReturnItem;
import com.storefront.orders.domain.ReturnRequest;
import com.storefront.orders.persistence.entity.ReturnItemEmbeddable;
import com.storefront.orders.persistence.entity.ReturnRequestEntity;
import com.storefront.orders.persistence.repository.ReturnRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReturnPersistenceService {

    private static final DateTimeFormatter REQUEST_DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final ReturnRequestRepository repository;

    @Transactional
    public ReturnRequest save(ReturnRequest request) {
        ReturnRequestEntity saved = repository.save(toEntity(request));
        log.debug("Persisted return request: returnId={} status={}", saved.getId(), saved.getStatus());
        return toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<ReturnRequest> findById(String returnId) {
        return repository.findById(returnId).map(ReturnPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ReturnRequest> findByOrder(String orderId) {
        return repository.findByOrderIdOrderByRequestDateDesc(orderId).stream()
                .map(ReturnPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * {@code RET-yyyyMMdd-NNN} with a per-day sequence. The unique index on request_number
     * rejects the rare collision between two requests created in the same instant.
     */
    @Transactional(readOnly = true)
    public String nextRequestNumber(LocalDate day) {
        String prefix = "RET-" + REQUEST_DAY.format(day) + "-";
        long sequence = repository.countByRequestNumberStartingWith(prefix) + 1;
        return prefix + String.format("%03d", sequence);
    }

    private static ReturnRequestEntity toEntity(ReturnRequest request) {
        List<ReturnItemEmbeddable> items = new ArrayList<>();
        for (ReturnItem item : request.getItems()) {
            items.add(ReturnItemEmbeddable.builder()
                    .productId(item.getProductId())
                    .productName(item.getProductName())
                    .unitPrice(item.getUnitPrice())
                    .quantity(item.getQuantity())
                    .reason(item.getReason())
                    .description(item.getDescription())
                    .build());
        }
        return ReturnRequestEntity.builder()
                .id(request.getId())
                .orderId(request.getOrderId())
                .orderNumber(request.getOrderNumber())
                .customerId(request.getCustomerId())
                .requestNumber(request.getRequestNumber())
                .requestDate(request.getRequestDate())
                .items(items)
                .totalRefundAmount(request.getTotalRefundAmount())
                .status(request.getStatus())
                .adminNotes(request.getAdminNotes())
                .resolvedBy(request.getResolvedBy())
                .approvedAt(request.getApprovedAt())
                .refundId(request.getRefundId())
                .refundIssuedAt(request.getRefundIssuedAt())
                .updatedAt(request.getUpdatedAt())
                .build();
    }

    private static ReturnRequest toDomain(ReturnRequestEntity entity) {
        ReturnRequest.ReturnRequestBuilder builder = ReturnRequest.builder()
                .id(entity.getId())
                .orderId(entity.getOrderId())
                .orderNumber(entity.getOrderNumber())
                .customerId(entity.getCustomerId())
                .requestNumber(entity.getRequestNumber())
                .requestDate(entity.getRequestDate())
                .totalRefundAmount(entity.getTotalRefundAmount())
                .status(entity.getStatus())
                .adminNotes(entity.getAdminNotes())
                .resolvedBy(entity.getResolvedBy())
                .approvedAt(entity.getApprovedAt())
                .refundId(entity.getRefundId())
                .refundIssuedAt(entity.getRefundIssuedAt())
                .updatedAt(entity.getUpdatedAt());
        for (ReturnItemEmbeddable item : entity.getItems()) {
            builder.item(ReturnItem.builder()
                    .productId(item.getProductId())
                    .productName(item.getProductName())
                    .unitPrice(item.getUnitPrice())
                    .quantity(item.getQuantity())
                    .reason(item.getReason())
                    .description(item.getDescription())
                    .build());
        }
        return builder.build();
    }
}
