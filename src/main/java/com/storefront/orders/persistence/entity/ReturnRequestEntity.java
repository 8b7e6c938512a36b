package com.storefront.orders.persistence.entity;

import com.storefront.orders.domain.ReturnStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "return_requests", indexes = {
    @Index(name = "idx_return_number", columnList = "request_number", unique = true),
    @Index(name = "idx_return_order", columnList = "order_id"),
    @Index(name = "idx_return_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReturnRequestEntity {

    @Id
    @Column(name = "id", length = 36, nullable = false)
    private String id;

    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "order_number", nullable = false, length = 32)
    private String orderNumber;

    @Column(name = "customer_id", nullable = false)
    private String customerId;

    @Column(name = "request_number", nullable = false, length = 32)
    private String requestNumber;

    @Column(name = "request_date", nullable = false)
    private Instant requestDate;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "return_items", joinColumns = @JoinColumn(name = "return_id"))
    @OrderColumn(name = "line_no")
    @Builder.Default
    private List<ReturnItemEmbeddable> items = new ArrayList<>();

    @Column(name = "total_refund_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalRefundAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ReturnStatus status;

    @Column(name = "admin_notes", length = 1000)
    private String adminNotes;

    @Column(name = "resolved_by")
    private String resolvedBy;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "refund_id")
    private String refundId;

    @Column(name = "refund_issued_at")
    private Instant refundIssuedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
