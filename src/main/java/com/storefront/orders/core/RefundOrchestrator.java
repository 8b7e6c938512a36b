package com.storefront.orders.core;

import com.storefront.orders.api.OrderProcessingException;
import com.storefront.orders.compliance.PaymentAuditLogger;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.RefundStatus;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Refunds a captured order payment: idempotency by refund key, cumulative amount check against
 * the captured amount, adapter resolution by payment method, then the gateway call. Every
 * outcome, failures included, is written to the refund ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefundOrchestrator {

    private final PaymentGatewayRegistry gatewayRegistry;
    private final PaymentOrchestrator paymentOrchestrator;
    private final PaymentPersistenceService persistenceService;
    private final PaymentAuditLogger auditLogger;
    private final Clock clock;

    public RefundResult execute(RefundRequest request) {
        String refundKey = request.getIdempotencyKey();
        log.info("Executing refund: refundKey={}, orderId={}, amount={}", refundKey, request.getOrderId(), request.getAmount());

        try {
            Optional<RefundResult> existing = getCommittedRefund(refundKey);
            if (existing.isPresent()) {
                log.info("Returning existing refund for refundKey={}, status={}", refundKey, existing.get().getStatus());
                return existing.get();
            }
        } catch (Exception e) {
            log.error("Error checking refund idempotency for refundKey={}", refundKey, e);
        }

        Optional<PaymentIntent> capturedOpt = persistenceService.findCompletedIntent(request.getOrderId());
        if (capturedOpt.isEmpty()) {
            log.error("No completed payment to refund for orderId={}", request.getOrderId());
            return fail(request, "PAYMENT_NOT_CAPTURED", "Order " + request.getOrderId() + " has no completed payment");
        }
        PaymentIntent captured = capturedOpt.get();

        BigDecimal refundAmount = request.getAmount() != null ? request.getAmount() : captured.getExpectedAmount();
        RefundRequest resolved = request.toBuilder()
                .amount(refundAmount)
                .currencyCode(request.getCurrencyCode() != null ? request.getCurrencyCode() : captured.getCurrency())
                .paymentMethod(captured.getMethod())
                .providerTransactionId(captured.getProviderTransactionId())
                .externalReference(captured.getExternalReference())
                .build();

        if (refundAmount.signum() <= 0) {
            return fail(resolved, "INVALID_REFUND_AMOUNT", "Refund amount must be positive");
        }

        BigDecimal alreadyRefunded = persistenceService.sumCommittedRefunds(request.getOrderId());
        BigDecimal totalAfterRefund = alreadyRefunded.add(refundAmount);
        if (totalAfterRefund.compareTo(captured.getExpectedAmount()) > 0) {
            BigDecimal remaining = captured.getExpectedAmount().subtract(alreadyRefunded);
            log.error("Cumulative refund would exceed payment. paid={}, alreadyRefunded={}, requested={}, remaining={}, orderId={}",
                    captured.getExpectedAmount(), alreadyRefunded, refundAmount, remaining, request.getOrderId());
            return fail(resolved, "REFUND_LIMIT_EXCEEDED",
                    String.format("Cumulative refund limit exceeded. Already refunded: %s, Remaining: %s", alreadyRefunded, remaining));
        }

        Optional<PaymentGatewayAdapter> adapterOpt = gatewayRegistry.find(captured.getMethod());
        if (adapterOpt.isEmpty()) {
            log.error("No gateway adapter found for refund. method={}", captured.getMethod());
            return fail(resolved, "ADAPTER_NOT_FOUND", "No gateway adapter for " + captured.getMethod());
        }
        PaymentGatewayAdapter adapter = adapterOpt.get();

        try {
            Optional<RefundResult> resultOpt = paymentOrchestrator.refund(adapter, resolved);
            if (resultOpt.isEmpty()) {
                log.error("Gateway adapter {} does not support refunds", adapter.getAdapterName());
                return fail(resolved, "REFUND_NOT_SUPPORTED", adapter.getPaymentMethod() + " does not support refunds");
            }
            RefundResult result = resultOpt.get();
            if (result.getStatus() == null) {
                return fail(resolved, "INVALID_RESULT", "Adapter returned invalid refund result");
            }
            log.info("Refund executed: refundKey={}, status={}, providerRefundId={}",
                    refundKey, result.getStatus(), result.getProviderRefundId());
            store(resolved, result);
            return result;
        } catch (OrderProcessingException e) {
            log.error("Refund execution failed for refundKey={}", refundKey, e);
            return fail(resolved, e.getErrorCode(), "Refund execution failed: " + e.getMessage());
        }
    }

    /** A SUCCESS or PENDING refund is final; a FAILED one may be retried under the same key. */
    private Optional<RefundResult> getCommittedRefund(String refundKey) {
        return persistenceService.getRefund(refundKey)
                .filter(entity -> entity.getStatus() == RefundStatus.SUCCESS || entity.getStatus() == RefundStatus.PENDING)
                .map(entity -> RefundResult.builder()
                        .idempotencyKey(entity.getRefundIdempotencyKey())
                        .orderId(entity.getOrderId())
                        .providerRefundId(entity.getProviderRefundId())
                        .status(entity.getStatus())
                        .amount(entity.getAmount())
                        .currencyCode(entity.getCurrencyCode())
                        .failureCode(entity.getFailureCode())
                        .message(entity.getFailureMessage())
                        .timestamp(entity.getCreatedAt() != null ? entity.getCreatedAt() : clock.instant())
                        .build());
    }

    private RefundResult fail(RefundRequest request, String failureCode, String message) {
        RefundResult failure = RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .status(RefundStatus.FAILED)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .failureCode(failureCode)
                .message(message)
                .timestamp(clock.instant())
                .build();
        store(request, failure);
        return failure;
    }

    private void store(RefundRequest request, RefundResult result) {
        auditLogger.logRefund(result);
        if (request.getAmount() == null || request.getCurrencyCode() == null) {
            // nothing was resolved, so there is no ledger row to write
            return;
        }
        persistenceService.persistRefund(request, result);
    }
}
