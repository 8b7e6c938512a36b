package com.storefront.orders.adapters;

import com.storefront.orders.adapters.client.OrderAlreadyCapturedException;
import com.storefront.orders.adapters.client.RedirectGatewayClient;
import com.storefront.orders.adapters.client.RedirectOrder;
import com.storefront.orders.adapters.client.RedirectRefund;
import com.storefront.orders.api.CaptureException;
import com.storefront.orders.core.PaymentGatewayAdapter;
import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentMethod;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.RefundStatus;
import com.storefront.orders.domain.TransactionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * PayPal-style redirect checkout. The buyer approves on the gateway's site; {@link #capture}
 * is the only way an intent becomes COMPLETED. Webhooks can report approval or denial but
 * never completion.
 */
@Slf4j
@Component
public class RedirectGatewayAdapter implements PaymentGatewayAdapter {

    private final RedirectGatewayClient client;
    private final Clock clock;
    private final Duration approvalExpiry;

    public RedirectGatewayAdapter(
            RedirectGatewayClient client,
            Clock clock,
            @Value("${orders.payment.redirect.approval-expiry-minutes:180}") long approvalExpiryMinutes) {
        this.client = client;
        this.clock = clock;
        this.approvalExpiry = Duration.ofMinutes(approvalExpiryMinutes);
    }

    @Override
    public PaymentMethod getPaymentMethod() {
        return PaymentMethod.CARD_REDIRECT;
    }

    @Override
    public PaymentIntent initiate(Order order) {
        PaymentGatewayAdapter.requirePayable(order);
        RedirectOrder gatewayOrder = client.createOrder(order.getOrderNumber(), order.getTotalAmount(), order.getCurrency());
        if (gatewayOrder.getId() == null || gatewayOrder.getApprovalUrl() == null) {
            throw new IllegalStateException("Redirect gateway returned no order id or approval URL for order " + order.getId());
        }
        Instant now = clock.instant();
        log.debug("Redirect payment initiated: orderId={} gatewayOrderId={}", order.getId(), gatewayOrder.getId());
        return PaymentIntent.builder()
                .id(UUID.randomUUID().toString())
                .orderId(order.getId())
                .method(PaymentMethod.CARD_REDIRECT)
                .externalReference(gatewayOrder.getId())
                .expectedAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .presentationUrl(gatewayOrder.getApprovalUrl())
                .expirationTime(now.plus(approvalExpiry))
                .requiredConfirmations(0)
                .observedConfirmations(0)
                .status(IntentStatus.INITIATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Override
    public PaymentResult capture(PaymentIntent intent) {
        String reference = intent.getExternalReference();
        RedirectOrder captured;
        try {
            captured = client.captureOrder(reference);
        } catch (OrderAlreadyCapturedException e) {
            RedirectOrder existing = client.getOrder(reference);
            if ("COMPLETED".equalsIgnoreCase(existing.getStatus()) && existing.getCaptureId() != null) {
                log.info("Gateway order already captured, returning existing capture: reference={} captureId={}",
                        reference, existing.getCaptureId());
                return success(intent, existing, "Already captured");
            }
            throw new CaptureException("Gateway order " + reference + " reported as captured but no capture was found", e);
        }

        if ("COMPLETED".equalsIgnoreCase(captured.getStatus()) && captured.getCaptureId() != null) {
            return success(intent, captured, "Captured");
        }
        log.warn("Redirect capture not completed: reference={} status={} reason={}",
                reference, captured.getStatus(), captured.getFailureReason());
        return PaymentResult.builder()
                .idempotencyKey(reference)
                .status(TransactionStatus.FAILED)
                .amount(intent.getExpectedAmount())
                .currencyCode(intent.getCurrency())
                .failureCode(captured.getFailureReason() != null ? captured.getFailureReason() : "CAPTURE_" + captured.getStatus())
                .message("Capture not completed, gateway status " + captured.getStatus())
                .timestamp(clock.instant())
                .build();
    }

    @Override
    public PaymentSignal poll(PaymentIntent intent) {
        RedirectOrder order = client.getOrder(intent.getExternalReference());
        return PaymentSignal.builder()
                .externalReference(intent.getExternalReference())
                .statusCode(order.getStatus() != null ? order.getStatus().toLowerCase(Locale.ROOT) : null)
                .amountReceived(order.getCapturedAmount())
                .transactionHash(order.getCaptureId())
                .source("poll")
                .receivedAt(clock.instant())
                .build();
    }

    /**
     * Approval (or a completed capture seen from outside) only means the buyer is done on the
     * gateway side. COMPLETED is reserved for our own capture call.
     */
    @Override
    public IntentStatus evaluate(PaymentIntent intent, PaymentSignal signal) {
        String code = signal.getStatusCode() == null ? "" : signal.getStatusCode().toLowerCase(Locale.ROOT);
        switch (code) {
            case "approved":
            case "saved":
            case "completed":
                return IntentStatus.AWAITING_CONFIRMATION;
            case "denied":
            case "declined":
            case "voided":
                return IntentStatus.FAILED;
            default:
                return intent.getStatus() != null && !intent.getStatus().isTerminal()
                        ? intent.getStatus()
                        : IntentStatus.INITIATED;
        }
    }

    @Override
    public Optional<RefundResult> refund(RefundRequest request) {
        if (request.getProviderTransactionId() == null) {
            return Optional.of(failedRefund(request, "CAPTURE_ID_MISSING", "No capture id recorded for order " + request.getOrderId()));
        }
        RedirectRefund refund = client.refundCapture(request.getProviderTransactionId(), request.getAmount(),
                request.getCurrencyCode(), request.getReason(), request.getIdempotencyKey());
        RefundStatus status;
        if ("COMPLETED".equalsIgnoreCase(refund.getStatus())) {
            status = RefundStatus.SUCCESS;
        } else if ("PENDING".equalsIgnoreCase(refund.getStatus())) {
            status = RefundStatus.PENDING;
        } else if ("CANCELLED".equalsIgnoreCase(refund.getStatus())) {
            status = RefundStatus.CANCELLED;
        } else {
            status = RefundStatus.FAILED;
        }
        return Optional.of(RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .providerRefundId(refund.getId())
                .status(status)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .failureCode(status == RefundStatus.FAILED || status == RefundStatus.CANCELLED ? "GATEWAY_REFUND_" + refund.getStatus() : null)
                .message("Gateway refund status " + refund.getStatus())
                .timestamp(clock.instant())
                .build());
    }

    private PaymentResult success(PaymentIntent intent, RedirectOrder order, String message) {
        return PaymentResult.builder()
                .idempotencyKey(intent.getExternalReference())
                .providerTransactionId(order.getCaptureId())
                .status(TransactionStatus.SUCCESS)
                .amount(order.getCapturedAmount() != null ? order.getCapturedAmount() : intent.getExpectedAmount())
                .currencyCode(order.getCurrencyCode() != null ? order.getCurrencyCode() : intent.getCurrency())
                .message(message)
                .timestamp(clock.instant())
                .metadata(Map.of("adapterName", getAdapterName(), "gatewayOrderId", intent.getExternalReference()))
                .build();
    }

    private RefundResult failedRefund(RefundRequest request, String code, String message) {
        return RefundResult.builder()
                .idempotencyKey(request.getIdempotencyKey())
                .orderId(request.getOrderId())
                .status(RefundStatus.FAILED)
                .amount(request.getAmount())
                .currencyCode(request.getCurrencyCode())
                .failureCode(code)
                .message(message)
                .timestamp(clock.instant())
                .build();
    }
}
