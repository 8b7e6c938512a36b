package com.storefront.orders.compliance;

import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.RefundResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes [AUDIT] lines for every money-moving step. Kept apart from operational logging so the
 * lines can be routed to a retention store by logger name.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logInitiated(PaymentIntent intent) {
        log.info("[AUDIT] PAYMENT_INITIATED orderId={} method={} reference={} amount={} currency={} cryptoAmount={} expiresAt={}",
                intent.getOrderId(),
                intent.getMethod(),
                intent.getExternalReference(),
                intent.getExpectedAmount(),
                intent.getCurrency(),
                intent.getCryptoAmount(),
                intent.getExpirationTime());
    }

    public void logCapture(PaymentIntent intent, PaymentResult result) {
        log.info("[AUDIT] PAYMENT_CAPTURE orderId={} reference={} captureId={} status={} failureCode={}",
                intent.getOrderId(),
                intent.getExternalReference(),
                result.getProviderTransactionId(),
                result.getStatus(),
                result.getFailureCode());
    }

    public void logSignal(PaymentIntent intent, PaymentSignal signal, Object outcome) {
        log.info("[AUDIT] PAYMENT_SIGNAL orderId={} reference={} source={} statusCode={} confirmations={} amountReceived={} outcome={}",
                intent.getOrderId(),
                intent.getExternalReference(),
                signal.getSource(),
                signal.getStatusCode(),
                signal.getConfirmations(),
                signal.getAmountReceived(),
                outcome);
    }

    public void logUnappliedPayment(PaymentIntent intent, PaymentSignal signal, Order order) {
        log.warn("[AUDIT] PAYMENT_UNAPPLIED orderId={} orderStatus={} paymentStatus={} intentStatus={} method={} reference={} transaction={} confirmations={} amountReceived={} expectedAmount={} currency={}",
                order.getId(),
                order.getStatus(),
                order.getPaymentStatus(),
                intent.getStatus(),
                intent.getMethod(),
                intent.getExternalReference(),
                signal.getTransactionHash(),
                signal.getConfirmations(),
                signal.getAmountReceived(),
                intent.getExpectedAmount(),
                intent.getCurrency());
    }

    public void logRefund(RefundResult result) {
        log.info("[AUDIT] REFUND_RESULT refundKey={} orderId={} providerRefundId={} status={} amount={} failureCode={}",
                result.getIdempotencyKey(),
                result.getOrderId(),
                result.getProviderRefundId(),
                result.getStatus(),
                result.getAmount(),
                result.getFailureCode());
    }
}
