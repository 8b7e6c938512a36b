package com.storefront.orders.persistence.service;

import com.storefront.orders.domain.IntentStatus;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.domain.RefundStatus;
import com.storefront.orders.persistence.entity.PaymentIntentEntity;
import com.storefront.orders.persistence.entity.RefundEntity;
import com.storefront.orders.persistence.repository.PaymentIntentRepository;
import com.storefront.orders.persistence.repository.RefundRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persists payment intents and the refund ledger. Intent writes propagate failures because
 * signals are matched against them; ledger writes are logged and swallowed so a database hiccup
 * never hides a refund the gateway already made.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentPersistenceService {

    private static final EnumSet<IntentStatus> OPEN_STATUSES =
            EnumSet.of(IntentStatus.INITIATED, IntentStatus.AWAITING_CONFIRMATION);

    private final PaymentIntentRepository intentRepository;
    private final RefundRepository refundRepository;

    @Transactional
    public PaymentIntent saveIntent(PaymentIntent intent) {
        PaymentIntentEntity saved = intentRepository.save(toEntity(intent));
        log.debug("Persisted payment intent: intentId={} orderId={} status={}",
                saved.getId(), saved.getOrderId(), saved.getStatus());
        return toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findIntentByExternalReference(String externalReference) {
        return intentRepository.findByExternalReference(externalReference).map(PaymentPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public List<PaymentIntent> findIntentsByOrder(String orderId) {
        return intentRepository.findByOrderIdOrderByCreatedAtDesc(orderId).stream()
                .map(PaymentPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    /** Latest intent still waiting for the customer or the chain. */
    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findOpenIntent(String orderId) {
        return intentRepository.findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(orderId, OPEN_STATUSES)
                .map(PaymentPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentIntent> findCompletedIntent(String orderId) {
        return intentRepository.findFirstByOrderIdAndStatusInOrderByCreatedAtDesc(orderId, EnumSet.of(IntentStatus.COMPLETED))
                .map(PaymentPersistenceService::toDomain);
    }

    /**
     * Creates or overwrites the ledger row for {@code refundIdempotencyKey}.
     */
    @Transactional
    public void persistRefund(RefundRequest request, RefundResult result) {
        String refundIdempotencyKey = request.getIdempotencyKey();
        try {
            Optional<RefundEntity> existingOpt = refundRepository.findByRefundIdempotencyKey(refundIdempotencyKey);

            RefundEntity entity;
            if (existingOpt.isPresent()) {
                entity = existingOpt.get();
                entity.setStatus(result.getStatus());
                entity.setProviderRefundId(result.getProviderRefundId());
                entity.setAmount(result.getAmount() != null ? result.getAmount() : entity.getAmount());
                entity.setFailureCode(result.getFailureCode());
                entity.setFailureMessage(truncate(result.getMessage()));
                entity.setUpdatedAt(Instant.now());
            } else {
                entity = RefundEntity.builder()
                        .refundIdempotencyKey(refundIdempotencyKey)
                        .orderId(request.getOrderId())
                        .paymentMethod(request.getPaymentMethod())
                        .providerRefundId(result.getProviderRefundId())
                        .status(result.getStatus())
                        .amount(result.getAmount() != null ? result.getAmount() : request.getAmount())
                        .currencyCode(result.getCurrencyCode() != null ? result.getCurrencyCode() : request.getCurrencyCode())
                        .failureCode(result.getFailureCode())
                        .failureMessage(truncate(result.getMessage()))
                        .reason(request.getReason())
                        .correlationId(request.getCorrelationId())
                        .build();
            }

            refundRepository.save(entity);
            log.debug("Persisted refund: refundIdempotencyKey={}, status={}", refundIdempotencyKey, result.getStatus());
        } catch (DataIntegrityViolationException e) {
            log.warn("Duplicate refund idempotency key detected: refundIdempotencyKey={}. " +
                    "This is expected in concurrent scenarios.", refundIdempotencyKey);
        } catch (Exception e) {
            log.error("Failed to persist refund: refundIdempotencyKey={}", refundIdempotencyKey, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<RefundEntity> getRefund(String refundIdempotencyKey) {
        return refundRepository.findByRefundIdempotencyKey(refundIdempotencyKey);
    }

    /** Sum of refunds that succeeded or are committed for manual settlement. */
    @Transactional(readOnly = true)
    public BigDecimal sumCommittedRefunds(String orderId) {
        BigDecimal sum = refundRepository.sumRefundedAmountByOrder(orderId,
                EnumSet.of(RefundStatus.SUCCESS, RefundStatus.PENDING));
        return sum != null ? sum : BigDecimal.ZERO;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() > 900 ? message.substring(0, 900) : message;
    }

    static PaymentIntentEntity toEntity(PaymentIntent intent) {
        return PaymentIntentEntity.builder()
                .id(intent.getId())
                .orderId(intent.getOrderId())
                .method(intent.getMethod())
                .externalReference(intent.getExternalReference())
                .expectedAmount(intent.getExpectedAmount())
                .currency(intent.getCurrency())
                .cryptoAmount(intent.getCryptoAmount())
                .exchangeRate(intent.getExchangeRate())
                .exchangeRateTimestamp(intent.getExchangeRateTimestamp())
                .presentationUrl(intent.getPresentationUrl())
                .depositAddress(intent.getDepositAddress())
                .qrPayload(intent.getQrPayload())
                .expirationTime(intent.getExpirationTime())
                .requiredConfirmations(intent.getRequiredConfirmations())
                .observedConfirmations(intent.getObservedConfirmations())
                .providerTransactionId(intent.getProviderTransactionId())
                .status(intent.getStatus())
                .createdAt(intent.getCreatedAt())
                .updatedAt(intent.getUpdatedAt())
                .build();
    }

    static PaymentIntent toDomain(PaymentIntentEntity entity) {
        return PaymentIntent.builder()
                .id(entity.getId())
                .orderId(entity.getOrderId())
                .method(entity.getMethod())
                .externalReference(entity.getExternalReference())
                .expectedAmount(entity.getExpectedAmount())
                .currency(entity.getCurrency())
                .cryptoAmount(entity.getCryptoAmount())
                .exchangeRate(entity.getExchangeRate())
                .exchangeRateTimestamp(entity.getExchangeRateTimestamp())
                .presentationUrl(entity.getPresentationUrl())
                .depositAddress(entity.getDepositAddress())
                .qrPayload(entity.getQrPayload())
                .expirationTime(entity.getExpirationTime())
                .requiredConfirmations(entity.getRequiredConfirmations())
                .observedConfirmations(entity.getObservedConfirmations())
                .providerTransactionId(entity.getProviderTransactionId())
                .status(entity.getStatus())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
