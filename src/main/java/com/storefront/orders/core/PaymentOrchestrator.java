package com.storefront.orders.core;

import com.storefront.orders.api.GatewayUnavailableException;
import com.storefront.orders.api.OrderProcessingException;
import com.storefront.orders.compliance.PaymentAuditLogger;
import com.storefront.orders.compliance.SecretMasker;
import com.storefront.orders.domain.Order;
import com.storefront.orders.domain.PaymentIntent;
import com.storefront.orders.domain.PaymentResult;
import com.storefront.orders.domain.PaymentSignal;
import com.storefront.orders.domain.RefundRequest;
import com.storefront.orders.domain.RefundResult;
import com.storefront.orders.persistence.service.PaymentPersistenceService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs every gateway call under the adapter's circuit breaker and the shared {@code gateway}
 * retry, and makes capture idempotent per gateway order. Callers never see a raw network
 * failure: an open circuit or exhausted retry surfaces as {@link GatewayUnavailableException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    private static final String RETRY_INSTANCE = "gateway";

    private final PaymentGatewayRegistry gatewayRegistry;
    private final IdempotencyService idempotencyService;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final PaymentPersistenceService persistenceService;
    private final PaymentAuditLogger auditLogger;

    /**
     * Opens a payment at the order's gateway and persists the intent so later signals can find it.
     */
    public PaymentIntent initiate(Order order) {
        PaymentGatewayAdapter adapter = gatewayRegistry.require(order.getPaymentMethod());
        log.info("Initiating payment: orderId={} method={} amount={} {}",
                order.getId(), order.getPaymentMethod(), order.getTotalAmount(), order.getCurrency());
        PaymentIntent intent = call(adapter, "initiate", order.getOrderNumber(), () -> adapter.initiate(order));
        if (intent == null || intent.getExternalReference() == null) {
            throw new IllegalStateException("Adapter " + adapter.getAdapterName() + " returned no payment reference");
        }
        PaymentIntent saved = persistenceService.saveIntent(intent);
        auditLogger.logInitiated(saved);
        return saved;
    }

    /**
     * Captures a redirect payment. A second call for the same gateway order returns the cached
     * result without touching the gateway.
     */
    public PaymentResult capture(PaymentIntent intent) {
        String reference = intent.getExternalReference();
        try {
            Optional<PaymentResult> cached = idempotencyService.getCachedResult(reference);
            if (cached.isPresent()) {
                PaymentResult cachedResult = cached.get();
                if (cachedResult.getStatus() == null) {
                    log.error("Cached capture result for reference={} has no status, ignoring it", reference);
                } else {
                    log.info("Returning cached capture result for reference={}, status={}", reference, cachedResult.getStatus());
                    return cachedResult;
                }
            }
        } catch (Exception e) {
            log.error("Error checking capture idempotency for reference={}", reference, e);
        }

        PaymentGatewayAdapter adapter = gatewayRegistry.require(intent.getMethod());
        PaymentResult result = call(adapter, "capture", reference, () -> adapter.capture(intent));
        if (result == null || result.getStatus() == null) {
            throw new IllegalStateException("Adapter " + adapter.getAdapterName() + " returned an invalid capture result");
        }
        auditLogger.logCapture(intent, result);

        // only successes are cached: the buyer may fix a declined instrument and approve again
        if (result.isSuccess()) {
            try {
                idempotencyService.storeResult(reference, result);
            } catch (Exception e) {
                log.warn("Could not cache capture result for reference={}: {}", reference, e.getMessage());
            }
        }
        return result;
    }

    /** Read-only status query against the gateway. */
    public PaymentSignal poll(PaymentIntent intent) {
        PaymentGatewayAdapter adapter = gatewayRegistry.require(intent.getMethod());
        return call(adapter, "poll", intent.getExternalReference(), () -> adapter.poll(intent));
    }

    public Optional<RefundResult> refund(PaymentGatewayAdapter adapter, RefundRequest request) {
        return call(adapter, "refund", request.getIdempotencyKey(), () -> adapter.refund(request));
    }

    private <T> T call(PaymentGatewayAdapter adapter, String operation, String reference, Supplier<T> supplier) {
        String adapterName = adapter.getAdapterName();
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(adapterName);
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<T> withRetry = Retry.decorateSupplier(retry, supplier);
        Supplier<T> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);
        try {
            return withCb.get();
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for adapter={}, {} rejected for reference={}",
                    adapterName, operation, SecretMasker.maskAddress(reference));
            throw new GatewayUnavailableException(adapter.getPaymentMethod() + " gateway is temporarily unavailable ("
                    + operation + ", reference=" + SecretMasker.maskAddress(reference) + ")", e);
        } catch (OrderProcessingException | IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Gateway {} failed: adapter={} reference={}", operation, adapterName, SecretMasker.maskAddress(reference), e);
            throw new GatewayUnavailableException(adapter.getPaymentMethod() + " " + operation + " failed for reference="
                    + SecretMasker.maskAddress(reference) + ": " + SecretMasker.maskMessage(e.getMessage()), e);
        }
    }
}
