package com.storefront.orders.core;

import com.storefront.orders.api.GatewayUnavailableException;
import com.storefront.orders.domain.PaymentMethod;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the gateway adapter for a payment method.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentGatewayRegistry {

    private final List<PaymentGatewayAdapter> adapters;

    private final Map<PaymentMethod, PaymentGatewayAdapter> adapterByMethod = new EnumMap<>(PaymentMethod.class);

    @PostConstruct
    void init() {
        log.info("Initializing PaymentGatewayRegistry with {} adapters", adapters.size());
        for (PaymentGatewayAdapter adapter : adapters) {
            PaymentGatewayAdapter previous = adapterByMethod.putIfAbsent(adapter.getPaymentMethod(), adapter);
            if (previous != null) {
                log.warn("Ignoring adapter {} for method={}: {} already registered",
                        adapter.getAdapterName(), adapter.getPaymentMethod(), previous.getAdapterName());
            }
        }
        for (PaymentMethod method : PaymentMethod.values()) {
            if (!adapterByMethod.containsKey(method)) {
                log.warn("No gateway adapter registered for method={}", method);
            }
        }
        log.info("Registered gateway adapters: {}", adapterByMethod.keySet());
    }

    public Optional<PaymentGatewayAdapter> find(PaymentMethod method) {
        return Optional.ofNullable(adapterByMethod.get(method));
    }

    public PaymentGatewayAdapter require(PaymentMethod method) {
        return find(method).orElseThrow(() ->
                new GatewayUnavailableException("No gateway adapter configured for method=" + method));
    }
}
