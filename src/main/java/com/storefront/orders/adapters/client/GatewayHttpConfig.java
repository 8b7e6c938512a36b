package com.storefront.orders.adapters.client;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Shared {@link RestTemplate} for outbound gateway calls. Timeouts are short because every
 * call already runs under a retry and a circuit breaker.
 */
@Configuration
public class GatewayHttpConfig {

    @Bean
    public RestTemplate gatewayRestTemplate(@Value("${orders.payment.http.timeout-ms:5000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }
}
