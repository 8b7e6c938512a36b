package com.storefront.orders.compliance;

import com.storefront.orders.api.InvalidWebhookSignatureException;
import com.storefront.orders.domain.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks HMAC-SHA256 signatures on payment webhooks. Accepts a bare hex digest or one prefixed
 * with {@code sha256=}. A method with no configured secret rejects every webhook.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final String bitcoinSecret;
    private final String moneroSecret;
    private final String redirectSecret;

    public WebhookSignatureVerifier(
            @Value("${orders.webhook.bitcoin-secret:}") String bitcoinSecret,
            @Value("${orders.webhook.monero-secret:}") String moneroSecret,
            @Value("${orders.webhook.redirect-secret:}") String redirectSecret) {
        this.bitcoinSecret = bitcoinSecret;
        this.moneroSecret = moneroSecret;
        this.redirectSecret = redirectSecret;
    }

    public void verify(PaymentMethod method, String rawBody, String signatureHeader) {
        String secret = secretFor(method);
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret not configured for method={}; rejecting webhook", method);
            throw new InvalidWebhookSignatureException("Webhook signature cannot be verified for " + method);
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Missing webhook signature");
        }
        String provided = signatureHeader.trim();
        if (provided.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            provided = provided.substring(PREFIX.length());
        }
        String expected = sign(secret, rawBody != null ? rawBody : "");
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("Webhook signature mismatch for method={} signature={}", method, SecretMasker.mask(provided));
            throw new InvalidWebhookSignatureException("Invalid webhook signature");
        }
    }

    /** Hex HMAC-SHA256 of {@code body}. */
    public static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private String secretFor(PaymentMethod method) {
        switch (method) {
            case BITCOIN:
                return bitcoinSecret;
            case MONERO:
                return moneroSecret;
            case CARD_REDIRECT:
                return redirectSecret;
            default:
                return null;
        }
    }
}
