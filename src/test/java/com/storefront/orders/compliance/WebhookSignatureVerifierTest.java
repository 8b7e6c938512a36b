package com.storefront.orders.compliance;

import com.storefront.orders.api.InvalidWebhookSignatureException;
import com.storefront.orders.domain.PaymentMethod;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSignatureVerifierTest {

    private static final String BODY = "{\"addr\":\"bc1qxy2kgdygjrsqtzq2n0yrf2493p83kkfjhx0wlh\",\"status\":2,\"value\":1774950}";

    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier("btc-secret", "xmr-secret", "");

    @Test
    void signMatchesKnownHmacVector() {
        assertThat(WebhookSignatureVerifier.sign("Jefe", "what do ya want for nothing?"))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    void acceptsBareAndPrefixedSignatures() {
        String signature = WebhookSignatureVerifier.sign("btc-secret", BODY);

        assertThatCode(() -> verifier.verify(PaymentMethod.BITCOIN, BODY, signature)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.verify(PaymentMethod.BITCOIN, BODY, "sha256=" + signature)).doesNotThrowAnyException();
        assertThatCode(() -> verifier.verify(PaymentMethod.BITCOIN, BODY, signature.toUpperCase(Locale.ROOT)))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsSignatureFromAnotherSecret() {
        String moneroSignature = WebhookSignatureVerifier.sign("xmr-secret", BODY);

        assertThatThrownBy(() -> verifier.verify(PaymentMethod.BITCOIN, BODY, moneroSignature))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void rejectsTamperedBody() {
        String signature = WebhookSignatureVerifier.sign("btc-secret", BODY);

        assertThatThrownBy(() -> verifier.verify(PaymentMethod.BITCOIN, BODY.replace("1774950", "9774950"), signature))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }

    @Test
    void rejectsMissingSignature() {
        assertThatThrownBy(() -> verifier.verify(PaymentMethod.MONERO, BODY, " "))
                .isInstanceOf(InvalidWebhookSignatureException.class)
                .hasMessage("Missing webhook signature");
    }

    @Test
    void unconfiguredSecretRejectsEverything() {
        String signature = WebhookSignatureVerifier.sign("", BODY);

        assertThatThrownBy(() -> verifier.verify(PaymentMethod.CARD_REDIRECT, BODY, signature))
                .isInstanceOf(InvalidWebhookSignatureException.class);
    }
}
