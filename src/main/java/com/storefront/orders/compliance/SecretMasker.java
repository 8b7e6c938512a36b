package com.storefront.orders.compliance;

import java.util.regex.Pattern;

/**
 * Redacts secrets so they are safe to include in logs and error bodies. Gateway error
 * messages are passed through {@link #maskMessage} before they leave the adapter layer.
 */
public final class SecretMasker {

    private static final String MASK = "****";
    private static final Pattern BEARER = Pattern.compile("(?i)(bearer\\s+)[A-Za-z0-9._~+/=-]+");
    private static final Pattern KEY_VALUE = Pattern.compile(
            "(?i)((?:api[_-]?key|client[_-]?secret|access[_-]?token|secret|signature|x-auth-key|authorization)[\"']?\\s*[:=]\\s*[\"']?)[^\\s\"',&}]+");

    private SecretMasker() {}

    /** Keeps the last four characters of a secret, e.g. "sk_live_abcd1234" -> "****1234". */
    public static String mask(String secret) {
        if (secret == null || secret.isBlank()) return null;
        if (secret.length() <= 8) return MASK;
        return MASK + secret.substring(secret.length() - 4);
    }

    /** Masks bearer tokens and key=value style secrets inside free text. */
    public static String maskMessage(String message) {
        if (message == null) return null;
        String masked = BEARER.matcher(message).replaceAll("$1" + MASK);
        return KEY_VALUE.matcher(masked).replaceAll("$1" + MASK);
    }

    /** Deposit addresses are not secret but are long; log a recognisable prefix only. */
    public static String maskAddress(String address) {
        if (address == null || address.isBlank()) return null;
        if (address.length() <= 12) return address;
        return address.substring(0, 8) + "..." + address.substring(address.length() - 4);
    }
}
