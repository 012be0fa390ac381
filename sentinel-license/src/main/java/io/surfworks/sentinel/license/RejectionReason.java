package io.surfworks.sentinel.license;

import java.util.Locale;

/**
 * Why the licensing service, or the engine on its behalf, refused a request.
 */
public enum RejectionReason {
    INVALID_KEY,
    NO_PRODUCT_KEY,
    REVOKED,
    DEACTIVATED_REMOTELY,
    FRAUD_DETECTED,
    ACTIVATION_LIMIT_REACHED,
    KEY_EXPIRED,
    ACCOUNT_CANCELED,
    INVALID_EXTENSION,
    STORE_FAILURE,
    UNKNOWN;

    /**
     * Lenient lookup for codes reported by a remote service.
     */
    public static RejectionReason fromCode(String code) {
        if (code == null || code.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
