package io.surfworks.sentinel.license;

import java.time.Instant;
import java.util.Map;

/**
 * Activation state persisted for one product.
 *
 * <p>A key saved while an activation is live is held as pending until it is
 * activated, so a failed re-activation leaves the existing one untouched.
 *
 * @param activated whether this installation currently holds an activation
 * @param scope user-wide or system-wide
 * @param productKey the activated (or, before any activation, the saved) product key
 * @param activatedAt when the last successful activation happened
 * @param lastVerifiedAt last successful online verification
 * @param lastAttemptAt last attempt to contact the channel, successful or not
 * @param lastAttemptFailed whether that attempt failed on connectivity
 * @param features entitlement features reported by the last successful exchange
 * @param pendingKey key saved but not yet activated while another one is live
 * @param pendingScope scope for the pending key
 */
public record ActivationRecord(
    boolean activated,
    Scope scope,
    String productKey,
    Instant activatedAt,
    Instant lastVerifiedAt,
    Instant lastAttemptAt,
    boolean lastAttemptFailed,
    Map<String, String> features,
    String pendingKey,
    Scope pendingScope
) {

    public ActivationRecord {
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    /**
     * A saved but not yet activated product key.
     */
    public static ActivationRecord keyOnly(String productKey, Scope scope) {
        return new ActivationRecord(false, scope, productKey, null, null, null, false, Map.of(), null, null);
    }

    /**
     * Record the key the next activation should use.
     */
    public ActivationRecord withSavedKey(String key, Scope keyScope) {
        if (!activated) {
            return new ActivationRecord(false, keyScope, key, activatedAt, lastVerifiedAt,
                lastAttemptAt, lastAttemptFailed, features, null, null);
        }
        return new ActivationRecord(true, scope, productKey, activatedAt, lastVerifiedAt,
            lastAttemptAt, lastAttemptFailed, features, key, keyScope);
    }

    public String keyToActivate() {
        return pendingKey != null ? pendingKey : productKey;
    }

    public Scope scopeToActivate() {
        return pendingKey != null ? pendingScope : scope;
    }

    public ActivationRecord activatedAt(Instant now, Map<String, String> grantedFeatures) {
        return new ActivationRecord(true, scopeToActivate(), keyToActivate(), now, now, now, false,
            grantedFeatures, null, null);
    }

    public ActivationRecord verifiedAt(Instant now, Map<String, String> reportedFeatures) {
        return new ActivationRecord(activated, scope, productKey, activatedAt, now, now, false,
            reportedFeatures, pendingKey, pendingScope);
    }

    public ActivationRecord attemptFailedAt(Instant now) {
        return new ActivationRecord(activated, scope, productKey, activatedAt, lastVerifiedAt, now, true,
            features, pendingKey, pendingScope);
    }

    public ActivationRecord revokedAt(Instant now) {
        return new ActivationRecord(false, scope, productKey, activatedAt, lastVerifiedAt, now, false,
            features, pendingKey, pendingScope);
    }

    /**
     * The instant offline tolerance is measured from.
     */
    public Instant verificationBaseline() {
        return lastVerifiedAt != null ? lastVerifiedAt : activatedAt;
    }

    /**
     * Whether the record shows an activation the service took back.
     */
    public boolean wasRevoked() {
        return !activated && activatedAt != null;
    }

    /**
     * Get masked key for display (e.g., "U9MM...NETA").
     */
    public String maskedKey() {
        String key = keyToActivate();
        if (key == null || key.length() < 8) return "****";
        return key.substring(0, 4) + "..." + key.substring(key.length() - 4);
    }
}
