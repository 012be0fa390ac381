package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * Consolidated result of a genuine verification.
 *
 * @param status what the engine concluded
 * @param offlineKind for {@link Status#GENUINE_BUT_OFFLINE}, whether the channel
 *                    failed just now or a recent failure is still being honored
 * @param showWarning whether the host should tell the user the check failed
 * @param reason the rejection reason for {@link Status#REVOKED}
 * @param message informational message (may be null)
 */
public record VerificationOutcome(
    Status status,
    OfflineKind offlineKind,
    boolean showWarning,
    RejectionReason reason,
    String message
) {

    public enum Status {
        GENUINE,
        GENUINE_FEATURES_CHANGED,
        GENUINE_BUT_OFFLINE,
        NOT_GENUINE,
        REVOKED,
        CONFIG_ERROR
    }

    public enum OfflineKind {
        TRANSIENT,
        PERSISTED_DELAY
    }

    public VerificationOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static VerificationOutcome genuine() {
        return new VerificationOutcome(Status.GENUINE, null, false, null, null);
    }

    public static VerificationOutcome featuresChanged() {
        return new VerificationOutcome(Status.GENUINE_FEATURES_CHANGED, null, false, null, null);
    }

    public static VerificationOutcome offline(OfflineKind kind, boolean showWarning, String message) {
        return new VerificationOutcome(Status.GENUINE_BUT_OFFLINE, kind, showWarning, null, message);
    }

    public static VerificationOutcome notGenuine(String message) {
        return new VerificationOutcome(Status.NOT_GENUINE, null, false, null, message);
    }

    public static VerificationOutcome revoked(RejectionReason reason, String message) {
        return new VerificationOutcome(Status.REVOKED, null, false, reason, message);
    }

    public static VerificationOutcome configError(String message) {
        return new VerificationOutcome(Status.CONFIG_ERROR, null, false, null, message);
    }

    /**
     * True when the host may enable licensed features.
     */
    public boolean isGenuine() {
        return status == Status.GENUINE
            || status == Status.GENUINE_FEATURES_CHANGED
            || status == Status.GENUINE_BUT_OFFLINE;
    }
}
