package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * Result of starting or continuing a trial.
 *
 * @param status trial state after the call
 * @param daysRemaining days left (0 unless active)
 * @param message informational message (may be null)
 */
public record TrialOutcome(Status status, int daysRemaining, String message) {

    public enum Status {
        ACTIVE,
        EXPIRED,
        EXPIRED_FRAUD,
        NETWORK_ERROR,
        REJECTED
    }

    public TrialOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static TrialOutcome active(int daysRemaining) {
        return new TrialOutcome(Status.ACTIVE, daysRemaining, null);
    }

    public static TrialOutcome expired() {
        return new TrialOutcome(Status.EXPIRED, 0, "Trial period has expired");
    }

    public static TrialOutcome fraud() {
        return new TrialOutcome(Status.EXPIRED_FRAUD, 0, "Trial expired because the system clock was tampered with");
    }

    public static TrialOutcome networkError(String message) {
        return new TrialOutcome(Status.NETWORK_ERROR, 0, message);
    }

    public static TrialOutcome rejected(String message) {
        return new TrialOutcome(Status.REJECTED, 0, message);
    }

    static TrialOutcome of(TrialRecord record) {
        if (record.fraud()) {
            return fraud();
        }
        if (record.expired()) {
            return expired();
        }
        return active(record.daysRemaining());
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }
}
