package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * Result of an activation or deactivation exchange.
 *
 * @param status whether the exchange succeeded
 * @param reason rejection reason if rejected
 * @param message error message if it failed
 */
public record ActivationOutcome(Status status, RejectionReason reason, String message) {

    public enum Status {
        OK,
        REJECTED,
        NETWORK_ERROR
    }

    public ActivationOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static ActivationOutcome ok() {
        return new ActivationOutcome(Status.OK, null, null);
    }

    public static ActivationOutcome rejected(RejectionReason reason, String message) {
        return new ActivationOutcome(Status.REJECTED, reason, message);
    }

    public static ActivationOutcome networkError(String message) {
        return new ActivationOutcome(Status.NETWORK_ERROR, null, message);
    }

    public boolean success() {
        return status == Status.OK;
    }
}
