package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * Asynchronous trial notification delivered to a {@link TrialCallback}.
 *
 * @param status what happened
 * @param errorCode for {@link Status#UNEXPECTED}, the failure that stopped
 *                  trial polling; otherwise null
 */
public record TrialEvent(Status status, LicenseException.ErrorCode errorCode) {

    public enum Status {
        /** The trial ran out naturally. */
        EXPIRED,

        /** The trial was ended because of date/time fraud. */
        EXPIRED_FRAUD,

        /** Trial state could not be determined. */
        UNEXPECTED
    }

    public TrialEvent {
        Objects.requireNonNull(status, "status");
    }

    public static TrialEvent expired() {
        return new TrialEvent(Status.EXPIRED, null);
    }

    public static TrialEvent expiredFraud() {
        return new TrialEvent(Status.EXPIRED_FRAUD, null);
    }

    public static TrialEvent unexpected(LicenseException.ErrorCode code) {
        return new TrialEvent(Status.UNEXPECTED, code);
    }
}
