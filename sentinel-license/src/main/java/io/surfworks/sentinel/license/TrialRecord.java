package io.surfworks.sentinel.license;

import java.time.Instant;

/**
 * Trial state persisted for one product version.
 *
 * <p>For verified trials {@code trustedStart} is the channel's time when the
 * trial began and {@code clockOffsetMillis} is how far the local clock was
 * behind it. {@code highWaterMark} is the latest effective time ever observed;
 * effective time going backwards past it is treated as clock fraud.
 *
 * @param flags flags the trial was started with
 * @param versionId product version the trial was granted for
 * @param startedAt local time the trial began
 * @param trustedStart trusted time the trial began (equals startedAt for unverified trials)
 * @param clockOffsetMillis trusted minus local time at start
 * @param highWaterMark latest effective time observed
 * @param durationDays length of the grant, including extensions
 * @param daysRemaining days left as of the last evaluation
 * @param expired one-way expiry flag
 * @param fraud set when clock manipulation was detected; implies expired
 */
public record TrialRecord(
    TrialFlags flags,
    String versionId,
    Instant startedAt,
    Instant trustedStart,
    long clockOffsetMillis,
    Instant highWaterMark,
    int durationDays,
    int daysRemaining,
    boolean expired,
    boolean fraud
) {

    public static TrialRecord start(TrialFlags flags, String versionId, Instant localNow,
                                    Instant trustedNow, int durationDays) {
        long offset = trustedNow.toEpochMilli() - localNow.toEpochMilli();
        return new TrialRecord(flags, versionId, localNow, trustedNow, offset, trustedNow,
            durationDays, durationDays, false, false);
    }

    public TrialRecord evaluated(Instant newHighWaterMark, int newDaysRemaining) {
        int remaining = Math.min(daysRemaining, newDaysRemaining);
        return new TrialRecord(flags, versionId, startedAt, trustedStart, clockOffsetMillis,
            newHighWaterMark, durationDays, remaining, expired || remaining == 0, fraud);
    }

    public TrialRecord fraudulent() {
        return new TrialRecord(flags, versionId, startedAt, trustedStart, clockOffsetMillis,
            highWaterMark, durationDays, 0, true, true);
    }

    public TrialRecord extendedBy(int extraDays) {
        return new TrialRecord(flags, versionId, startedAt, trustedStart, clockOffsetMillis,
            highWaterMark, durationDays + extraDays, daysRemaining + extraDays, expired, fraud);
    }

    public boolean isActive() {
        return !expired && daysRemaining > 0;
    }
}
