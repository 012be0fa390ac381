package io.surfworks.sentinel.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether the activation on this machine is genuine.
 *
 * <p>The channel is contacted at most once per call. Between scheduled checks a
 * prior success is trusted as is. Connectivity failures are absorbed for
 * {@code daysBetweenChecks + graceDaysOnNetworkError} days counted from the last
 * successful check, after which the installation is not genuine until a live
 * check succeeds. A rejection from the service clears the local activation.
 *
 * <p>Elapsed time is measured against the later of the local clock and the last
 * recorded attempt, so turning the clock back does not stretch the grace period.
 */
final class GenuineVerifier {

    private static final Logger LOG = Logger.getLogger(GenuineVerifier.class.getName());

    private final LicenseHandle handle;
    private final VerificationChannel channel;
    private final LocalStateStore store;
    private final Clock clock;
    private final Duration offlineRetryDelay;
    private final Lock lock;

    GenuineVerifier(LicenseHandle handle, VerificationChannel channel, LocalStateStore store,
                    Clock clock, EngineSettings settings, Lock lock) {
        this.handle = handle;
        this.channel = channel;
        this.store = store;
        this.clock = clock;
        this.offlineRetryDelay = settings.offlineRetryDelay();
        this.lock = lock;
    }

    /**
     * Verify, honoring the check interval and the offline retry delay.
     */
    VerificationOutcome verify(GenuineOptions options) {
        return run(options, false);
    }

    /**
     * Verify against the channel right away.
     */
    VerificationOutcome verifyNow(GenuineOptions options) {
        return run(options, true);
    }

    GenuineDays genuineDays(GenuineOptions options) {
        Objects.requireNonNull(options, "options");
        lock.lock();
        try {
            ActivationRecord record = store.load(handle).activation();
            if (record == null || !record.activated() || record.verificationBaseline() == null) {
                return new GenuineDays(0, false);
            }
            long elapsed = Math.max(0, Duration.between(record.verificationBaseline(),
                effectiveNow(record, clock.instant())).toDays());
            if (elapsed < options.daysBetweenChecks()) {
                return new GenuineDays((int) (options.daysBetweenChecks() - elapsed), false);
            }
            long tolerance = options.offlineToleranceDays();
            if (elapsed <= tolerance) {
                return new GenuineDays((int) (tolerance - elapsed), true);
            }
            return new GenuineDays(0, false);
        } finally {
            lock.unlock();
        }
    }

    private VerificationOutcome run(GenuineOptions options, boolean force) {
        Objects.requireNonNull(options, "options");
        lock.lock();
        try {
            ActivationRecord record = store.load(handle).activation();
            if (record == null || !record.activated()) {
                return VerificationOutcome.notGenuine("Not activated");
            }
            if (record.productKey() == null || record.productKey().isBlank()) {
                LOG.warning(handle + ": activation record carries no product key");
                return VerificationOutcome.configError("Activation record has no product key");
            }

            Instant now = clock.instant();
            if (!force) {
                if (isCheckCurrent(record, now, options)) {
                    LOG.fine(() -> handle + ": verified " + record.lastVerifiedAt() + ", next check not yet due");
                    return VerificationOutcome.genuine();
                }
                if (isRetryDeferred(record, now, options)) {
                    LOG.fine(() -> handle + ": last attempt at " + record.lastAttemptAt() + " failed, deferring retry");
                    return VerificationOutcome.offline(VerificationOutcome.OfflineKind.PERSISTED_DELAY,
                        !options.skipOfflineShowError(),
                        "Licensing service was unreachable recently; still within the grace period");
                }
            }

            ChannelResult<Entitlements> result = channel.check(handle, record.productKey());
            switch (result.kind()) {
                case OK:
                    return onVerified(record, result.value(), now);
                case REJECTED:
                    return onRejected(record, result, now);
                default:
                    return onUnreachable(record, result, now, options);
            }
        } finally {
            lock.unlock();
        }
    }

    private VerificationOutcome onVerified(ActivationRecord record, Entitlements entitlements, Instant now) {
        Map<String, String> features = entitlements != null ? entitlements.features() : Map.of();
        boolean changed = !record.features().equals(features);
        store.save(handle, record.verifiedAt(now, features));
        if (changed) {
            LOG.info(() -> handle + ": entitlements changed to " + features.keySet());
            return VerificationOutcome.featuresChanged();
        }
        LOG.fine(() -> handle + ": genuine");
        return VerificationOutcome.genuine();
    }

    private VerificationOutcome onRejected(ActivationRecord record, ChannelResult<?> result, Instant now) {
        store.save(handle, record.revokedAt(now));
        LOG.warning(handle + ": activation rejected by " + channel.getChannelName()
            + " (" + result.reason() + "): " + result.message());
        return VerificationOutcome.revoked(result.reason(), result.message());
    }

    private VerificationOutcome onUnreachable(ActivationRecord record, ChannelResult<?> result, Instant now,
                                              GenuineOptions options) {
        Instant effective = effectiveNow(record, now);
        store.save(handle, record.attemptFailedAt(effective));

        if (isWithinGrace(record, effective, options)) {
            LOG.log(Level.WARNING, "{0}: licensing service unreachable ({1}), running on grace period",
                new Object[] {handle, result.message()});
            return VerificationOutcome.offline(VerificationOutcome.OfflineKind.TRANSIENT,
                !options.skipOfflineShowError(), result.message());
        }
        LOG.warning(handle + ": not verified for more than " + options.offlineToleranceDays()
            + " days, a live check is required");
        return VerificationOutcome.notGenuine(
            "Could not verify with the licensing service for more than "
                + options.offlineToleranceDays() + " days");
    }

    private static boolean isCheckCurrent(ActivationRecord record, Instant now, GenuineOptions options) {
        Instant verified = record.lastVerifiedAt();
        if (record.lastAttemptFailed() || verified == null || now.isBefore(verified)) {
            return false;
        }
        return Duration.between(verified, now).compareTo(Duration.ofDays(options.daysBetweenChecks())) < 0;
    }

    private boolean isRetryDeferred(ActivationRecord record, Instant now, GenuineOptions options) {
        Instant attempt = record.lastAttemptAt();
        if (!record.lastAttemptFailed() || attempt == null || now.isBefore(attempt)) {
            return false;
        }
        return Duration.between(attempt, now).compareTo(offlineRetryDelay) < 0
            && isWithinGrace(record, now, options);
    }

    private static boolean isWithinGrace(ActivationRecord record, Instant effectiveNow, GenuineOptions options) {
        Instant baseline = record.verificationBaseline();
        if (baseline == null) {
            return false;
        }
        // Whole days, the same measure genuineDays reports
        return Duration.between(baseline, effectiveNow).toDays() <= options.offlineToleranceDays();
    }

    private static Instant effectiveNow(ActivationRecord record, Instant now) {
        Instant attempt = record.lastAttemptAt();
        return attempt != null && attempt.isAfter(now) ? attempt : now;
    }
}
