package io.surfworks.sentinel.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * Grants and ages the trial for one product.
 *
 * <p>Day counts only ever go down. A verified trial measures time on the
 * channel's clock, using the offset captured at start, and treats the effective
 * time moving back past the start or the high-water mark (beyond the skew
 * tolerance) as fraud. An unverified trial measures local time and clamps a
 * backwards clock at zero elapsed.
 */
final class TrialTracker {

    private static final Logger LOG = Logger.getLogger(TrialTracker.class.getName());

    private final LicenseHandle handle;
    private final ProductConfig config;
    private final VerificationChannel channel;
    private final LocalStateStore store;
    private final Clock clock;
    private final Duration skewTolerance;
    private final Lock lock;

    TrialTracker(LicenseHandle handle, ProductConfig config, VerificationChannel channel,
                 LocalStateStore store, Clock clock, EngineSettings settings, Lock lock) {
        this.handle = handle;
        this.config = config;
        this.channel = channel;
        this.store = store;
        this.clock = clock;
        this.skewTolerance = settings.clockSkewTolerance();
        this.lock = lock;
    }

    /**
     * Start the trial, or re-validate the one already running.
     *
     * @throws LicenseException with {@code INVALID_TRIAL_FLAGS} if a trial exists with other flags
     */
    TrialOutcome startOrContinue(TrialFlags flags) {
        Objects.requireNonNull(flags, "flags");
        lock.lock();
        try {
            TrialRecord record = store.load(handle).trial();
            if (record == null) {
                return start(flags);
            }
            if (record.expired() && mayRestart(record)) {
                LOG.info(() -> handle + ": trial for " + record.versionId() + " expired, granting a new one");
                return start(flags);
            }
            requireFlags(record, flags);
            if (record.expired()) {
                return TrialOutcome.of(record);
            }
            return TrialOutcome.of(evaluateAndSave(record));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Days left in the trial, 0 when there is none.
     */
    int daysRemaining(TrialFlags flags) {
        Objects.requireNonNull(flags, "flags");
        lock.lock();
        try {
            TrialRecord record = store.load(handle).trial();
            if (record == null) {
                return 0;
            }
            requireFlags(record, flags);
            return evaluateAndSave(record).daysRemaining();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-evaluate the stored trial, or return null if there is none.
     */
    TrialRecord poll() {
        lock.lock();
        try {
            TrialRecord record = store.load(handle).trial();
            return record == null ? null : evaluateAndSave(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Redeem an extension code for the running trial.
     */
    TrialOutcome extend(String extensionCode, TrialFlags flags) {
        Objects.requireNonNull(flags, "flags");
        if (extensionCode == null || extensionCode.isBlank()) {
            return TrialOutcome.rejected("Extension code is empty");
        }
        lock.lock();
        try {
            TrialRecord record = store.load(handle).trial();
            if (record == null) {
                return TrialOutcome.rejected("No trial has been started");
            }
            requireFlags(record, flags);
            TrialRecord current = evaluateAndSave(record);
            if (!current.isActive()) {
                return TrialOutcome.of(current);
            }

            ChannelResult<Integer> result = channel.extendTrial(handle, extensionCode.trim());
            if (result.isNetworkError()) {
                return TrialOutcome.networkError(result.message());
            }
            if (result.isRejected() || result.value() == null || result.value() <= 0) {
                LOG.warning(handle + ": trial extension refused: " + result.message());
                return TrialOutcome.rejected(result.message() != null ? result.message() : "Extension refused");
            }
            TrialRecord extended = current.extendedBy(result.value());
            store.save(handle, extended);
            LOG.info(() -> handle + ": trial extended by " + result.value() + " days");
            return TrialOutcome.of(extended);
        } finally {
            lock.unlock();
        }
    }

    private TrialOutcome start(TrialFlags flags) {
        Instant localNow = clock.instant();
        Instant trustedNow = localNow;
        if (flags.isVerified()) {
            ChannelResult<Instant> time = channel.trustedTime(handle);
            if (time.isNetworkError()) {
                LOG.warning(handle + ": cannot start a verified trial offline: " + time.message());
                return TrialOutcome.networkError(time.message());
            }
            if (time.isRejected() || time.value() == null) {
                LOG.warning(handle + ": trial refused by " + channel.getChannelName() + ": " + time.message());
                return TrialOutcome.rejected(time.message() != null ? time.message() : "Trial refused");
            }
            trustedNow = time.value();
        }

        TrialRecord record = TrialRecord.start(flags, handle.versionId(), localNow, trustedNow, config.trialDays());
        store.save(handle, record);
        LOG.info(() -> handle + ": " + flags + " trial started, " + record.durationDays() + " days");
        return TrialOutcome.of(record);
    }

    private boolean mayRestart(TrialRecord record) {
        return config.trialRestart() == ProductConfig.TrialRestart.NEW_VERSION
            && !record.fraud()
            && !handle.versionId().equals(record.versionId());
    }

    private static void requireFlags(TrialRecord record, TrialFlags flags) {
        if (!record.flags().equals(flags)) {
            throw LicenseException.trialFlagsMismatch(record.flags(), flags);
        }
    }

    private TrialRecord evaluateAndSave(TrialRecord record) {
        TrialRecord evaluated = evaluate(record);
        if (!evaluated.equals(record)) {
            store.save(handle, evaluated);
            if (evaluated.fraud() && !record.fraud()) {
                LOG.warning(handle + ": clock moved back to before " + record.highWaterMark()
                    + ", trial ended");
            } else if (evaluated.expired() && !record.expired()) {
                LOG.info(() -> handle + ": trial expired");
            }
        }
        return evaluated;
    }

    private TrialRecord evaluate(TrialRecord record) {
        if (record.expired()) {
            return record;
        }
        Instant localNow = clock.instant();

        if (record.flags().isVerified()) {
            Instant effectiveNow = localNow.plusMillis(record.clockOffsetMillis());
            if (effectiveNow.isBefore(record.trustedStart().minus(skewTolerance))
                || effectiveNow.isBefore(record.highWaterMark().minus(skewTolerance))) {
                return record.fraudulent();
            }
            Instant highWater = effectiveNow.isAfter(record.highWaterMark()) ? effectiveNow : record.highWaterMark();
            return record.evaluated(highWater, remaining(record, Duration.between(record.trustedStart(), highWater)));
        }

        Duration elapsed = Duration.between(record.startedAt(), localNow);
        if (elapsed.isNegative()) {
            elapsed = Duration.ZERO;
        }
        Instant highWater = localNow.isAfter(record.highWaterMark()) ? localNow : record.highWaterMark();
        return record.evaluated(highWater, remaining(record, elapsed));
    }

    private static int remaining(TrialRecord record, Duration elapsed) {
        long left = record.durationDays() - Math.max(0, elapsed.toDays());
        return (int) Math.max(0, left);
    }
}
