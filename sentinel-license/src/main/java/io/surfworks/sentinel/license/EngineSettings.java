package io.surfworks.sentinel.license;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of the license engine.
 *
 * @param trialPollInterval how often the trial notifier re-evaluates the trial
 * @param offlineRetryDelay after a connectivity failure, how long {@code verify}
 *                          keeps answering offline-genuine without retrying
 * @param clockSkewTolerance how far the clock may move backwards before a
 *                           verified trial is treated as tampered with
 */
public record EngineSettings(
    Duration trialPollInterval,
    Duration offlineRetryDelay,
    Duration clockSkewTolerance
) {

    public static final Duration DEFAULT_TRIAL_POLL_INTERVAL = Duration.ofMinutes(1);
    public static final Duration DEFAULT_OFFLINE_RETRY_DELAY = Duration.ofHours(5);
    public static final Duration DEFAULT_CLOCK_SKEW_TOLERANCE = Duration.ofHours(1);

    public EngineSettings {
        Objects.requireNonNull(trialPollInterval, "trialPollInterval");
        Objects.requireNonNull(offlineRetryDelay, "offlineRetryDelay");
        Objects.requireNonNull(clockSkewTolerance, "clockSkewTolerance");
        if (trialPollInterval.isZero() || trialPollInterval.isNegative()) {
            throw new IllegalArgumentException("trialPollInterval must be positive: " + trialPollInterval);
        }
        if (offlineRetryDelay.isNegative() || clockSkewTolerance.isNegative()) {
            throw new IllegalArgumentException("durations must not be negative");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_TRIAL_POLL_INTERVAL, DEFAULT_OFFLINE_RETRY_DELAY,
            DEFAULT_CLOCK_SKEW_TOLERANCE);
    }

    /**
     * Defaults overridden by the environment, see {@link LicenseConfig}.
     */
    public static EngineSettings fromEnvironment() {
        return new EngineSettings(
            LicenseConfig.getTrialPollInterval(),
            LicenseConfig.getOfflineRetryDelay(),
            LicenseConfig.getClockSkewTolerance()
        );
    }

    public EngineSettings withTrialPollInterval(Duration interval) {
        return new EngineSettings(interval, offlineRetryDelay, clockSkewTolerance);
    }
}
