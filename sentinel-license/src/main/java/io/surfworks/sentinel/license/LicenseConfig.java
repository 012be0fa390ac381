package io.surfworks.sentinel.license;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.logging.Logger;

/**
 * Environment-driven configuration for the license engine.
 *
 * <p>Every value has a default; the environment only overrides it.
 */
public final class LicenseConfig {

    private static final Logger LOG = Logger.getLogger(LicenseConfig.class.getName());

    /**
     * Environment variable overriding the state directory.
     */
    public static final String ENV_CONFIG_DIR = "SENTINEL_CONFIG_DIR";

    /**
     * Environment variable for the licensing service base URL.
     */
    public static final String ENV_SERVER_URL = "SENTINEL_SERVER_URL";

    /**
     * Environment variable for the trial poll interval, in seconds.
     */
    public static final String ENV_TRIAL_POLL_SECONDS = "SENTINEL_TRIAL_POLL_SECONDS";

    /**
     * Environment variable for the offline retry delay, in hours.
     */
    public static final String ENV_OFFLINE_RETRY_HOURS = "SENTINEL_OFFLINE_RETRY_HOURS";

    /**
     * Environment variable for the tolerated backwards clock skew, in minutes.
     */
    public static final String ENV_CLOCK_SKEW_MINUTES = "SENTINEL_CLOCK_SKEW_MINUTES";

    /**
     * Default state directory.
     */
    public static final Path DEFAULT_CONFIG_DIR = Path.of(
        System.getProperty("user.home"), ".config", "sentinel"
    );

    /**
     * Default licensing service.
     */
    public static final String DEFAULT_SERVER_URL = "https://license.surfworks.energy";

    private LicenseConfig() {}

    /**
     * Get the state directory.
     */
    public static Path getConfigDir() {
        String explicit = System.getenv(ENV_CONFIG_DIR);
        if (explicit != null && !explicit.isBlank()) {
            return Path.of(explicit);
        }
        String configHome = System.getenv("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "sentinel");
        }
        return DEFAULT_CONFIG_DIR;
    }

    /**
     * Get the licensing service base URL.
     */
    public static String getServerUrl() {
        String url = System.getenv(ENV_SERVER_URL);
        return url != null && !url.isBlank() ? url.trim() : DEFAULT_SERVER_URL;
    }

    public static Duration getTrialPollInterval() {
        Duration interval = parseDuration(ENV_TRIAL_POLL_SECONDS, System.getenv(ENV_TRIAL_POLL_SECONDS),
            ChronoUnit.SECONDS, EngineSettings.DEFAULT_TRIAL_POLL_INTERVAL);
        return interval.isZero() ? EngineSettings.DEFAULT_TRIAL_POLL_INTERVAL : interval;
    }

    public static Duration getOfflineRetryDelay() {
        return parseDuration(ENV_OFFLINE_RETRY_HOURS, System.getenv(ENV_OFFLINE_RETRY_HOURS),
            ChronoUnit.HOURS, EngineSettings.DEFAULT_OFFLINE_RETRY_DELAY);
    }

    public static Duration getClockSkewTolerance() {
        return parseDuration(ENV_CLOCK_SKEW_MINUTES, System.getenv(ENV_CLOCK_SKEW_MINUTES),
            ChronoUnit.MINUTES, EngineSettings.DEFAULT_CLOCK_SKEW_TOLERANCE);
    }

    static Duration parseDuration(String name, String value, ChronoUnit unit, Duration fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            long amount = Long.parseLong(value.trim());
            if (amount < 0) {
                LOG.warning(name + " must not be negative, using default " + fallback);
                return fallback;
            }
            return Duration.of(amount, unit);
        } catch (NumberFormatException e) {
            LOG.warning(name + "='" + value + "' is not a number, using default " + fallback);
            return fallback;
        }
    }
}
