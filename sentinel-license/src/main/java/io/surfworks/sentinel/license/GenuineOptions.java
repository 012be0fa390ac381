package io.surfworks.sentinel.license;

/**
 * Options for one genuine verification call.
 *
 * @param daysBetweenChecks how long a successful check is trusted before the
 *                          channel is contacted again
 * @param graceDaysOnNetworkError extra days the installation stays genuine when
 *                                the channel cannot be reached
 * @param skipOfflineShowError suppress the warning flag on offline outcomes
 */
public record GenuineOptions(
    int daysBetweenChecks,
    int graceDaysOnNetworkError,
    boolean skipOfflineShowError
) {

    public static final int DEFAULT_DAYS_BETWEEN_CHECKS = 90;
    public static final int DEFAULT_GRACE_DAYS = 14;

    public GenuineOptions {
        if (daysBetweenChecks < 0) {
            throw new IllegalArgumentException("daysBetweenChecks must be >= 0: " + daysBetweenChecks);
        }
        if (graceDaysOnNetworkError < 0) {
            throw new IllegalArgumentException("graceDaysOnNetworkError must be >= 0: " + graceDaysOnNetworkError);
        }
    }

    /**
     * 90 days between checks, 14 grace days, warnings shown.
     */
    public static GenuineOptions defaults() {
        return new GenuineOptions(DEFAULT_DAYS_BETWEEN_CHECKS, DEFAULT_GRACE_DAYS, false);
    }

    public static GenuineOptions of(int daysBetweenChecks, int graceDaysOnNetworkError) {
        return new GenuineOptions(daysBetweenChecks, graceDaysOnNetworkError, false);
    }

    /**
     * Total number of days a verification stays usable without a live check.
     */
    public long offlineToleranceDays() {
        return (long) daysBetweenChecks + graceDaysOnNetworkError;
    }
}
