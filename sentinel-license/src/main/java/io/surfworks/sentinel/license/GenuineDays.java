package io.surfworks.sentinel.license;

/**
 * Days left before the next mandatory online check.
 *
 * @param daysRemaining days until the check is due, or until the grace period
 *                      ends when already in it. One day means at most one day.
 * @param inGracePeriod whether the regular check window has already passed
 */
public record GenuineDays(int daysRemaining, boolean inGracePeriod) {
}
