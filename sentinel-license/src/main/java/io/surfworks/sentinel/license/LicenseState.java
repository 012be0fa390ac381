package io.surfworks.sentinel.license;

/**
 * Entitlement state of a {@link LicenseSession}. Every state can be re-entered.
 */
public enum LicenseState {
    /** Nothing activated and no trial started. */
    UNCONFIGURED,

    /** Activated and, as far as the last check knows, genuine. */
    ACTIVATED,

    /** Not activated, running on a trial with days left. */
    TRIAL_ACTIVE,

    /** Not activated, trial used up (or ended by fraud). */
    TRIAL_EXPIRED,

    /** Activation revoked, or offline grace exhausted; a live check or new key is needed. */
    NOT_GENUINE_BLOCKED
}
