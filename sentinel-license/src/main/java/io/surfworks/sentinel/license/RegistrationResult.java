package io.surfworks.sentinel.license;

/**
 * Result of registering a {@link TrialCallback}.
 */
public enum RegistrationResult {
    /** Callback armed; it fires when the trial expires. */
    OK,

    /** The trial has already expired, nothing was armed. */
    ALREADY_FIRED,

    /** No trial has been started for this handle. */
    NO_TRIAL
}
