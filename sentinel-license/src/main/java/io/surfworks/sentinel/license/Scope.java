package io.surfworks.sentinel.license;

/**
 * Whether a license or trial is bound to one user account or to the whole machine.
 */
public enum Scope {
    USER,
    SYSTEM
}
