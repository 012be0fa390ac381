package io.surfworks.sentinel.license;

/**
 * Host callback for trial expiry.
 *
 * <p>Invoked at most once per registration, on the executor the session was
 * built with and never on the caller's thread. It may run concurrently with
 * any other operation on the same session, so implementations must do their
 * own synchronization (and UI toolkits their own thread hand-off).
 */
@FunctionalInterface
public interface TrialCallback {

    void onTrialEvent(TrialEvent event);
}
