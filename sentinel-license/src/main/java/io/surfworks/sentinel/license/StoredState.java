package io.surfworks.sentinel.license;

/**
 * Everything persisted for one handle. Either record may be null.
 *
 * @param activation activation record, or null if never saved
 * @param trial trial record, or null if no trial was started
 */
public record StoredState(ActivationRecord activation, TrialRecord trial) {

    public static StoredState empty() {
        return new StoredState(null, null);
    }
}
