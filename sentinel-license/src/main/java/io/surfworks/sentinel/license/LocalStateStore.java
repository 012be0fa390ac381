package io.surfworks.sentinel.license;

import java.util.concurrent.locks.Lock;

/**
 * Durable storage for a handle's activation and trial records.
 *
 * <p>Implementations must make a record durable before {@code save} returns:
 * a crash afterwards must not lose the update. Tamper evidence is the
 * implementation's concern; the engine only requires that corrupt state is
 * reported as a {@link LicenseException} rather than as missing state.
 *
 * <p>Records are owned by the handle's product, and handles for several
 * versions of one product share them. Callers hold {@link #lockFor} around every
 * read-modify-write cycle, so load and save themselves need no atomicity
 * beyond a single record.
 */
public interface LocalStateStore {

    /**
     * Load both records for a handle.
     *
     * @return stored state; either record may be null
     * @throws LicenseException with {@code STORE_FAILURE} if state exists but cannot be read
     */
    StoredState load(LicenseHandle handle);

    /**
     * Replace the activation record.
     *
     * @throws LicenseException with {@code STORE_FAILURE} if the write did not become durable
     */
    void save(LicenseHandle handle, ActivationRecord record);

    /**
     * Replace the trial record.
     *
     * @throws LicenseException with {@code STORE_FAILURE} if the write did not become durable
     */
    void save(LicenseHandle handle, TrialRecord record);

    /**
     * Remove the activation record, keeping any trial record.
     */
    void deleteActivation(LicenseHandle handle);

    /**
     * The lock guarding the handle's records. Every handle whose records are
     * the same gets the same lock, so it must be reentrant.
     */
    Lock lockFor(LicenseHandle handle);
}
