package io.surfworks.sentinel.license;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Non-persistent store keyed by product.
 *
 * <p>Handy for embedding and tests. Two sessions for the same product share
 * records, like two processes sharing the same state directory would.
 */
public class InMemoryStateStore implements LocalStateStore {

    private final Map<String, ActivationRecord> activations = new ConcurrentHashMap<>();
    private final Map<String, TrialRecord> trials = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    @Override
    public StoredState load(LicenseHandle handle) {
        return new StoredState(activations.get(handle.productId()), trials.get(handle.productId()));
    }

    @Override
    public void save(LicenseHandle handle, ActivationRecord record) {
        activations.put(handle.productId(), record);
    }

    @Override
    public void save(LicenseHandle handle, TrialRecord record) {
        trials.put(handle.productId(), record);
    }

    @Override
    public void deleteActivation(LicenseHandle handle) {
        activations.remove(handle.productId());
    }

    @Override
    public Lock lockFor(LicenseHandle handle) {
        return locks.computeIfAbsent(handle.productId(), id -> new ReentrantLock());
    }
}
