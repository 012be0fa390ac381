package io.surfworks.sentinel.license;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * Licensing for one product version, the entry point of the engine.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LicenseSession license = LicenseSession.acquireFromEnvironment(Path.of("product.json"))) {
 *     VerificationOutcome genuine = license.verify(GenuineOptions.defaults());
 *     if (!genuine.isGenuine()) {
 *         TrialFlags flags = TrialFlags.verified(Scope.USER);
 *         TrialOutcome trial = license.startOrContinueTrial(flags);
 *         if (trial.isActive()) {
 *             license.registerTrialCallback(event -> disableFeatures());
 *         }
 *     }
 * }
 * }</pre>
 *
 * <p>Several sessions can be open in one process, each with its own handle.
 * Sessions for the same product share its stored records and the store's lock
 * for them, so their updates never interleave. Every method is safe to call
 * from any thread. After {@link #close()}
 * every operation throws {@link LicenseException} with {@code SESSION_CLOSED}.
 */
public class LicenseSession implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseSession.class.getName());

    private final LicenseHandle handle;
    private final ProductConfig config;
    private final VerificationChannel channel;
    private final LocalStateStore store;
    private final Clock clock;
    private final Lock lock;
    private final GenuineVerifier verifier;
    private final TrialTracker tracker;
    private final TrialNotifier notifier;

    private volatile LicenseState state;
    private volatile boolean closed;

    private LicenseSession(ProductConfig config, VerificationChannel channel, LocalStateStore store,
                           EngineSettings settings, Clock clock, Executor callbackExecutor) {
        this.handle = LicenseHandle.next(config);
        this.config = config;
        this.channel = channel;
        this.store = store;
        this.clock = clock;
        this.lock = store.lockFor(handle);
        this.verifier = new GenuineVerifier(handle, channel, store, clock, settings, lock);
        this.tracker = new TrialTracker(handle, config, channel, store, clock, settings, lock);
        this.notifier = new TrialNotifier(handle, tracker::poll, settings.trialPollInterval(),
            callbackExecutor, this::onTrialFired);
        this.state = initialState(store.load(handle));
    }

    /**
     * Acquire a session with default settings and the system clock.
     *
     * @throws LicenseException with {@code INVALID_CONFIG} if the product configuration is unusable
     */
    public static LicenseSession acquire(ProductConfig config, VerificationChannel channel, LocalStateStore store) {
        return acquire(config, channel, store, EngineSettings.defaults(), Clock.systemUTC(), null);
    }

    /**
     * Acquire a session.
     *
     * @param callbackExecutor where trial callbacks run; null for a dedicated thread
     * @throws LicenseException with {@code INVALID_CONFIG} if the product configuration is unusable,
     *         or {@code STORE_FAILURE} if the stored state cannot be read
     */
    public static LicenseSession acquire(ProductConfig config, VerificationChannel channel, LocalStateStore store,
                                         EngineSettings settings, Clock clock, Executor callbackExecutor) {
        if (config == null) {
            throw LicenseException.invalidConfig("no product configuration");
        }
        config.validate();
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clock, "clock");

        LicenseSession session = new LicenseSession(config, channel, store, settings, clock, callbackExecutor);
        LOG.info(() -> session.handle + ": acquired via " + channel.getChannelName() + ", state " + session.state);
        return session;
    }

    /**
     * Acquire a session for the product details file, with the HTTP channel,
     * file store and settings taken from the environment.
     */
    public static LicenseSession acquireFromEnvironment(Path productDetails) {
        return acquire(ProductConfig.load(productDetails), HttpVerificationChannel.fromEnvironment(),
            FileStateStore.fromEnvironment(), EngineSettings.fromEnvironment(), Clock.systemUTC(), null);
    }

    public LicenseHandle handle() {
        return handle;
    }

    public ProductConfig config() {
        return config;
    }

    public LicenseState state() {
        return state;
    }

    // ===== Genuine verification =====

    /**
     * Check the activation is genuine, contacting the licensing service only
     * when a check is due.
     */
    public VerificationOutcome verify(GenuineOptions options) {
        ensureOpen();
        lock.lock();
        try {
            return applyVerification(verifier.verify(options));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check the activation against the licensing service now.
     */
    public VerificationOutcome verifyNow(GenuineOptions options) {
        ensureOpen();
        lock.lock();
        try {
            return applyVerification(verifier.verifyNow(options));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether this installation holds an activation, without contacting the service.
     */
    public boolean isActivated() {
        ensureOpen();
        ActivationRecord record = loadActivation();
        return record != null && record.activated();
    }

    /**
     * Days until the next mandatory verification, or until the grace period ends.
     */
    public GenuineDays genuineDays(GenuineOptions options) {
        ensureOpen();
        return verifier.genuineDays(options);
    }

    /**
     * Value of an entitlement feature reported by the last successful exchange.
     */
    public Optional<String> featureValue(String name) {
        ensureOpen();
        Objects.requireNonNull(name, "name");
        ActivationRecord record = loadActivation();
        if (record == null || !record.activated()) {
            return Optional.empty();
        }
        return Optional.ofNullable(record.features().get(name));
    }

    // ===== Product keys and activation =====

    /**
     * Validate and store a product key for the next {@link #activate()}.
     *
     * <p>While an activation is live the key is held aside, so a failed
     * re-activation keeps the existing one.
     */
    public KeySaveResult saveProductKey(String productKey, Scope scope) {
        ensureOpen();
        Objects.requireNonNull(scope, "scope");
        if (!config.acceptsKey(productKey)) {
            return KeySaveResult.rejected(RejectionReason.INVALID_KEY, "Product key format is invalid");
        }
        String key = productKey.trim();
        lock.lock();
        try {
            ActivationRecord existing = store.load(handle).activation();
            ActivationRecord updated = existing == null
                ? ActivationRecord.keyOnly(key, scope)
                : existing.withSavedKey(key, scope);
            store.save(handle, updated);
            LOG.fine(() -> handle + ": product key " + updated.maskedKey() + " saved");
            return KeySaveResult.ok();
        } catch (LicenseException e) {
            LOG.warning(handle + ": " + e.getMessage());
            return KeySaveResult.rejected(RejectionReason.STORE_FAILURE, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activate the saved product key with the licensing service.
     */
    public ActivationOutcome activate() {
        ensureOpen();
        lock.lock();
        try {
            ActivationRecord record = store.load(handle).activation();
            if (record == null || record.keyToActivate() == null) {
                return ActivationOutcome.rejected(RejectionReason.NO_PRODUCT_KEY, "No product key has been saved");
            }

            ChannelResult<Entitlements> result = channel.activate(handle, record.keyToActivate(),
                record.scopeToActivate());
            if (result.isNetworkError()) {
                LOG.warning(handle + ": activation failed: " + result.message());
                return ActivationOutcome.networkError(result.message());
            }
            if (result.isRejected()) {
                LOG.warning(handle + ": activation rejected (" + result.reason() + "): " + result.message());
                return ActivationOutcome.rejected(result.reason(), result.message());
            }

            Map<String, String> features = result.value() != null ? result.value().features() : Map.of();
            ActivationRecord activated = record.activatedAt(clock.instant(), features);
            store.save(handle, activated);
            LOG.info(() -> handle + ": activated with " + activated.maskedKey());
            transition(LicenseState.ACTIVATED);
            return ActivationOutcome.ok();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release this installation's activation.
     *
     * @param eraseKey also forget the saved product key
     */
    public ActivationOutcome deactivate(boolean eraseKey) {
        ensureOpen();
        lock.lock();
        try {
            ActivationRecord record = store.load(handle).activation();
            if (record == null) {
                return ActivationOutcome.rejected(RejectionReason.NO_PRODUCT_KEY, "No product key has been saved");
            }

            if (record.activated()) {
                ChannelResult<Void> result = channel.deactivate(handle, record.productKey());
                if (result.isNetworkError()) {
                    LOG.warning(handle + ": deactivation failed: " + result.message());
                    return ActivationOutcome.networkError(result.message());
                }
                if (result.isRejected()) {
                    LOG.warning(handle + ": deactivation rejected (" + result.reason() + "): " + result.message());
                    return ActivationOutcome.rejected(result.reason(), result.message());
                }
            }

            if (eraseKey) {
                store.deleteActivation(handle);
            } else {
                store.save(handle, ActivationRecord.keyOnly(record.productKey(), record.scope()));
            }
            LOG.info(() -> handle + ": deactivated" + (eraseKey ? ", product key erased" : ""));
            transition(trialState(store.load(handle).trial()));
            return ActivationOutcome.ok();
        } finally {
            lock.unlock();
        }
    }

    /**
     * The saved product key with all but its first and last four characters hidden.
     */
    public Optional<String> maskedProductKey() {
        ensureOpen();
        ActivationRecord record = loadActivation();
        if (record == null || record.keyToActivate() == null) {
            return Optional.empty();
        }
        return Optional.of(record.maskedKey());
    }

    // ===== Trial =====

    /**
     * Start the trial, or re-validate the running one. Never extends it.
     *
     * @throws LicenseException with {@code INVALID_TRIAL_FLAGS} if the trial was started with other flags
     */
    public TrialOutcome startOrContinueTrial(TrialFlags flags) {
        ensureOpen();
        lock.lock();
        try {
            TrialOutcome outcome = tracker.startOrContinue(flags);
            applyTrial(outcome);
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Days left in the trial, 0 if none was started.
     *
     * @throws LicenseException with {@code INVALID_TRIAL_FLAGS} if the trial was started with other flags
     */
    public int daysRemaining(TrialFlags flags) {
        ensureOpen();
        lock.lock();
        try {
            int days = tracker.daysRemaining(flags);
            if (days == 0 && state == LicenseState.TRIAL_ACTIVE) {
                transition(LicenseState.TRIAL_EXPIRED);
            }
            return days;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Redeem a trial extension code. Expired trials cannot be extended.
     */
    public TrialOutcome extendTrial(String extensionCode, TrialFlags flags) {
        ensureOpen();
        lock.lock();
        try {
            TrialOutcome outcome = tracker.extend(extensionCode, flags);
            applyTrial(outcome);
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Be told, once, when the trial expires. Replaces any earlier callback,
     * which will then never be invoked.
     */
    public RegistrationResult registerTrialCallback(TrialCallback callback) {
        ensureOpen();
        return notifier.register(callback);
    }

    /**
     * Stop background polling. Callbacks not yet delivered are dropped.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        notifier.close();
        LOG.fine(() -> handle + ": closed");
    }

    // ===== Internals =====

    TrialNotifier notifier() {
        return notifier;
    }

    // Callers hold the lock, so the outcome and the transition it causes are one step
    private VerificationOutcome applyVerification(VerificationOutcome outcome) {
        if (outcome.isGenuine()) {
            transition(LicenseState.ACTIVATED);
        } else if (outcome.status() == VerificationOutcome.Status.REVOKED) {
            transition(LicenseState.NOT_GENUINE_BLOCKED);
        } else if (outcome.status() == VerificationOutcome.Status.NOT_GENUINE && state == LicenseState.ACTIVATED) {
            transition(LicenseState.NOT_GENUINE_BLOCKED);
        }
        return outcome;
    }

    private void applyTrial(TrialOutcome outcome) {
        LicenseState current = state;
        if (current == LicenseState.ACTIVATED) {
            return;
        }
        if (outcome.isActive()) {
            transition(LicenseState.TRIAL_ACTIVE);
        } else if (outcome.status() == TrialOutcome.Status.EXPIRED
            || outcome.status() == TrialOutcome.Status.EXPIRED_FRAUD) {
            if (current == LicenseState.TRIAL_ACTIVE || current == LicenseState.UNCONFIGURED) {
                transition(LicenseState.TRIAL_EXPIRED);
            }
        }
    }

    private void onTrialFired(TrialEvent event) {
        lock.lock();
        try {
            if (state == LicenseState.TRIAL_ACTIVE && event.status() != TrialEvent.Status.UNEXPECTED) {
                transition(LicenseState.TRIAL_EXPIRED);
            }
        } finally {
            lock.unlock();
        }
    }

    private synchronized void transition(LicenseState next) {
        LicenseState previous = state;
        if (previous != next) {
            state = next;
            LOG.info(() -> handle + ": " + previous + " -> " + next);
        }
    }

    private ActivationRecord loadActivation() {
        lock.lock();
        try {
            return store.load(handle).activation();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw LicenseException.sessionClosed();
        }
    }

    private static LicenseState initialState(StoredState stored) {
        ActivationRecord activation = stored.activation();
        if (activation != null && activation.activated()) {
            return LicenseState.ACTIVATED;
        }
        TrialRecord trial = stored.trial();
        if (trial != null && trial.isActive()) {
            return LicenseState.TRIAL_ACTIVE;
        }
        if (activation != null && activation.wasRevoked()) {
            return LicenseState.NOT_GENUINE_BLOCKED;
        }
        return trialState(trial);
    }

    private static LicenseState trialState(TrialRecord trial) {
        if (trial == null) {
            return LicenseState.UNCONFIGURED;
        }
        return trial.isActive() ? LicenseState.TRIAL_ACTIVE : LicenseState.TRIAL_EXPIRED;
    }
}
