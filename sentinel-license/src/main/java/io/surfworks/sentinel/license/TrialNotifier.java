package io.surfworks.sentinel.license;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Watches the trial in the background and tells the host once it is over.
 *
 * <p>At most one registration is live. Each goes {@code ARMED -> FIRED} or
 * {@code ARMED -> CANCELLED} exactly once; a replaced or closed registration
 * never reaches its callback. Callbacks run on the callback executor, never
 * on the polling thread.
 */
final class TrialNotifier implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(TrialNotifier.class.getName());

    /**
     * Consecutive polling failures after which the trial is reported as undeterminable.
     */
    static final int MAX_POLL_FAILURES = 3;

    enum State {
        ARMED,
        FIRED,
        CANCELLED
    }

    private final LicenseHandle handle;
    private final Supplier<TrialRecord> poller;
    private final Duration interval;
    private final Executor callbackExecutor;
    private final ExecutorService ownedCallbackExecutor;
    private final Consumer<TrialEvent> onFire;
    private final AtomicReference<Registration> current = new AtomicReference<>();

    private ScheduledExecutorService scheduler;
    private volatile boolean closed;

    /**
     * @param poller re-evaluates the stored trial, returning null when there is none
     * @param callbackExecutor where callbacks run, or null for a dedicated thread
     * @param onFire invoked on the polling thread when a registration fires, before the handoff
     */
    TrialNotifier(LicenseHandle handle, Supplier<TrialRecord> poller, Duration interval,
                  Executor callbackExecutor, Consumer<TrialEvent> onFire) {
        this.handle = handle;
        this.poller = poller;
        this.interval = interval;
        this.onFire = onFire;
        if (callbackExecutor != null) {
            this.callbackExecutor = callbackExecutor;
            this.ownedCallbackExecutor = null;
        } else {
            this.ownedCallbackExecutor = Executors.newSingleThreadExecutor(daemon("license-callback-" + handle.id()));
            this.callbackExecutor = ownedCallbackExecutor;
        }
    }

    /**
     * Register the callback, replacing any earlier one.
     *
     * @throws LicenseException with {@code SESSION_CLOSED} after {@link #close()},
     *         or {@code STORE_FAILURE} if the trial cannot be read
     */
    synchronized RegistrationResult register(TrialCallback callback) {
        Objects.requireNonNull(callback, "callback");
        if (closed) {
            throw LicenseException.sessionClosed();
        }
        TrialRecord trial = poller.get();
        if (trial == null) {
            return RegistrationResult.NO_TRIAL;
        }
        if (!trial.isActive()) {
            return RegistrationResult.ALREADY_FIRED;
        }

        Registration registration = new Registration(callback);
        Registration previous = current.getAndSet(registration);
        if (previous != null) {
            previous.cancel();
            LOG.fine(() -> handle + ": trial callback replaced");
        }
        long millis = interval.toMillis();
        registration.future = scheduler().scheduleWithFixedDelay(
            () -> poll(registration), millis, millis, TimeUnit.MILLISECONDS);
        return RegistrationResult.OK;
    }

    /**
     * Poll the live registration now.
     */
    void pollOnce() {
        Registration registration = current.get();
        if (registration != null) {
            poll(registration);
        }
    }

    State state() {
        Registration registration = current.get();
        return registration == null ? null : registration.state.get();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        Registration registration = current.getAndSet(null);
        if (registration != null) {
            registration.cancel();
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (ownedCallbackExecutor != null) {
            ownedCallbackExecutor.shutdownNow();
        }
    }

    private ScheduledExecutorService scheduler() {
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(daemon("license-trial-" + handle.id()));
        }
        return scheduler;
    }

    private void poll(Registration registration) {
        if (closed || registration.state.get() != State.ARMED) {
            return;
        }
        TrialRecord trial;
        try {
            trial = poller.get();
        } catch (RuntimeException e) {
            // Keep the scheduler alive; repeated failures are reported through the callback
            int failures = registration.failures.incrementAndGet();
            LOG.log(Level.WARNING, handle + ": trial poll failed (" + failures + "/" + MAX_POLL_FAILURES + ")", e);
            if (failures >= MAX_POLL_FAILURES) {
                LicenseException.ErrorCode code = e instanceof LicenseException
                    ? ((LicenseException) e).errorCode()
                    : LicenseException.ErrorCode.UNKNOWN;
                fire(registration, TrialEvent.unexpected(code));
            }
            return;
        }
        registration.failures.set(0);

        if (trial == null) {
            LOG.warning(handle + ": trial state disappeared while a callback was registered");
            fire(registration, TrialEvent.unexpected(LicenseException.ErrorCode.STORE_FAILURE));
        } else if (trial.fraud()) {
            fire(registration, TrialEvent.expiredFraud());
        } else if (!trial.isActive()) {
            fire(registration, TrialEvent.expired());
        } else {
            int days = trial.daysRemaining();
            LOG.fine(() -> handle + ": trial has " + days + " days left");
        }
    }

    private void fire(Registration registration, TrialEvent event) {
        if (!registration.state.compareAndSet(State.ARMED, State.FIRED)) {
            return;
        }
        ScheduledFuture<?> future = registration.future;
        if (future != null) {
            future.cancel(false);
        }
        LOG.info(() -> handle + ": trial event " + event.status());
        onFire.accept(event);
        try {
            callbackExecutor.execute(() -> deliver(registration, event));
        } catch (RejectedExecutionException e) {
            LOG.log(Level.WARNING, handle + ": callback executor refused trial event " + event.status(), e);
        }
    }

    private void deliver(Registration registration, TrialEvent event) {
        if (closed || current.get() != registration) {
            LOG.fine(() -> handle + ": dropping trial event for a stale registration");
            return;
        }
        try {
            registration.callback.onTrialEvent(event);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, handle + ": trial callback threw", e);
        }
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Registration {
        final TrialCallback callback;
        final AtomicReference<State> state = new AtomicReference<>(State.ARMED);
        volatile ScheduledFuture<?> future;
        final AtomicInteger failures = new AtomicInteger();

        Registration(TrialCallback callback) {
            this.callback = callback;
        }

        void cancel() {
            if (state.compareAndSet(State.ARMED, State.CANCELLED)) {
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
            }
        }
    }
}
