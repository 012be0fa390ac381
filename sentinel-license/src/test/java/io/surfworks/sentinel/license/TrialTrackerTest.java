package io.surfworks.sentinel.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TrialTracker}.
 */
class TrialTrackerTest {

    private static final TrialFlags VERIFIED = TrialFlags.verified(Scope.USER);
    private static final TrialFlags UNVERIFIED = TrialFlags.unverified(Scope.SYSTEM);

    private MutableClock clock;
    private ScriptedChannel channel;
    private InMemoryStateStore store;
    private ProductConfig config;
    private TrialTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T09:00:00Z");
        channel = new ScriptedChannel(clock);
        store = new InMemoryStateStore();
        config = ProductConfig.of("acme-editor-3", 10);
        tracker = trackerFor(config);
    }

    private TrialTracker trackerFor(ProductConfig productConfig) {
        return new TrialTracker(LicenseHandle.next(productConfig), productConfig, channel, store, clock,
            EngineSettings.defaults(), new ReentrantLock());
    }

    private static Duration days(long days) {
        return Duration.ofDays(days);
    }

    @Test
    @DisplayName("a 10-day verified trial counts down to expiry")
    void startOrContinue_tenDayTrial_expires() {
        var started = tracker.startOrContinue(VERIFIED);
        assertEquals(TrialOutcome.Status.ACTIVE, started.status());
        assertEquals(10, started.daysRemaining());

        clock.advance(days(3));
        assertEquals(7, tracker.daysRemaining(VERIFIED));

        clock.advance(days(7));
        assertEquals(0, tracker.daysRemaining(VERIFIED));
        assertEquals(TrialOutcome.Status.EXPIRED, tracker.startOrContinue(VERIFIED).status());
        assertTrue(tracker.poll().expired());
    }

    @Test
    @DisplayName("starting a running trial again re-validates without extending it")
    void startOrContinue_repeated_isIdempotent() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(Duration.ofHours(30));

        var again = tracker.startOrContinue(VERIFIED);
        var onceMore = tracker.startOrContinue(VERIFIED);

        assertEquals(9, again.daysRemaining());
        assertEquals(again, onceMore);
        assertEquals(1, channel.timeRequests.get());
        assertEquals(10, tracker.poll().durationDays());
    }

    @Test
    @DisplayName("day counts never go up")
    void daysRemaining_isMonotonic() {
        tracker.startOrContinue(UNVERIFIED);
        int previous = tracker.daysRemaining(UNVERIFIED);
        for (int i = 0; i < 12; i++) {
            clock.advance(Duration.ofHours(i % 2 == 0 ? 20 : -10));
            int current = tracker.daysRemaining(UNVERIFIED);
            assertTrue(current <= previous, "went from " + previous + " to " + current);
            previous = current;
        }
    }

    @Test
    @DisplayName("rolling the clock back on a verified trial ends it as fraud")
    void verifiedTrial_clockRollback_isFraud() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(days(2));
        assertEquals(8, tracker.daysRemaining(VERIFIED));

        clock.rewind(days(3));
        var outcome = tracker.startOrContinue(VERIFIED);

        assertEquals(TrialOutcome.Status.EXPIRED_FRAUD, outcome.status());
        assertEquals(0, outcome.daysRemaining());
        var record = tracker.poll();
        assertTrue(record.fraud());
        assertTrue(record.expired());

        clock.advance(days(5));
        assertEquals(TrialOutcome.Status.EXPIRED_FRAUD, tracker.startOrContinue(VERIFIED).status());
    }

    @Test
    @DisplayName("rolling the clock back to before a verified trial began is fraud")
    void verifiedTrial_clockBeforeStart_isFraud() {
        tracker.startOrContinue(VERIFIED);

        clock.rewind(Duration.ofHours(2));

        assertEquals(0, tracker.daysRemaining(VERIFIED));
        assertTrue(tracker.poll().fraud());
    }

    @Test
    @DisplayName("small backwards clock adjustments are tolerated")
    void verifiedTrial_smallSkew_tolerated() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(days(2));
        tracker.daysRemaining(VERIFIED);

        clock.rewind(Duration.ofMinutes(30));

        var outcome = tracker.startOrContinue(VERIFIED);
        assertEquals(TrialOutcome.Status.ACTIVE, outcome.status());
        assertEquals(8, outcome.daysRemaining());
    }

    @Test
    @DisplayName("verified trials count days on the service clock")
    void verifiedTrial_usesTrustedTime() {
        var serviceClock = MutableClock.at("2026-03-05T09:00:00Z");
        channel = new ScriptedChannel(serviceClock);
        tracker = trackerFor(config);

        tracker.startOrContinue(VERIFIED);
        var record = tracker.poll();

        assertEquals(serviceClock.instant(), record.trustedStart());
        assertEquals(days(4).toMillis(), record.clockOffsetMillis());

        clock.advance(days(4));
        assertEquals(6, tracker.daysRemaining(VERIFIED));
    }

    @Test
    @DisplayName("unverified trials treat a backwards clock as no time elapsed")
    void unverifiedTrial_clockRollback_isClampedNotFraud() {
        tracker.startOrContinue(UNVERIFIED);
        clock.rewind(days(5));
        assertEquals(10, tracker.daysRemaining(UNVERIFIED));

        clock.advance(days(9));
        assertEquals(6, tracker.daysRemaining(UNVERIFIED));

        clock.rewind(days(4));
        var outcome = tracker.startOrContinue(UNVERIFIED);
        assertEquals(TrialOutcome.Status.ACTIVE, outcome.status());
        assertEquals(6, outcome.daysRemaining());
        assertFalse(tracker.poll().fraud());
    }

    @Test
    @DisplayName("an expired trial stays expired")
    void startOrContinue_afterExpiry_isOneShot() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(days(11));
        assertEquals(TrialOutcome.Status.EXPIRED, tracker.startOrContinue(VERIFIED).status());

        var restarted = tracker.startOrContinue(VERIFIED);

        assertEquals(TrialOutcome.Status.EXPIRED, restarted.status());
        assertEquals(1, channel.timeRequests.get());
    }

    @Test
    @DisplayName("NEW_VERSION grants a fresh trial to another version of the product")
    void restartPolicy_newVersion_grantsFreshTrial() {
        var v3 = new ProductConfig("acme-editor", "acme-editor-3", 10, null, ProductConfig.TrialRestart.NEW_VERSION);
        var v4 = new ProductConfig("acme-editor", "acme-editor-4", 14, null, ProductConfig.TrialRestart.NEW_VERSION);
        trackerFor(v3).startOrContinue(VERIFIED);
        clock.advance(days(10));
        assertEquals(TrialOutcome.Status.EXPIRED, trackerFor(v3).startOrContinue(VERIFIED).status());

        var fresh = trackerFor(v4).startOrContinue(VERIFIED);

        assertEquals(TrialOutcome.Status.ACTIVE, fresh.status());
        assertEquals(14, fresh.daysRemaining());
        assertEquals("acme-editor-4", trackerFor(v4).poll().versionId());
    }

    @Test
    @DisplayName("NEVER keeps trials one-shot across versions")
    void restartPolicy_never_keepsExpired() {
        var v3 = new ProductConfig("acme-editor", "acme-editor-3", 10, null, null);
        var v4 = new ProductConfig("acme-editor", "acme-editor-4", 10, null, null);
        trackerFor(v3).startOrContinue(UNVERIFIED);
        clock.advance(days(10));
        trackerFor(v3).daysRemaining(UNVERIFIED);

        assertEquals(TrialOutcome.Status.EXPIRED, trackerFor(v4).startOrContinue(UNVERIFIED).status());
    }

    @Test
    @DisplayName("fraud is never forgiven by a new version")
    void restartPolicy_fraud_notRestarted() {
        var v3 = new ProductConfig("acme-editor", "acme-editor-3", 10, null, ProductConfig.TrialRestart.NEW_VERSION);
        var v4 = new ProductConfig("acme-editor", "acme-editor-4", 10, null, ProductConfig.TrialRestart.NEW_VERSION);
        trackerFor(v3).startOrContinue(VERIFIED);
        clock.rewind(days(1));
        trackerFor(v3).daysRemaining(VERIFIED);

        assertEquals(TrialOutcome.Status.EXPIRED_FRAUD, trackerFor(v4).startOrContinue(VERIFIED).status());
    }

    @Test
    @DisplayName("a verified trial cannot start offline and nothing is stored")
    void startOrContinue_verifiedOffline_networkError() {
        channel.goOffline();

        var outcome = tracker.startOrContinue(VERIFIED);

        assertEquals(TrialOutcome.Status.NETWORK_ERROR, outcome.status());
        assertNotNull(outcome.message());
        assertNull(tracker.poll());
    }

    @Test
    @DisplayName("an unverified trial starts offline")
    void startOrContinue_unverifiedOffline_starts() {
        channel.goOffline();

        assertEquals(TrialOutcome.Status.ACTIVE, tracker.startOrContinue(UNVERIFIED).status());
        assertEquals(0, channel.timeRequests.get());
    }

    @Test
    @DisplayName("a trial refused by the service is reported as rejected")
    void startOrContinue_refused_rejected() {
        channel.timeOverride = ChannelResult.rejected(RejectionReason.FRAUD_DETECTED, "Trial not available");

        var outcome = tracker.startOrContinue(VERIFIED);

        assertEquals(TrialOutcome.Status.REJECTED, outcome.status());
        assertEquals("Trial not available", outcome.message());
        assertNull(tracker.poll());
    }

    @Test
    @DisplayName("using other flags than the trial was started with is an error")
    void flagsMismatch_throws() {
        tracker.startOrContinue(VERIFIED);

        var ex = assertThrows(LicenseException.class, () -> tracker.startOrContinue(UNVERIFIED));
        assertEquals(LicenseException.ErrorCode.INVALID_TRIAL_FLAGS, ex.errorCode());

        var scopeEx = assertThrows(LicenseException.class,
            () -> tracker.daysRemaining(TrialFlags.verified(Scope.SYSTEM)));
        assertEquals(LicenseException.ErrorCode.INVALID_TRIAL_FLAGS, scopeEx.errorCode());
    }

    @Test
    @DisplayName("daysRemaining is 0 when no trial was started")
    void daysRemaining_noTrial_zero() {
        assertEquals(0, tracker.daysRemaining(VERIFIED));
        assertNull(tracker.poll());
    }

    @Test
    @DisplayName("an extension code adds the granted days to a running trial")
    void extend_activeTrial_addsDays() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(days(4));
        channel.extendResult = ChannelResult.ok(7);

        var outcome = tracker.extend("EXT-1234", VERIFIED);

        assertEquals(TrialOutcome.Status.ACTIVE, outcome.status());
        assertEquals(13, outcome.daysRemaining());
        clock.advance(days(1));
        assertEquals(12, tracker.daysRemaining(VERIFIED));
    }

    @Test
    @DisplayName("expired trials are never extended")
    void extend_expiredTrial_notExtended() {
        tracker.startOrContinue(VERIFIED);
        clock.advance(days(10));

        var outcome = tracker.extend("EXT-1234", VERIFIED);

        assertEquals(TrialOutcome.Status.EXPIRED, outcome.status());
        assertEquals(0, channel.extensions.get());
    }

    @Test
    @DisplayName("a refused extension code leaves the trial unchanged")
    void extend_refused_rejected() {
        tracker.startOrContinue(VERIFIED);
        channel.extendResult = ChannelResult.rejected(RejectionReason.INVALID_EXTENSION, "Extension already used");

        var outcome = tracker.extend("EXT-1234", VERIFIED);

        assertEquals(TrialOutcome.Status.REJECTED, outcome.status());
        assertEquals(10, tracker.daysRemaining(VERIFIED));
    }

    @Test
    @DisplayName("extending without a trial or code is rejected")
    void extend_noTrialOrCode_rejected() {
        assertEquals(TrialOutcome.Status.REJECTED, tracker.extend("EXT-1234", VERIFIED).status());
        tracker.startOrContinue(VERIFIED);
        assertEquals(TrialOutcome.Status.REJECTED, tracker.extend("  ", VERIFIED).status());
        assertEquals(0, channel.extensions.get());
    }
}
