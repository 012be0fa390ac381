package io.surfworks.sentinel.license;

import java.time.Instant;

/**
 * Connection to the remote licensing service.
 *
 * <p>Every method is exactly one attempt: implementations must not retry
 * internally and must bound their own latency with a timeout. Failures to
 * reach the service are reported as {@link ChannelResult#networkError}, never
 * as exceptions; {@link ChannelResult#rejected} is reserved for answers the
 * service actually gave.
 *
 * <p>Calls may arrive from several threads at once.
 */
public interface VerificationChannel {

    /**
     * Re-verify an existing activation.
     *
     * @param handle the handle being verified
     * @param productKey the activated product key
     * @return the current entitlements, a rejection (revoked, deactivated
     *         remotely, fraud), or a network error
     */
    ChannelResult<Entitlements> check(LicenseHandle handle, String productKey);

    /**
     * Activate a product key on this machine.
     *
     * @return the granted entitlements, a rejection, or a network error
     */
    ChannelResult<Entitlements> activate(LicenseHandle handle, String productKey, Scope scope);

    /**
     * Release this machine's activation.
     *
     * @return ok or a network error
     */
    ChannelResult<Void> deactivate(LicenseHandle handle, String productKey);

    /**
     * Fetch the service's current time, used to anchor verified trials.
     */
    ChannelResult<Instant> trustedTime(LicenseHandle handle);

    /**
     * Redeem a trial extension code.
     *
     * @return the number of days granted
     */
    ChannelResult<Integer> extendTrial(LicenseHandle handle, String extensionCode);

    /**
     * Get the channel name for display/logging.
     */
    String getChannelName();
}
