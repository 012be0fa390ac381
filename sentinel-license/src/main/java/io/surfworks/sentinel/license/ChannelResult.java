package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * Result of a single exchange with the {@link VerificationChannel}.
 *
 * @param kind success, definite rejection, or connectivity failure
 * @param value the payload on success, otherwise null
 * @param reason the rejection reason if rejected, otherwise null
 * @param message diagnostic message (may be null)
 * @param <T> payload type
 */
public record ChannelResult<T>(
    Kind kind,
    T value,
    RejectionReason reason,
    String message
) {

    public enum Kind {
        OK,
        REJECTED,
        NETWORK_ERROR
    }

    public ChannelResult {
        Objects.requireNonNull(kind, "kind");
    }

    public static <T> ChannelResult<T> ok(T value) {
        return new ChannelResult<>(Kind.OK, value, null, null);
    }

    public static <T> ChannelResult<T> rejected(RejectionReason reason, String message) {
        return new ChannelResult<>(Kind.REJECTED, null, reason, message);
    }

    public static <T> ChannelResult<T> networkError(String message) {
        return new ChannelResult<>(Kind.NETWORK_ERROR, null, null, message);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public boolean isNetworkError() {
        return kind == Kind.NETWORK_ERROR;
    }
}
