package io.surfworks.sentinel.license;

import java.util.Objects;

/**
 * How a trial is tracked.
 *
 * <p>A {@link Kind#VERIFIED verified} trial anchors its day count on a time
 * obtained from the verification channel when the trial starts, so rolling the
 * local clock back cannot give days back. An {@link Kind#UNVERIFIED unverified}
 * trial trusts the local clock.
 *
 * @param kind verified or unverified
 * @param scope user-wide or system-wide
 */
public record TrialFlags(Kind kind, Scope scope) {

    public enum Kind {
        VERIFIED,
        UNVERIFIED
    }

    public TrialFlags {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(scope, "scope");
    }

    public static TrialFlags verified(Scope scope) {
        return new TrialFlags(Kind.VERIFIED, scope);
    }

    public static TrialFlags unverified(Scope scope) {
        return new TrialFlags(Kind.UNVERIFIED, scope);
    }

    public boolean isVerified() {
        return kind == Kind.VERIFIED;
    }

    @Override
    public String toString() {
        return kind + "|" + scope;
    }
}
