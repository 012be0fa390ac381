package io.surfworks.sentinel.license;

/**
 * Exception thrown when a license operation cannot proceed.
 *
 * <p>Only conditions the caller must not continue past are raised this way.
 * Network failures, rejections and trial expiry are reported as values.
 */
public class LicenseException extends RuntimeException {

    private final ErrorCode errorCode;

    public LicenseException(String message) {
        super(message);
        this.errorCode = ErrorCode.UNKNOWN;
    }

    public LicenseException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LicenseException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * License engine error codes.
     */
    public enum ErrorCode {
        /** Unknown or unclassified error */
        UNKNOWN,

        /** Product configuration missing or malformed */
        INVALID_CONFIG,

        /** Local state could not be read or written */
        STORE_FAILURE,

        /** Trial flags differ from the ones the trial was started with */
        INVALID_TRIAL_FLAGS,

        /** Session already closed */
        SESSION_CLOSED
    }

    public static LicenseException invalidConfig(String detail) {
        return new LicenseException("Invalid product configuration: " + detail, ErrorCode.INVALID_CONFIG);
    }

    public static LicenseException invalidConfig(String detail, Throwable cause) {
        return new LicenseException("Invalid product configuration: " + detail, ErrorCode.INVALID_CONFIG, cause);
    }

    public static LicenseException storeFailure(String operation, Throwable cause) {
        return new LicenseException(
                String.format("License state %s failed: %s", operation, cause.getMessage()),
                ErrorCode.STORE_FAILURE, cause);
    }

    public static LicenseException trialFlagsMismatch(TrialFlags expected, TrialFlags actual) {
        return new LicenseException(
                String.format("Trial was started with %s, queried with %s", expected, actual),
                ErrorCode.INVALID_TRIAL_FLAGS);
    }

    public static LicenseException sessionClosed() {
        return new LicenseException("License session is closed", ErrorCode.SESSION_CLOSED);
    }
}
