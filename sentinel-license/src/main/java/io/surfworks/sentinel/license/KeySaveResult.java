package io.surfworks.sentinel.license;

/**
 * Result of saving a product key.
 *
 * @param saved whether the key was stored
 * @param reason why it was not (null on success)
 * @param message error message if not saved
 */
public record KeySaveResult(boolean saved, RejectionReason reason, String message) {

    public static KeySaveResult ok() {
        return new KeySaveResult(true, null, null);
    }

    public static KeySaveResult rejected(RejectionReason reason, String message) {
        return new KeySaveResult(false, reason, message);
    }
}
