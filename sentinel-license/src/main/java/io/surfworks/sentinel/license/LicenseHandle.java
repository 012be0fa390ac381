package io.surfworks.sentinel.license;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque identifier binding a session to one product version.
 *
 * <p>Handles are only created by {@link LicenseSession#acquire}; a bad product
 * configuration never produces one.
 *
 * @param id process-unique handle number, never zero
 * @param productId the product family whose local state the handle uses
 * @param versionId the product version the handle is bound to
 */
public record LicenseHandle(long id, String productId, String versionId) {

    private static final AtomicLong NEXT_ID = new AtomicLong();

    static LicenseHandle next(ProductConfig config) {
        return new LicenseHandle(NEXT_ID.incrementAndGet(), config.productId(), config.versionId());
    }

    @Override
    public String toString() {
        return "handle#" + id + "[" + versionId + "]";
    }
}
