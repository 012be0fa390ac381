package io.surfworks.sentinel.license;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Product details a session is acquired for.
 *
 * <p>Can be built in code or loaded from a JSON product details file:
 * <pre>{@code
 * {
 *   "productId": "usenetsync",
 *   "versionId": "18324776654b3946fc44a5f3.49025204",
 *   "trialDays": 10,
 *   "keyPattern": "[A-Z0-9]{4}(-[A-Z0-9]{4}){6}",
 *   "trialRestart": "NEVER"
 * }
 * }</pre>
 *
 * @param productId product family; versions of one product share local state.
 *                  Defaults to the version id.
 * @param versionId identifier of the product version, as known to the licensing service
 * @param trialDays length of a trial grant in days
 * @param keyPattern regular expression product keys must match
 * @param trialRestart whether an expired trial may ever be granted again
 */
public record ProductConfig(
    String productId,
    String versionId,
    int trialDays,
    String keyPattern,
    TrialRestart trialRestart
) {

    /**
     * Seven dash-separated groups of four characters, e.g. {@code U9MM-4NJ5-QFG8-TWM5-QM75-92YI-NETA}.
     */
    public static final String DEFAULT_KEY_PATTERN = "[A-Za-z0-9]{4}(-[A-Za-z0-9]{4}){6}";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{2,127}");
    private static final Gson GSON = new Gson();

    /**
     * Policy for granting a new trial after the previous one expired.
     */
    public enum TrialRestart {
        /** Trials are one-shot. */
        NEVER,

        /** A fresh grant is allowed when the expired trial belongs to another version. Fraud is never forgiven. */
        NEW_VERSION
    }

    public ProductConfig {
        if (productId == null || productId.isBlank()) {
            productId = versionId;
        }
        if (keyPattern == null || keyPattern.isBlank()) {
            keyPattern = DEFAULT_KEY_PATTERN;
        }
        if (trialRestart == null) {
            trialRestart = TrialRestart.NEVER;
        }
    }

    public static ProductConfig of(String versionId, int trialDays) {
        return new ProductConfig(versionId, versionId, trialDays, DEFAULT_KEY_PATTERN, TrialRestart.NEVER);
    }

    /**
     * Load product details from a JSON file.
     *
     * @throws LicenseException with {@code INVALID_CONFIG} if the file is missing or malformed
     */
    public static ProductConfig load(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (NoSuchFileException e) {
            throw LicenseException.invalidConfig("product details not found at " + file, e);
        } catch (IOException e) {
            throw LicenseException.invalidConfig("cannot read " + file, e);
        }

        ProductFile parsed;
        try {
            parsed = GSON.fromJson(json, ProductFile.class);
        } catch (JsonParseException e) {
            throw LicenseException.invalidConfig("malformed product details in " + file, e);
        }
        if (parsed == null) {
            throw LicenseException.invalidConfig("empty product details in " + file);
        }

        TrialRestart restart;
        try {
            restart = parsed.trialRestart != null ? TrialRestart.valueOf(parsed.trialRestart) : null;
        } catch (IllegalArgumentException e) {
            throw LicenseException.invalidConfig("unknown trialRestart '" + parsed.trialRestart + "'", e);
        }

        ProductConfig config = new ProductConfig(
            parsed.productId, parsed.versionId, parsed.trialDays, parsed.keyPattern, restart);
        config.validate();
        return config;
    }

    /**
     * Check the configuration is usable.
     *
     * @throws LicenseException with {@code INVALID_CONFIG} otherwise
     */
    public void validate() {
        if (versionId == null || !IDENTIFIER.matcher(versionId).matches()) {
            throw LicenseException.invalidConfig("versionId '" + versionId + "' is not a valid version identifier");
        }
        if (!IDENTIFIER.matcher(productId).matches()) {
            throw LicenseException.invalidConfig("productId '" + productId + "' is not a valid identifier");
        }
        if (trialDays <= 0) {
            throw LicenseException.invalidConfig("trialDays must be positive: " + trialDays);
        }
        try {
            Pattern.compile(keyPattern);
        } catch (PatternSyntaxException e) {
            throw LicenseException.invalidConfig("keyPattern does not compile", e);
        }
    }

    public boolean acceptsKey(String productKey) {
        return productKey != null && Pattern.matches(keyPattern, productKey.trim());
    }

    private static class ProductFile {
        String productId;
        String versionId;
        int trialDays;
        String keyPattern;
        String trialRestart;
    }
}
