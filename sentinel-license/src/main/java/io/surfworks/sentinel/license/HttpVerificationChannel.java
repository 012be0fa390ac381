package io.surfworks.sentinel.license;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Verification channel speaking JSON over HTTPS to the licensing service.
 *
 * <p>Endpoints, relative to the base URL, per product version:
 * <ul>
 *   <li>{@code POST /v1/versions/{id}/verifications} - re-verify an activation</li>
 *   <li>{@code POST /v1/versions/{id}/activations} - activate a product key</li>
 *   <li>{@code POST /v1/versions/{id}/deactivations} - release an activation</li>
 *   <li>{@code GET  /v1/versions/{id}/time} - trusted time for verified trials</li>
 *   <li>{@code POST /v1/versions/{id}/trial-extensions} - redeem an extension code</li>
 * </ul>
 *
 * <p>A 2xx answer is success. A 4xx answer carrying
 * {@code {"error": {"code": "...", "detail": "..."}}} is a definite rejection.
 * Anything else (5xx, 408, 429, I/O failure, timeout, unreadable body) is a
 * network error: the engine never infers a rejection it was not given.
 */
public class HttpVerificationChannel implements VerificationChannel {

    private static final Logger LOG = Logger.getLogger(HttpVerificationChannel.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private static final String CONTENT_TYPE = "application/json";
    private static final Gson GSON = new Gson();

    private final URI baseUri;
    private final HttpClient httpClient;
    private final Duration timeout;

    /**
     * Create a channel with configuration from environment variables.
     */
    public static HttpVerificationChannel fromEnvironment() {
        return new HttpVerificationChannel(LicenseConfig.getServerUrl());
    }

    public HttpVerificationChannel(String baseUrl) {
        this(baseUrl, DEFAULT_TIMEOUT);
    }

    public HttpVerificationChannel(String baseUrl, Duration timeout) {
        this(URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/"),
            HttpClient.newBuilder().connectTimeout(timeout).build(),
            timeout);
    }

    HttpVerificationChannel(URI baseUri, HttpClient httpClient, Duration timeout) {
        this.baseUri = baseUri;
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public String getChannelName() {
        return "HTTP " + baseUri;
    }

    @Override
    public ChannelResult<Entitlements> check(LicenseHandle handle, String productKey) {
        JsonObject body = new JsonObject();
        body.addProperty("key", productKey);
        body.addProperty("machine", MachineFingerprint.generate(Scope.SYSTEM));
        return exchange(post(handle, "verifications", body), HttpVerificationChannel::parseEntitlements);
    }

    @Override
    public ChannelResult<Entitlements> activate(LicenseHandle handle, String productKey, Scope scope) {
        JsonObject body = new JsonObject();
        body.addProperty("key", productKey);
        body.addProperty("scope", scope.name());
        body.addProperty("machine", MachineFingerprint.generate(Scope.SYSTEM));
        body.addProperty("fingerprint", MachineFingerprint.generate(scope));
        body.addProperty("machineName", MachineFingerprint.getMachineName());
        return exchange(post(handle, "activations", body), HttpVerificationChannel::parseEntitlements);
    }

    @Override
    public ChannelResult<Void> deactivate(LicenseHandle handle, String productKey) {
        JsonObject body = new JsonObject();
        body.addProperty("key", productKey);
        body.addProperty("machine", MachineFingerprint.generate(Scope.SYSTEM));
        ChannelResult<Void> result = exchange(post(handle, "deactivations", body), json -> null);
        if (result.isRejected() && result.reason() == RejectionReason.DEACTIVATED_REMOTELY) {
            // Nothing left to release on the server side
            return ChannelResult.ok(null);
        }
        return result;
    }

    @Override
    public ChannelResult<Instant> trustedTime(LicenseHandle handle) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint(handle, "time"))
            .header("Accept", CONTENT_TYPE)
            .GET()
            .timeout(timeout)
            .build();
        return exchange(request, json -> Instant.parse(requireString(json, "now")));
    }

    @Override
    public ChannelResult<Integer> extendTrial(LicenseHandle handle, String extensionCode) {
        JsonObject body = new JsonObject();
        body.addProperty("code", extensionCode);
        body.addProperty("machine", MachineFingerprint.generate(Scope.SYSTEM));
        return exchange(post(handle, "trial-extensions", body), json -> {
            JsonElement days = json.get("days");
            if (days == null || !days.isJsonPrimitive()) {
                throw new JsonParseException("missing 'days'");
            }
            return days.getAsInt();
        });
    }

    private HttpRequest post(LicenseHandle handle, String action, JsonObject body) {
        return HttpRequest.newBuilder()
            .uri(endpoint(handle, action))
            .header("Accept", CONTENT_TYPE)
            .header("Content-Type", CONTENT_TYPE)
            .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(body)))
            .timeout(timeout)
            .build();
    }

    URI endpoint(LicenseHandle handle, String action) {
        return baseUri.resolve("v1/versions/" + handle.versionId() + "/" + action);
    }

    private <T> ChannelResult<T> exchange(HttpRequest request, Function<JsonObject, T> parser) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.log(Level.FINE, "Request to " + request.uri() + " failed", e);
            return ChannelResult.networkError("Network error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChannelResult.networkError("Request interrupted");
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                JsonObject json = parseObject(response.body());
                return ChannelResult.ok(parser.apply(json));
            } catch (JsonParseException | IllegalStateException | UnsupportedOperationException
                     | NumberFormatException | DateTimeParseException e) {
                LOG.warning("Unreadable response from " + request.uri() + ": " + e.getMessage());
                return ChannelResult.networkError("Failed to parse response: " + e.getMessage());
            }
        }
        if (status >= 400 && status < 500 && status != 408 && status != 429) {
            return parseRejection(status, response.body());
        }
        return ChannelResult.networkError("Licensing service unavailable (HTTP " + status + ")");
    }

    private static <T> ChannelResult<T> parseRejection(int status, String body) {
        String code = null;
        String detail = "Request rejected (HTTP " + status + ")";
        try {
            JsonObject json = parseObject(body);
            JsonElement error = json.get("error");
            if (error != null && error.isJsonObject()) {
                JsonObject err = error.getAsJsonObject();
                code = err.has("code") && !err.get("code").isJsonNull() ? err.get("code").getAsString() : null;
                if (err.has("detail") && !err.get("detail").isJsonNull()) {
                    detail = err.get("detail").getAsString();
                }
            }
        } catch (JsonParseException | IllegalStateException e) {
            LOG.log(Level.FINE, "Rejection body is not an error document", e);
        }
        RejectionReason reason = code != null ? RejectionReason.fromCode(code)
            : status == 404 ? RejectionReason.INVALID_KEY : RejectionReason.UNKNOWN;
        return ChannelResult.rejected(reason, detail);
    }

    private static JsonObject parseObject(String body) {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        return JsonParser.parseString(body).getAsJsonObject();
    }

    private static Entitlements parseEntitlements(JsonObject json) {
        Map<String, String> features = new HashMap<>();
        JsonElement element = json.get("features");
        if (element != null && element.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                JsonElement value = entry.getValue();
                features.put(entry.getKey(), value.isJsonNull() ? "" : value.getAsString());
            }
        }
        return new Entitlements(features);
    }

    private static String requireString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new JsonParseException("missing '" + field + "'");
        }
        return element.getAsString();
    }
}
