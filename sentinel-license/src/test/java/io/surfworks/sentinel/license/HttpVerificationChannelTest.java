package io.surfworks.sentinel.license;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HttpVerificationChannel} against an in-process HTTP server.
 */
class HttpVerificationChannelTest {

    private static final String KEY = "U9MM-4NJ5-QFG8-TWM5-QM75-92YI-NETA";

    private HttpServer server;
    private HttpVerificationChannel channel;
    private LicenseHandle handle;
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String response = "{}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        server.createContext("/", exchange -> {
            lastPath.set(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        channel = new HttpVerificationChannel(
            "http://localhost:" + server.getAddress().getPort(), Duration.ofSeconds(5));
        handle = LicenseHandle.next(ProductConfig.of("acme-editor-3", 10));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(int code, String body) {
        status = code;
        response = body;
    }

    private JsonObject sentBody() {
        return JsonParser.parseString(lastBody.get()).getAsJsonObject();
    }

    @Test
    @DisplayName("check posts the key and reads entitlements")
    void check_ok_readsFeatures() {
        respond(200, "{\"features\": {\"tier\": \"pro\", \"seats\": 5, \"note\": null}}");

        var result = channel.check(handle, KEY);

        assertTrue(result.isOk());
        assertEquals(Map.of("tier", "pro", "seats", "5", "note", ""), result.value().features());
        assertEquals("POST /v1/versions/acme-editor-3/verifications", lastPath.get());
        assertEquals(KEY, sentBody().get("key").getAsString());
        assertEquals(MachineFingerprint.generate(Scope.SYSTEM), sentBody().get("machine").getAsString());
    }

    @Test
    @DisplayName("activate sends scope and scoped fingerprint")
    void activate_sendsScope() {
        respond(201, "{}");

        var result = channel.activate(handle, KEY, Scope.USER);

        assertTrue(result.isOk());
        assertEquals(Map.of(), result.value().features());
        assertEquals("USER", sentBody().get("scope").getAsString());
        assertEquals(MachineFingerprint.generate(Scope.USER), sentBody().get("fingerprint").getAsString());
        assertEquals(MachineFingerprint.getMachineName(), sentBody().get("machineName").getAsString());
    }

    @Test
    @DisplayName("4xx with an error code is a rejection with that reason")
    void check_rejected_mapsCode() {
        respond(403, "{\"error\": {\"code\": \"REVOKED\", \"detail\": \"License has been revoked\"}}");

        var result = channel.check(handle, KEY);

        assertTrue(result.isRejected());
        assertEquals(RejectionReason.REVOKED, result.reason());
        assertEquals("License has been revoked", result.message());
    }

    @Test
    @DisplayName("404 without an error document means the key is unknown")
    void check_notFound_invalidKey() {
        respond(404, "not found");

        var result = channel.check(handle, KEY);

        assertTrue(result.isRejected());
        assertEquals(RejectionReason.INVALID_KEY, result.reason());
    }

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 502, 503})
    @DisplayName("timeouts, throttling and server errors are network errors")
    void check_transientStatus_networkError(int code) {
        respond(code, "{\"error\": {\"code\": \"REVOKED\"}}");

        assertTrue(channel.check(handle, KEY).isNetworkError());
    }

    @Test
    @DisplayName("an unreadable success body is a network error")
    void check_garbageBody_networkError() {
        respond(200, "<html>captive portal</html>");

        assertTrue(channel.check(handle, KEY).isNetworkError());
    }

    @Test
    @DisplayName("an unreachable server is a network error")
    void check_unreachable_networkError() {
        server.stop(0);

        var result = channel.check(handle, KEY);

        assertTrue(result.isNetworkError());
        assertTrue(result.message().startsWith("Network error"));
    }

    @Test
    @DisplayName("trustedTime reads the server time")
    void trustedTime_ok() {
        respond(200, "{\"now\": \"2026-06-01T12:00:00Z\"}");

        var result = channel.trustedTime(handle);

        assertEquals(Instant.parse("2026-06-01T12:00:00Z"), result.value());
        assertEquals("GET /v1/versions/acme-editor-3/time", lastPath.get());
    }

    @Test
    @DisplayName("trustedTime without a time is a network error")
    void trustedTime_missing_networkError() {
        respond(200, "{\"now\": \"soon\"}");
        assertTrue(channel.trustedTime(handle).isNetworkError());

        respond(200, "{}");
        assertTrue(channel.trustedTime(handle).isNetworkError());
    }

    @Test
    @DisplayName("deactivation of a machine the server already released succeeds")
    void deactivate_alreadyReleased_ok() {
        respond(409, "{\"error\": {\"code\": \"DEACTIVATED_REMOTELY\"}}");

        var result = channel.deactivate(handle, KEY);

        assertTrue(result.isOk());
        assertNull(result.value());
        assertEquals("POST /v1/versions/acme-editor-3/deactivations", lastPath.get());
    }

    @Test
    @DisplayName("extendTrial reads the granted days")
    void extendTrial_ok() {
        respond(200, "{\"days\": 7}");

        var result = channel.extendTrial(handle, "EXT-2026");

        assertEquals(7, result.value());
        assertEquals("EXT-2026", sentBody().get("code").getAsString());
    }

    @Test
    @DisplayName("channel name names the endpoint")
    void getChannelName_includesUrl() {
        assertTrue(channel.getChannelName().contains("localhost"));
    }
}
