package io.surfworks.sentinel.license;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hardware identifier sent with activations so the service can bind them to a machine.
 *
 * <p>System-scope fingerprints identify the machine; user-scope fingerprints
 * additionally include the account name, so two users on one machine hold
 * separate activations.
 */
public final class MachineFingerprint {

    private static final Logger LOG = Logger.getLogger(MachineFingerprint.class.getName());

    private static volatile String machineId;

    private MachineFingerprint() {}

    /**
     * Fingerprint for the given scope.
     *
     * @return 32 lowercase hex characters
     */
    public static String generate(Scope scope) {
        String raw = machineIdentifier();
        if (scope == Scope.USER) {
            raw = raw + "|" + System.getProperty("user.name", "unknown");
        }
        return sha256(raw).substring(0, 32);
    }

    /**
     * Human-readable machine name, e.g. {@code build-01 (Linux)}.
     */
    public static String getMachineName() {
        String os = System.getProperty("os.name", "Unknown");
        String lower = os.toLowerCase(Locale.ROOT);
        String label = lower.contains("mac") ? "macOS" : lower.contains("linux") ? "Linux" : os;
        return hostname() + " (" + label + ")";
    }

    private static String machineIdentifier() {
        String id = machineId;
        if (id == null) {
            String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
            if (os.contains("linux")) {
                id = linuxMachineId();
            } else if (os.contains("mac")) {
                id = macSerialNumber();
            } else {
                id = networkMac();
            }
            machineId = id;
        }
        return id;
    }

    private static String linuxMachineId() {
        StringBuilder id = new StringBuilder();
        for (String source : new String[] {"/etc/machine-id", "/sys/class/dmi/id/product_uuid"}) {
            Path path = Path.of(source);
            try {
                if (Files.isReadable(path)) {
                    id.append(Files.readString(path).trim());
                }
            } catch (IOException e) {
                // product_uuid is root-only on many systems
                LOG.log(Level.FINE, "Cannot read " + source, e);
            }
        }
        return id.length() > 0 ? id.toString() : networkMac();
    }

    private static String macSerialNumber() {
        ProcessBuilder pb = new ProcessBuilder("ioreg", "-rd1", "-c", "IOPlatformExpertDevice");
        try {
            Process p = pb.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.contains("IOPlatformSerialNumber")) {
                        int start = line.indexOf('"', line.indexOf('=')) + 1;
                        int end = line.lastIndexOf('"');
                        if (start > 0 && end > start) {
                            return line.substring(start, end);
                        }
                    }
                }
            }
            p.waitFor();
        } catch (IOException e) {
            LOG.log(Level.FINE, "ioreg unavailable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return networkMac();
    }

    private static String networkMac() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface ni = interfaces.nextElement();
                byte[] mac = ni.getHardwareAddress();
                if (mac != null && mac.length > 0 && !ni.isLoopback()) {
                    return HexFormat.of().formatHex(mac);
                }
            }
        } catch (SocketException e) {
            LOG.log(Level.FINE, "Cannot enumerate network interfaces", e);
        }
        // Stable for the process but not across machines
        return System.getProperty("user.home", "/unknown") + "|" + hostname();
    }

    private static String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
