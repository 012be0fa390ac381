package io.surfworks.sentinel.license;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores license state as JSON files, one directory per product.
 *
 * <p>Layout: {@code <configDir>/<productId>/activation.json} and
 * {@code <configDir>/<productId>/trial.json}. Writes go to a temporary file
 * that is forced to disk and then moved over the old file, so a crash leaves
 * either the old or the new record, never a torn one.
 *
 * <p>Locks are shared by every store in the process that resolves to the same
 * product directory. Other processes are not excluded.
 */
public class FileStateStore implements LocalStateStore {

    private static final Logger LOG = Logger.getLogger(FileStateStore.class.getName());

    static final String ACTIVATION_FILE = "activation.json";
    static final String TRIAL_FILE = "trial.json";

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final Path configDir;

    public FileStateStore(Path configDir) {
        this.configDir = configDir;
    }

    /**
     * Store rooted at {@link LicenseConfig#getConfigDir()}.
     */
    public static FileStateStore fromEnvironment() {
        return new FileStateStore(LicenseConfig.getConfigDir());
    }

    @Override
    public StoredState load(LicenseHandle handle) {
        Path dir = productDir(handle);
        CachedActivation activation = read(dir.resolve(ACTIVATION_FILE), CachedActivation.class);
        CachedTrial trial = read(dir.resolve(TRIAL_FILE), CachedTrial.class);
        try {
            return new StoredState(
                activation != null ? activation.toRecord() : null,
                trial != null ? trial.toRecord() : null
            );
        } catch (RuntimeException e) {
            // Unparseable instants or enum names
            throw LicenseException.storeFailure("load of " + dir, e);
        }
    }

    @Override
    public void save(LicenseHandle handle, ActivationRecord record) {
        write(productDir(handle).resolve(ACTIVATION_FILE), GSON.toJson(CachedActivation.of(record)));
    }

    @Override
    public void save(LicenseHandle handle, TrialRecord record) {
        write(productDir(handle).resolve(TRIAL_FILE), GSON.toJson(CachedTrial.of(record)));
    }

    @Override
    public void deleteActivation(LicenseHandle handle) {
        Path file = productDir(handle).resolve(ACTIVATION_FILE);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw LicenseException.storeFailure("delete of " + file, e);
        }
    }

    @Override
    public Lock lockFor(LicenseHandle handle) {
        Path key = productDir(handle).toAbsolutePath().normalize();
        return LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
    }

    Path productDir(LicenseHandle handle) {
        return configDir.resolve(handle.productId());
    }

    private <T> T read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            String json = Files.readString(file);
            T value = GSON.fromJson(json, type);
            if (value == null) {
                throw new IOException("empty state file");
            }
            return value;
        } catch (IOException | RuntimeException e) {
            // A damaged record must not read as "no trial" or "never activated"
            throw LicenseException.storeFailure("read of " + file, e);
        }
    }

    private void write(Path file, String json) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            syncDirectory(file.getParent());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            LOG.log(Level.WARNING, "Failed to persist " + file, e);
            throw LicenseException.storeFailure("write of " + file, e);
        }
    }

    /**
     * Force the directory entry of a completed rename to disk. Returns false
     * where the platform cannot open a directory for syncing.
     */
    static boolean syncDirectory(Path dir) {
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
            return true;
        } catch (IOException e) {
            LOG.log(Level.FINE, "Directory sync unavailable for " + dir, e);
            return false;
        }
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class CachedActivation {
        boolean activated;
        String scope;
        String productKey;
        String activatedAt;
        String lastVerifiedAt;
        String lastAttemptAt;
        boolean lastAttemptFailed;
        Map<String, String> features;
        String pendingKey;
        String pendingScope;

        static CachedActivation of(ActivationRecord record) {
            CachedActivation cached = new CachedActivation();
            cached.activated = record.activated();
            cached.scope = record.scope() != null ? record.scope().name() : null;
            cached.productKey = record.productKey();
            cached.activatedAt = format(record.activatedAt());
            cached.lastVerifiedAt = format(record.lastVerifiedAt());
            cached.lastAttemptAt = format(record.lastAttemptAt());
            cached.lastAttemptFailed = record.lastAttemptFailed();
            cached.features = record.features();
            cached.pendingKey = record.pendingKey();
            cached.pendingScope = record.pendingScope() != null ? record.pendingScope().name() : null;
            return cached;
        }

        ActivationRecord toRecord() {
            return new ActivationRecord(
                activated,
                scope != null ? Scope.valueOf(scope) : null,
                productKey,
                parse(activatedAt),
                parse(lastVerifiedAt),
                parse(lastAttemptAt),
                lastAttemptFailed,
                features,
                pendingKey,
                pendingScope != null ? Scope.valueOf(pendingScope) : null
            );
        }
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class CachedTrial {
        String kind;
        String scope;
        String versionId;
        String startedAt;
        String trustedStart;
        long clockOffsetMillis;
        String highWaterMark;
        int durationDays;
        int daysRemaining;
        boolean expired;
        boolean fraud;

        static CachedTrial of(TrialRecord record) {
            CachedTrial cached = new CachedTrial();
            cached.kind = record.flags().kind().name();
            cached.scope = record.flags().scope().name();
            cached.versionId = record.versionId();
            cached.startedAt = format(record.startedAt());
            cached.trustedStart = format(record.trustedStart());
            cached.clockOffsetMillis = record.clockOffsetMillis();
            cached.highWaterMark = format(record.highWaterMark());
            cached.durationDays = record.durationDays();
            cached.daysRemaining = record.daysRemaining();
            cached.expired = record.expired();
            cached.fraud = record.fraud();
            return cached;
        }

        TrialRecord toRecord() {
            return new TrialRecord(
                new TrialFlags(TrialFlags.Kind.valueOf(kind), Scope.valueOf(scope)),
                versionId,
                parse(startedAt),
                parse(trustedStart),
                clockOffsetMillis,
                parse(highWaterMark),
                durationDays,
                daysRemaining,
                expired,
                fraud
            );
        }
    }
}
