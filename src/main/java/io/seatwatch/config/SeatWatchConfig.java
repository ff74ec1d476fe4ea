package io.seatwatch.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class SeatWatchConfig {
    public static final String ENCRYPTION_KEY_ENV = "SEATWATCH_ENCRYPTION_KEY";
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_SESSION_REFRESH_INTERVAL_SEC = 480L;
    public static final int DEFAULT_FAILURE_NOTIFY_DAILY_LIMIT = 3;
    public static final int DEFAULT_MIN_POLLING_INTERVAL_SEC = 1;
    public static final long DEFAULT_WEBHOOK_TIMEOUT_MS = 10_000L;
    public static final String DEFAULT_SMTP_HOST = "smtp.gmail.com";
    public static final int DEFAULT_SMTP_PORT = 587;
    public static final long DEFAULT_MAIL_TIMEOUT_MS = 10_000L;

    private final Path rootDir;

    public SeatWatchConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static SeatWatchConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new SeatWatchConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("seatwatch.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("seatwatch-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path encryptionKeyFile() {
        return securityRoot().resolve("encryption.key");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }
}
