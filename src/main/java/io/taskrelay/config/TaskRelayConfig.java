package io.taskrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskRelayConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "taskrelay-settings.json";
    public static final int MAX_CONTENT_CHARS = 64 * 1024;
    public static final int MAX_PRIORITY = 1_000;
    public static final long DEFAULT_LOCK_TTL_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_DEDUP_LOOKBACK_MS = 2L * 60L * 60L * 1000L;
    public static final long DEFAULT_DEDUP_TTL_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_TIMEOUT_MINUTES = 30;
    public static final long DEFAULT_DISPATCH_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_MONITOR_INTERVAL_MS = 15_000L;
    public static final long DEFAULT_MAX_IDLE_BACKOFF_MS = 60_000L;
    public static final long DEFAULT_STALE_THRESHOLD_MS = 10L * 60L * 1000L;
    public static final long DEFAULT_BLOCKED_COOLDOWN_MS = 15_000L;
    public static final int DEFAULT_CAPTURE_LINES = 50;
    public static final long DEFAULT_REMOTE_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_IDLE_COMPLETION_GRACE_MS = 30_000L;

    private final Path rootDir;

    public TaskRelayConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskRelayConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskRelayConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("taskrelay.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
