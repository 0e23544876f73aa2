package io.taskrelay.config;

import io.taskrelay.classify.ClassificationRule;
import io.taskrelay.classify.Classifier;
import io.taskrelay.health.OutputPatterns;
import io.taskrelay.model.WorkType;
import io.taskrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Effective runtime settings: defaults merged with the optional
 * {@code taskrelay-settings.json} under the data root.
 */
public record RelaySettings(
        long lockTtlMs,
        long dedupLookbackMs,
        long dedupTtlMs,
        int defaultMaxRetries,
        int defaultTimeoutMinutes,
        long dispatchIntervalMs,
        long monitorIntervalMs,
        long maxIdleBackoffMs,
        long staleThresholdMs,
        long blockedCooldownMs,
        String correctiveResponse,
        List<String> nudgeKeys,
        int captureLines,
        long remoteTimeoutMs,
        List<String> sshOptions,
        boolean completeOnIdle,
        long idleCompletionGraceMs,
        List<ClassificationRule> classifierRules,
        OutputPatterns outputPatterns
) {
    public static RelaySettings defaults() {
        return new RelaySettings(
                TaskRelayConfig.DEFAULT_LOCK_TTL_MS,
                TaskRelayConfig.DEFAULT_DEDUP_LOOKBACK_MS,
                TaskRelayConfig.DEFAULT_DEDUP_TTL_MS,
                TaskRelayConfig.DEFAULT_MAX_RETRIES,
                TaskRelayConfig.DEFAULT_TIMEOUT_MINUTES,
                TaskRelayConfig.DEFAULT_DISPATCH_INTERVAL_MS,
                TaskRelayConfig.DEFAULT_MONITOR_INTERVAL_MS,
                TaskRelayConfig.DEFAULT_MAX_IDLE_BACKOFF_MS,
                TaskRelayConfig.DEFAULT_STALE_THRESHOLD_MS,
                TaskRelayConfig.DEFAULT_BLOCKED_COOLDOWN_MS,
                "1",
                List.of("Enter"),
                TaskRelayConfig.DEFAULT_CAPTURE_LINES,
                TaskRelayConfig.DEFAULT_REMOTE_TIMEOUT_MS,
                List.of("-o", "BatchMode=yes", "-o", "StrictHostKeyChecking=accept-new"),
                false,
                TaskRelayConfig.DEFAULT_IDLE_COMPLETION_GRACE_MS,
                Classifier.defaultRules(),
                OutputPatterns.defaults()
        );
    }

    /**
     * Reads the settings file if present. A missing file yields {@link #defaults()}.
     */
    public static RelaySettings load(Path file) {
        RelaySettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read settings file: " + file, e);
        }
    }

    static RelaySettings fromFile(SettingsFile file, RelaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        long staleThreshold = sanitizeLong(file.staleThresholdMs(), defaults.staleThresholdMs(), 1_000L);
        long dispatchInterval = sanitizeLong(file.dispatchIntervalMs(), defaults.dispatchIntervalMs(), 100L);
        long maxIdleBackoff = sanitizeLong(file.maxIdleBackoffMs(), defaults.maxIdleBackoffMs(), dispatchInterval);
        if (maxIdleBackoff < dispatchInterval) {
            maxIdleBackoff = dispatchInterval;
        }
        OutputPatterns basePatterns = defaults.outputPatterns();
        OutputPatterns patterns = new OutputPatterns(
                sanitizeList(file.blockedPatterns(), basePatterns.blocked()),
                sanitizeList(file.activePatterns(), basePatterns.active()),
                sanitizeList(file.donePatterns(), basePatterns.done()),
                sanitizeList(file.errorPatterns(), basePatterns.error()),
                sanitizeList(file.idlePatterns(), basePatterns.idle())
        );
        return new RelaySettings(
                sanitizeLong(file.lockTtlMs(), defaults.lockTtlMs(), 1_000L),
                sanitizeLong(file.dedupLookbackMs(), defaults.dedupLookbackMs(), 0L),
                sanitizeLong(file.dedupTtlMs(), defaults.dedupTtlMs(), 60_000L),
                sanitizeInt(file.defaultMaxRetries(), defaults.defaultMaxRetries(), 0),
                sanitizeInt(file.defaultTimeoutMinutes(), defaults.defaultTimeoutMinutes(), 1),
                dispatchInterval,
                sanitizeLong(file.monitorIntervalMs(), defaults.monitorIntervalMs(), 1_000L),
                maxIdleBackoff,
                staleThreshold,
                sanitizeLong(file.blockedCooldownMs(), defaults.blockedCooldownMs(), 0L),
                file.correctiveResponse() == null ? defaults.correctiveResponse() : file.correctiveResponse(),
                sanitizeList(file.nudgeKeys(), defaults.nudgeKeys()),
                sanitizeInt(file.captureLines(), defaults.captureLines(), 5),
                sanitizeLong(file.remoteTimeoutMs(), defaults.remoteTimeoutMs(), 1_000L),
                file.sshOptions() == null ? defaults.sshOptions() : List.copyOf(file.sshOptions()),
                file.completeOnIdle() == null ? defaults.completeOnIdle() : file.completeOnIdle(),
                sanitizeLong(file.idleCompletionGraceMs(), defaults.idleCompletionGraceMs(), 0L),
                toRules(file.classifierRules(), defaults.classifierRules()),
                patterns
        );
    }

    private static List<ClassificationRule> toRules(List<RuleEntry> entries, List<ClassificationRule> fallback) {
        if (entries == null || entries.isEmpty()) {
            return fallback;
        }
        List<ClassificationRule> out = new ArrayList<>(entries.size());
        for (RuleEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            int priority = entry.priority() == null ? 50 : entry.priority();
            out.add(new ClassificationRule(entry.pattern(), WorkType.fromString(entry.workType()), priority));
        }
        return List.copyOf(out);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static List<String> sanitizeList(List<String> value, List<String> fallback) {
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String item : value) {
            if (item != null && !item.isEmpty()) {
                out.add(item);
            }
        }
        return out.isEmpty() ? fallback : List.copyOf(out);
    }

    record SettingsFile(
            Long lockTtlMs,
            Long dedupLookbackMs,
            Long dedupTtlMs,
            Integer defaultMaxRetries,
            Integer defaultTimeoutMinutes,
            Long dispatchIntervalMs,
            Long monitorIntervalMs,
            Long maxIdleBackoffMs,
            Long staleThresholdMs,
            Long blockedCooldownMs,
            String correctiveResponse,
            List<String> nudgeKeys,
            Integer captureLines,
            Long remoteTimeoutMs,
            List<String> sshOptions,
            Boolean completeOnIdle,
            Long idleCompletionGraceMs,
            List<RuleEntry> classifierRules,
            List<String> blockedPatterns,
            List<String> activePatterns,
            List<String> donePatterns,
            List<String> errorPatterns,
            List<String> idlePatterns
    ) {
    }

    record RuleEntry(String pattern, String workType, Integer priority) {
    }
}
