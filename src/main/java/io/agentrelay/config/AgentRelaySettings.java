package io.agentrelay.config;

import io.agentrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Tunables read from {@code agentrelay-settings.json}. Every field is optional in the file;
 * absent fields take the default and out-of-range values are clamped.
 */
public record AgentRelaySettings(
        String transport,
        String busDir,
        String resultStore,
        String resultDbFile,
        long overflowThresholdBytes,
        long overflowTtlMs,
        int workerConcurrency,
        long executionTimeoutMs,
        long pollIntervalMs,
        long subscriberTtlMs,
        long shutdownGraceMs
) {
    public static final String TRANSPORT_FILE = "file";
    public static final String TRANSPORT_MEMORY = "memory";
    public static final String STORE_SQLITE = "sqlite";
    public static final String STORE_MEMORY = "memory";

    public static final long DEFAULT_OVERFLOW_THRESHOLD_BYTES = 64L * 1024L;
    public static final long DEFAULT_OVERFLOW_TTL_MS = Duration.ofHours(24).toMillis();
    public static final int DEFAULT_WORKER_CONCURRENCY = 4;
    public static final long DEFAULT_EXECUTION_TIMEOUT_MS = Duration.ofMinutes(10).toMillis();
    public static final long DEFAULT_POLL_INTERVAL_MS = 100L;
    public static final long DEFAULT_SUBSCRIBER_TTL_MS = 15_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 15_000L;

    public static AgentRelaySettings defaults() {
        return new AgentRelaySettings(
                TRANSPORT_FILE,
                null,
                STORE_SQLITE,
                null,
                DEFAULT_OVERFLOW_THRESHOLD_BYTES,
                DEFAULT_OVERFLOW_TTL_MS,
                DEFAULT_WORKER_CONCURRENCY,
                DEFAULT_EXECUTION_TIMEOUT_MS,
                DEFAULT_POLL_INTERVAL_MS,
                DEFAULT_SUBSCRIBER_TTL_MS,
                DEFAULT_SHUTDOWN_GRACE_MS
        );
    }

    public static AgentRelaySettings load(Path file) {
        AgentRelaySettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static AgentRelaySettings fromFile(SettingsFile file, AgentRelaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        String transport = sanitizeChoice(file.transport(), defaults.transport(), TRANSPORT_FILE, TRANSPORT_MEMORY);
        String resultStore = sanitizeChoice(file.resultStore(), defaults.resultStore(), STORE_SQLITE, STORE_MEMORY);
        long pollInterval = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L);
        long subscriberTtl = sanitizeLong(file.subscriberTtlMs(), defaults.subscriberTtlMs(), pollInterval * 3L);
        return new AgentRelaySettings(
                transport,
                sanitizePath(file.busDir(), defaults.busDir()),
                resultStore,
                sanitizePath(file.resultDbFile(), defaults.resultDbFile()),
                sanitizeLong(file.overflowThresholdBytes(), defaults.overflowThresholdBytes(), 1L),
                sanitizeLong(file.overflowTtlMs(), defaults.overflowTtlMs(), 1_000L),
                sanitizeInt(file.workerConcurrency(), defaults.workerConcurrency(), 1),
                sanitizeLong(file.executionTimeoutMs(), defaults.executionTimeoutMs(), 100L),
                pollInterval,
                subscriberTtl,
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L)
        );
    }

    public AgentRelaySettings withWorkerConcurrency(int concurrency) {
        return new AgentRelaySettings(transport, busDir, resultStore, resultDbFile, overflowThresholdBytes, overflowTtlMs,
                Math.max(1, concurrency), executionTimeoutMs, pollIntervalMs, subscriberTtlMs, shutdownGraceMs);
    }

    public AgentRelaySettings withExecutionTimeoutMs(long timeoutMs) {
        return new AgentRelaySettings(transport, busDir, resultStore, resultDbFile, overflowThresholdBytes, overflowTtlMs,
                workerConcurrency, Math.max(100L, timeoutMs), pollIntervalMs, subscriberTtlMs, shutdownGraceMs);
    }

    public Duration overflowTtl() {
        return Duration.ofMillis(overflowTtlMs);
    }

    public Duration executionTimeout() {
        return Duration.ofMillis(executionTimeoutMs);
    }

    private static String sanitizeChoice(String raw, String fallback, String... allowed) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (String candidate : allowed) {
            if (candidate.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unsupported setting value: " + raw);
    }

    private static String sanitizePath(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            String transport,
            String busDir,
            String resultStore,
            String resultDbFile,
            Long overflowThresholdBytes,
            Long overflowTtlMs,
            Integer workerConcurrency,
            Long executionTimeoutMs,
            Long pollIntervalMs,
            Long subscriberTtlMs,
            Long shutdownGraceMs
    ) {
    }
}
