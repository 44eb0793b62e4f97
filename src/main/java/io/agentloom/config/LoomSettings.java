package io.agentloom.config;

import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Effective runtime settings. Values come from {@code agentloom-settings.json}
 * when present; anything missing or out of range falls back to the default.
 */
public record LoomSettings(
        long tickIntervalMs,
        int maxIterations,
        StorageKind storage,
        String redisUrl,
        String channelPrefix,
        int eventLogCapacity,
        long sandboxMemoryBytes,
        long sandboxTimeoutMs,
        String sandboxNetworkMode,
        String dockerHost
) {
    private static final Logger log = LoggerFactory.getLogger(LoomSettings.class);

    public enum StorageKind {
        FILE,
        SQLITE,
        MEMORY;

        public static StorageKind fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return FILE;
            }
            try {
                return valueOf(raw.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown storage kind: " + raw, e);
            }
        }
    }

    public static LoomSettings defaults() {
        return new LoomSettings(
                LoomConfig.DEFAULT_TICK_INTERVAL_MS,
                LoomConfig.DEFAULT_MAX_ITERATIONS,
                StorageKind.FILE,
                "",
                LoomConfig.DEFAULT_CHANNEL_PREFIX,
                LoomConfig.DEFAULT_EVENT_LOG_CAPACITY,
                LoomConfig.DEFAULT_SANDBOX_MEMORY_BYTES,
                LoomConfig.DEFAULT_SANDBOX_TIMEOUT_MS,
                LoomConfig.DEFAULT_SANDBOX_NETWORK_MODE,
                ""
        );
    }

    public static LoomSettings load(LoomConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            LoomSettings resolved = fromFile(raw, defaults());
            log.info("Loaded settings from {}", file);
            return resolved;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings file: " + file, e);
        }
    }

    static LoomSettings fromFile(SettingsFile file, LoomSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new LoomSettings(
                sanitizeLong(file.tickIntervalMs(), defaults.tickIntervalMs(), 0L),
                file.maxIterations() == null ? defaults.maxIterations() : file.maxIterations(),
                file.storage() == null || file.storage().isBlank()
                        ? defaults.storage()
                        : StorageKind.fromString(file.storage()),
                sanitizeText(file.redisUrl(), defaults.redisUrl()),
                sanitizeText(file.channelPrefix(), defaults.channelPrefix()),
                sanitizeInt(file.eventLogCapacity(), defaults.eventLogCapacity(), 1),
                sanitizeLong(file.sandboxMemoryBytes(), defaults.sandboxMemoryBytes(), 64L * 1024L * 1024L),
                sanitizeLong(file.sandboxTimeoutMs(), defaults.sandboxTimeoutMs(), 1_000L),
                sanitizeText(file.sandboxNetworkMode(), defaults.sandboxNetworkMode()),
                sanitizeText(file.dockerHost(), defaults.dockerHost())
        );
    }

    public LoomSettings withRedisUrl(String url) {
        if (url == null || url.isBlank()) {
            return this;
        }
        return new LoomSettings(tickIntervalMs, maxIterations, storage, url.trim(), channelPrefix,
                eventLogCapacity, sandboxMemoryBytes, sandboxTimeoutMs, sandboxNetworkMode, dockerHost);
    }

    public LoomSettings withStorage(StorageKind kind) {
        if (kind == null) {
            return this;
        }
        return new LoomSettings(tickIntervalMs, maxIterations, kind, redisUrl, channelPrefix,
                eventLogCapacity, sandboxMemoryBytes, sandboxTimeoutMs, sandboxNetworkMode, dockerHost);
    }

    public LoomSettings withLoop(Long intervalMs, Integer iterations) {
        return new LoomSettings(
                intervalMs == null ? tickIntervalMs : Math.max(0L, intervalMs),
                iterations == null ? maxIterations : iterations,
                storage, redisUrl, channelPrefix, eventLogCapacity,
                sandboxMemoryBytes, sandboxTimeoutMs, sandboxNetworkMode, dockerHost);
    }

    public boolean brokerEnabled() {
        return redisUrl != null && !redisUrl.isBlank();
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    record SettingsFile(
            Long tickIntervalMs,
            Integer maxIterations,
            String storage,
            String redisUrl,
            String channelPrefix,
            Integer eventLogCapacity,
            Long sandboxMemoryBytes,
            Long sandboxTimeoutMs,
            String sandboxNetworkMode,
            String dockerHost
    ) {
    }
}
