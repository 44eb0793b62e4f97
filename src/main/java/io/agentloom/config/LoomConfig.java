package io.agentloom.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class LoomConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final long DEFAULT_TICK_INTERVAL_MS = 500L;
    public static final int DEFAULT_MAX_ITERATIONS = 1_000;
    public static final int DEFAULT_EVENT_LOG_CAPACITY = 50;
    public static final long DEFAULT_SANDBOX_MEMORY_BYTES = 1024L * 1024L * 1024L;
    public static final long DEFAULT_SANDBOX_TIMEOUT_MS = 30_000L;
    public static final String DEFAULT_SANDBOX_NETWORK_MODE = "host";
    public static final String DEFAULT_CHANNEL_PREFIX = "agentloom:";

    private final Path rootDir;

    public LoomConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static LoomConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new LoomConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("agentloom.db");
    }

    public Path projectsDir() {
        return rootDir.resolve("projects");
    }

    public Path workersDir() {
        return rootDir.resolve("workers");
    }

    public Path scriptWorkersFile() {
        return workersDir().resolve("scripts.json");
    }

    public Path workspaceDir() {
        return rootDir.resolve("workspace");
    }

    public Path settingsFile() {
        return rootDir.resolve("agentloom-settings.json");
    }
}
