package io.agentloom.sandbox;

import java.nio.file.Path;

/**
 * One script execution. {@code workDir} is optional; when it exists on the host it is
 * mounted read/write at {@code /app}.
 */
public record SandboxRequest(
        String image,
        String command,
        Path workDir,
        long timeoutMs,
        boolean networkEnabled
) {
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;

    public SandboxRequest {
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image cannot be empty");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        image = image.trim();
        timeoutMs = timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
    }

    public static SandboxRequest of(String image, String command) {
        return new SandboxRequest(image, command, null, DEFAULT_TIMEOUT_MS, false);
    }

    public SandboxRequest withWorkDir(Path dir) {
        return new SandboxRequest(image, command, dir, timeoutMs, networkEnabled);
    }

    public SandboxRequest withTimeoutMs(long millis) {
        return new SandboxRequest(image, command, workDir, millis, networkEnabled);
    }

    public SandboxRequest withNetwork(boolean enabled) {
        return new SandboxRequest(image, command, workDir, timeoutMs, enabled);
    }
}
