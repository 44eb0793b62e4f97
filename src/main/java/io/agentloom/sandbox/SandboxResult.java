package io.agentloom.sandbox;

public record SandboxResult(
        String stdout,
        String stderr,
        int exitCode,
        long durationMs,
        boolean timedOut
) {
    public static final int ERROR_EXIT_CODE = -1;
    public static final int TIMEOUT_EXIT_CODE = 124;

    public SandboxResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        durationMs = Math.max(0L, durationMs);
    }

    public static SandboxResult error(String message, long durationMs) {
        return new SandboxResult("", message, ERROR_EXIT_CODE, durationMs, false);
    }

    public static SandboxResult timeout(String stdout, String stderr, long durationMs) {
        return new SandboxResult(stdout, stderr, TIMEOUT_EXIT_CODE, durationMs, true);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
