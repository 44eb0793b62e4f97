package io.agentloom.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Runs untrusted shell commands in ephemeral, memory-capped containers.
 *
 * <p>{@link #runScript(SandboxRequest)} never throws: engine errors come back as a
 * result with exit code {@value SandboxResult#ERROR_EXIT_CODE}, and a missed deadline
 * kills the container and reports exit code {@value SandboxResult#TIMEOUT_EXIT_CODE}.
 * The container is force-removed on every path.
 */
public final class ExecutionSandbox implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSandbox.class);

    public static final String LABEL_KEY = "agentloom.sandbox";
    public static final String LABEL_VALUE = "true";
    public static final String CONTAINER_WORKDIR = "/app";
    public static final String NETWORK_NONE = "none";
    public static final long DEFAULT_MEMORY_BYTES = 1024L * 1024L * 1024L;
    public static final String DEFAULT_NETWORK_MODE = "host";

    private final ContainerRuntime runtime;
    private final long memoryBytes;
    private final String networkMode;

    public ExecutionSandbox(ContainerRuntime runtime) {
        this(runtime, DEFAULT_MEMORY_BYTES, DEFAULT_NETWORK_MODE);
    }

    public ExecutionSandbox(ContainerRuntime runtime, long memoryBytes, String networkMode) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime must not be null");
        }
        this.runtime = runtime;
        this.memoryBytes = memoryBytes <= 0 ? DEFAULT_MEMORY_BYTES : memoryBytes;
        this.networkMode = networkMode == null || networkMode.isBlank() ? DEFAULT_NETWORK_MODE : networkMode.trim();
    }

    public SandboxResult runScript(String image, String command, Path workDir, long timeoutMs, boolean networkEnabled) {
        return runScript(new SandboxRequest(image, command, workDir, timeoutMs, networkEnabled));
    }

    public SandboxResult runScript(SandboxRequest request) {
        long startedNanos = System.nanoTime();
        String containerId = null;
        try {
            String image = ImageReference.parse(request.image()).canonical();
            ensureImage(image);

            containerId = runtime.createContainer(specFor(image, request));
            runtime.startContainer(containerId);
            log.debug("Started sandbox container {} image={}", shortId(containerId), image);

            OptionalInt exit = runtime.awaitExit(containerId, request.timeoutMs());
            if (exit.isEmpty()) {
                return timedOut(containerId, request, elapsedMs(startedNanos));
            }
            long durationMs = elapsedMs(startedNanos);
            ContainerLogs logs = runtime.fetchLogs(containerId);
            SandboxResult result = new SandboxResult(
                    LogSanitizer.clean(logs.stdout()),
                    LogSanitizer.clean(logs.stderr()),
                    exit.getAsInt(),
                    durationMs,
                    false
            );
            log.info("Sandbox run finished image={} exitCode={} durationMs={}", image, result.exitCode(), durationMs);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Sandbox run interrupted image={}", request.image());
            return SandboxResult.error("sandbox run interrupted", elapsedMs(startedNanos));
        } catch (Exception e) {
            log.error("Sandbox run failed image={}: {}", request.image(), e.getMessage());
            return SandboxResult.error(messageOf(e), elapsedMs(startedNanos));
        } finally {
            if (containerId != null) {
                remove(containerId);
            }
        }
    }

    /**
     * Sandbox containers that still exist. Empty in steady state.
     */
    public List<String> leakedContainers() {
        return runtime.listContainers(Map.of(LABEL_KEY, LABEL_VALUE));
    }

    @Override
    public void close() {
        runtime.close();
    }

    ContainerSpec specFor(String image, SandboxRequest request) {
        Path hostDir = request.workDir() != null && Files.isDirectory(request.workDir())
                ? request.workDir().toAbsolutePath().normalize()
                : null;
        if (request.workDir() != null && hostDir == null) {
            log.warn("Sandbox workDir {} does not exist; running without a mount", request.workDir());
        }
        return new ContainerSpec(
                image,
                List.of("sh", "-c", request.command()),
                memoryBytes,
                request.networkEnabled() ? networkMode : NETWORK_NONE,
                hostDir,
                hostDir == null ? null : CONTAINER_WORKDIR,
                Map.of(LABEL_KEY, LABEL_VALUE)
        );
    }

    private void ensureImage(String image) throws InterruptedException {
        if (runtime.imageExists(image)) {
            return;
        }
        log.info("Pulling image {}", image);
        try {
            runtime.pullImage(image);
        } catch (RuntimeException first) {
            log.warn("Pull of {} failed, retrying once: {}", image, first.getMessage());
            runtime.pullImage(image);
        }
    }

    private SandboxResult timedOut(String containerId, SandboxRequest request, long durationMs)
            throws InterruptedException {
        log.warn("Sandbox container {} exceeded {}ms, killing", shortId(containerId), request.timeoutMs());
        try {
            runtime.killContainer(containerId);
        } catch (RuntimeException e) {
            log.warn("Failed to kill container {}: {}", shortId(containerId), e.getMessage());
        }
        ContainerLogs partial = ContainerLogs.EMPTY;
        try {
            partial = runtime.fetchLogs(containerId);
        } catch (RuntimeException e) {
            log.debug("No logs for timed out container {}: {}", shortId(containerId), e.getMessage());
        }
        String message = "Execution timed out after " + request.timeoutMs() + "ms";
        String stderr = LogSanitizer.clean(partial.stderr());
        return SandboxResult.timeout(
                LogSanitizer.clean(partial.stdout()),
                stderr.isEmpty() ? message : stderr + "\n" + message,
                durationMs
        );
    }

    private void remove(String containerId) {
        try {
            runtime.removeContainer(containerId);
        } catch (RuntimeException e) {
            log.error("Failed to remove sandbox container {}: {}", shortId(containerId), e.getMessage());
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String messageOf(Exception e) {
        return e.getMessage() == null || e.getMessage().isBlank() ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
