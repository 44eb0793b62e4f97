package io.agentloom.sandbox;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Runs against a real Docker engine; skipped when none is reachable.
 */
final class DockerSandboxIntegrationTest {
    private static DockerContainerRuntime runtime;
    private static ExecutionSandbox sandbox;

    @BeforeAll
    static void connect() {
        try {
            runtime = DockerContainerRuntime.connect(System.getenv("DOCKER_HOST"));
        } catch (RuntimeException e) {
            Assumptions.abort("docker client unavailable: " + e.getMessage());
        }
        Assumptions.assumeTrue(runtime.ping(), "docker engine not reachable");
        sandbox = new ExecutionSandbox(runtime);
    }

    @AfterAll
    static void close() {
        if (sandbox != null) {
            sandbox.close();
        }
    }

    @Test
    void echoSucceeds() {
        SandboxResult result = sandbox.runScript(SandboxRequest.of("busybox", "echo ok; exit 0"));

        Assertions.assertEquals(0, result.exitCode(), result.stderr());
        Assertions.assertEquals("ok", result.stdout().trim());
        Assertions.assertTrue(sandbox.leakedContainers().isEmpty());
    }

    @Test
    void exitCodeIsPropagated() {
        SandboxResult result = sandbox.runScript(SandboxRequest.of("busybox", "echo err >&2; exit 7"));

        Assertions.assertEquals(7, result.exitCode());
        Assertions.assertEquals("err", result.stderr().trim());
        Assertions.assertTrue(sandbox.leakedContainers().isEmpty());
    }

    @Test
    void timeoutKillsContainer() {
        SandboxResult result = sandbox.runScript(SandboxRequest.of("busybox", "sleep 30").withTimeoutMs(1_000));

        Assertions.assertTrue(result.timedOut());
        Assertions.assertEquals(124, result.exitCode());
        Assertions.assertTrue(sandbox.leakedContainers().isEmpty());
    }

    @Test
    void unknownImageFailsWithoutLeaking() {
        SandboxResult result = sandbox.runScript(
                SandboxRequest.of("agentloom.invalid/does-not-exist:never", "true"));

        Assertions.assertEquals(-1, result.exitCode());
        Assertions.assertTrue(sandbox.leakedContainers().isEmpty());
    }
}
