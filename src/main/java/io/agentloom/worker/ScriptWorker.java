package io.agentloom.worker;

import io.agentloom.bus.EventBus;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventType;
import io.agentloom.event.TestReport;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.Phase;
import io.agentloom.sandbox.ExecutionSandbox;
import io.agentloom.sandbox.SandboxRequest;
import io.agentloom.sandbox.SandboxResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one configured shell command in the sandbox whenever its trigger event arrives,
 * records a {@code <role>_report} living document and announces the outcome.
 */
public final class ScriptWorker extends AbstractWorker {
    private static final Logger log = LoggerFactory.getLogger(ScriptWorker.class);
    private static final int MAX_OUTPUT_CHARS = 4_000;

    private final EventType trigger;
    private final SandboxRequest request;
    private final Phase phase;
    private final EventType successEvent;
    private final String task;
    private final ExecutionSandbox sandbox;
    private final AtomicReference<AgentEvent> pending = new AtomicReference<>();

    public ScriptWorker(
            String role,
            ProjectMemory memory,
            EventBus bus,
            ExecutionSandbox sandbox,
            EventType trigger,
            SandboxRequest request,
            Phase phase,
            EventType successEvent,
            String task
    ) {
        super(role, memory, bus);
        if (sandbox == null || trigger == null || request == null) {
            throw new IllegalArgumentException("script worker " + role + " needs a sandbox, trigger and request");
        }
        EventType success = successEvent == null ? EventType.UNIT_TESTS_PASSING : successEvent;
        if (success.payloadType() != TestReport.class) {
            throw new IllegalArgumentException("success event must carry a test report: " + success.wireName());
        }
        this.sandbox = sandbox;
        this.trigger = trigger;
        this.request = request;
        this.phase = phase;
        this.successEvent = success;
        this.task = task == null || task.isBlank() ? "Running " + request.command() : task.trim();
    }

    public static ScriptWorker fromSpec(ScriptWorkerSpec spec, Path workspace, WorkerContext context) {
        if (spec == null || spec.role() == null || spec.role().isBlank()) {
            throw new IllegalArgumentException("script worker role cannot be empty");
        }
        long timeoutMs = spec.timeoutMs() == null
                ? context.settings().sandboxTimeoutMs()
                : spec.timeoutMs();
        Path workDir = null;
        if (spec.workDir() != null && !spec.workDir().isBlank()) {
            workDir = workspace.resolve(spec.workDir()).normalize();
        }
        SandboxRequest request = new SandboxRequest(
                spec.image(),
                spec.command(),
                workDir,
                timeoutMs,
                Boolean.TRUE.equals(spec.network())
        );
        return new ScriptWorker(
                spec.role(),
                context.memory(),
                context.bus(),
                context.sandbox(),
                EventType.fromString(spec.trigger()),
                request,
                spec.phase() == null || spec.phase().isBlank() ? null : Phase.fromString(spec.phase()),
                spec.successEvent() == null || spec.successEvent().isBlank()
                        ? null
                        : EventType.fromString(spec.successEvent()),
                spec.task()
        );
    }

    @Override
    public void initialize() {
        on(trigger, pending::set);
        if (isWorking()) {
            log.warn("Worker {} was left working on a script; resetting to idle", role());
            finishWorking();
        }
    }

    public boolean hasPendingTrigger() {
        return pending.get() != null;
    }

    public String reportName() {
        return role() + "_report";
    }

    @Override
    public boolean act() {
        AgentEvent cause = pending.getAndSet(null);
        if (cause == null) {
            if (!isWorking()) {
                return false;
            }
            log.warn("Worker {} has no script in flight; clearing its working pointer", role());
            finishWorking();
            return true;
        }
        startWorking(task, List.of());
        SandboxResult result;
        try {
            if (phase != null) {
                memory.updatePhase(phase);
            }
            log.info("Worker {} running script after {} from {}", role(), trigger.wireName(), cause.emittedBy());
            result = sandbox.runScript(request);
            memory.updateDocument(reportName(), report(result));
        } finally {
            releasePointer();
        }

        if (result.succeeded()) {
            emit(successEvent, new TestReport(
                    role() + " passed in " + result.durationMs() + "ms",
                    truncate(result.stdout())
            ));
        } else {
            emitFailure(task, failureText(result));
        }
        return true;
    }

    // A failure here leaves the pointer WORKING; the next act() clears it.
    private void releasePointer() {
        try {
            finishWorking();
        } catch (RuntimeException e) {
            log.warn("Worker {} could not reset its working pointer: {}", role(), e.getMessage());
        }
    }

    private static Map<String, Object> report(SandboxResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", result.succeeded() ? "passed" : result.timedOut() ? "timed_out" : "failed");
        fields.put("exitCode", result.exitCode());
        fields.put("durationMs", result.durationMs());
        fields.put("output", truncate(result.stdout() + result.stderr()));
        return fields;
    }

    private static String failureText(SandboxResult result) {
        String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
        return "exit=" + result.exitCode() + " " + truncate(detail.strip());
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        if (raw.length() <= MAX_OUTPUT_CHARS) {
            return raw;
        }
        return raw.substring(0, MAX_OUTPUT_CHARS) + "...";
    }
}
