package io.agentloom.cli;

import io.agentloom.bus.EventBus;
import io.agentloom.config.LoomConfig;
import io.agentloom.config.LoomSettings;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import io.agentloom.model.Phase;
import io.agentloom.model.ProjectState;
import io.agentloom.runtime.LoomRuntime;
import io.agentloom.sandbox.ExecutionSandbox;
import io.agentloom.sandbox.SandboxRequest;
import io.agentloom.sandbox.SandboxResult;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agentloom",
        mixinStandardHelpOptions = true,
        description = "AgentLoom coordinator CLI",
        subcommands = {
                AgentLoomCommand.InitCommand.class,
                AgentLoomCommand.ProjectsCommand.class,
                AgentLoomCommand.ShowCommand.class,
                AgentLoomCommand.PhaseCommand.class,
                AgentLoomCommand.RunCommand.class,
                AgentLoomCommand.EmitCommand.class,
                AgentLoomCommand.SandboxRunCommand.class
        }
)
public final class AgentLoomCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(AgentLoomCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | projects | show | phase | run | emit | sandbox-run");
    }

    LoomRuntime runtime() {
        return LoomRuntime.open(LoomConfig.fromRoot(root));
    }

    /**
     * Command line with an error handler that prints the failure and exits with 1
     * instead of dumping a stack trace.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new AgentLoomCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            log.error("Command failed", ex);
            commandLine.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return cmd;
    }

    @Command(name = "init", description = "Create data directories and the SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Override
        public Integer call() {
            LoomRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized AgentLoom at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "projects", description = "List projects visible to an owner")
    static final class ProjectsCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Option(names = {"--owner"}, description = "Only projects owned by this user or unowned")
        String owner;

        @Option(names = {"--store"}, description = "Storage override: file|sqlite|memory")
        String store;

        @Override
        public Integer call() {
            LoomRuntime runtime = withStore(parent.runtime(), store);
            System.out.println(Jsons.toJson(runtime.listProjects(owner)));
            return 0;
        }
    }

    @Command(name = "show", description = "Print a project snapshot")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Option(names = {"--owner"}, description = "Requesting user")
        String owner;

        @Option(names = {"--store"}, description = "Storage override: file|sqlite|memory")
        String store;

        @Override
        public Integer call() {
            Optional<ProjectState> state = withStore(parent.runtime(), store).show(projectId, owner);
            if (state.isEmpty()) {
                System.err.println("Project not found: " + projectId);
                return 1;
            }
            System.out.println(Jsons.toJson(state.get()));
            return 0;
        }
    }

    @Command(name = "phase", description = "Set a project's phase (manual recovery)")
    static final class PhaseCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Parameters(index = "0", description = "Project id")
        String projectId;

        @Parameters(index = "1", description = "ideation|requirements|design|development|testing|deployment")
        String phase;

        @Option(names = {"--owner"}, description = "Requesting user")
        String owner;

        @Option(names = {"--store"}, description = "Storage override: file|sqlite|memory")
        String store;

        @Override
        public Integer call() {
            ProjectState state = withStore(parent.runtime(), store)
                    .changePhase(projectId, Phase.fromString(phase), owner);
            System.out.println(Jsons.toJson(new PhaseOutcome(state.projectId(), state.phase(), state.lastUpdated())));
            return 0;
        }
    }

    @Command(name = "run", description = "Run the coordinator loop for one project")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Option(names = {"--project"}, required = true, description = "Project id")
        String projectId;

        @Option(names = {"--owner"}, description = "Owner of the project")
        String owner;

        @Option(names = {"--iterations"}, description = "Maximum ticks; 0 or less runs until stopped")
        Integer iterations;

        @Option(names = {"--interval-ms"}, description = "Pause between ticks in ms")
        Long intervalMs;

        @Option(names = {"--store"}, description = "Storage override: file|sqlite|memory")
        String store;

        @Option(names = {"--redis-url"}, description = "Broker URL, e.g. redis://localhost:6379")
        String redisUrl;

        @Override
        public Integer call() throws Exception {
            LoomRuntime base = withStore(parent.runtime(), store);
            LoomSettings settings = base.settings()
                    .withLoop(intervalMs, iterations)
                    .withRedisUrl(redisUrl);
            LoomRuntime.RunOutcome outcome = base.withSettings(settings).run(projectId, owner, Thread::sleep);
            System.out.println(Jsons.toJson(outcome));
            return 0;
        }
    }

    @Command(name = "emit", description = "Publish one event on the broker bus")
    static final class EmitCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Parameters(index = "0", description = "Event type, e.g. user_idea_submitted")
        String type;

        @Option(names = {"--payload"}, required = true, description = "Payload JSON")
        String payload;

        @Option(names = {"--by"}, defaultValue = "cli", description = "Emitting role")
        String emittedBy;

        @Option(names = {"--redis-url"}, description = "Broker URL, e.g. redis://localhost:6379")
        String redisUrl;

        @Override
        public Integer call() throws Exception {
            LoomRuntime base = parent.runtime();
            LoomRuntime runtime = base.withSettings(base.settings().withRedisUrl(redisUrl));
            if (!runtime.settings().brokerEnabled()) {
                System.err.println("emit needs a broker: pass --redis-url or set redisUrl in settings");
                return 2;
            }
            EventType eventType = EventType.fromString(type);
            EventPayload body = Jsons.mapper().readValue(payload, eventType.payloadType());
            try (EventBus bus = runtime.openBus()) {
                AgentEvent event = bus.emit(eventType, emittedBy, body);
                System.out.println(Jsons.toJson(event));
            }
            return 0;
        }
    }

    @Command(name = "sandbox-run", description = "Run one command in the execution sandbox")
    static final class SandboxRunCommand implements Callable<Integer> {
        @ParentCommand
        AgentLoomCommand parent;

        @Option(names = {"--image"}, required = true, description = "Container image")
        String image;

        @Option(names = {"--command"}, required = true, description = "Shell command run with sh -c")
        String command;

        @Option(names = {"--workdir"}, description = "Host directory mounted at /app")
        String workDir;

        @Option(names = {"--timeout-ms"}, description = "Deadline in ms")
        Long timeoutMs;

        @Option(names = {"--network"}, defaultValue = "false", description = "Enable container networking")
        boolean network;

        @Override
        public Integer call() {
            LoomRuntime runtime = parent.runtime();
            SandboxRequest request = new SandboxRequest(
                    image,
                    command,
                    workDir == null ? null : Path.of(workDir),
                    timeoutMs == null ? runtime.settings().sandboxTimeoutMs() : timeoutMs,
                    network
            );
            try (ExecutionSandbox sandbox = runtime.openSandbox()) {
                SandboxResult result = sandbox.runScript(request);
                System.out.println(Jsons.toJson(result));
                return result.succeeded() ? 0 : 1;
            }
        }
    }

    private static LoomRuntime withStore(LoomRuntime runtime, String store) {
        if (store == null || store.isBlank()) {
            return runtime;
        }
        return runtime.withSettings(runtime.settings().withStorage(LoomSettings.StorageKind.fromString(store)));
    }

    record PhaseOutcome(String projectId, Phase phase, Instant lastUpdated) {
    }
}
