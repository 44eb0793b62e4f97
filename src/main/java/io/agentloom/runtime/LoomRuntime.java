package io.agentloom.runtime;

import io.agentloom.bus.BrokerEventBus;
import io.agentloom.bus.EventBus;
import io.agentloom.bus.InProcessEventBus;
import io.agentloom.bus.RecentEvents;
import io.agentloom.bus.RedisBrokerTransport;
import io.agentloom.config.LoomConfig;
import io.agentloom.config.LoomSettings;
import io.agentloom.coordinator.Coordinator;
import io.agentloom.coordinator.Worker;
import io.agentloom.event.AgentEvent;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.Phase;
import io.agentloom.model.ProjectState;
import io.agentloom.model.ProjectSummary;
import io.agentloom.sandbox.DockerContainerRuntime;
import io.agentloom.sandbox.ExecutionSandbox;
import io.agentloom.storage.Database;
import io.agentloom.storage.FileProjectStore;
import io.agentloom.storage.InMemoryProjectStore;
import io.agentloom.storage.ProjectStore;
import io.agentloom.storage.SqliteProjectStore;
import io.agentloom.worker.GuidelineLearner;
import io.agentloom.worker.GuidelineSource;
import io.agentloom.worker.ScriptWorkers;
import io.agentloom.worker.WorkerContext;
import io.agentloom.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Wires configuration, storage, bus, sandbox and workers for the command line.
 */
public final class LoomRuntime {
    private static final Logger log = LoggerFactory.getLogger(LoomRuntime.class);

    private final LoomConfig config;
    private final LoomSettings settings;
    private ProjectStore store;

    public LoomRuntime(LoomConfig config, LoomSettings settings) {
        this.config = config;
        this.settings = settings == null ? LoomSettings.defaults() : settings;
    }

    public static LoomRuntime open(LoomConfig config) {
        return new LoomRuntime(config, LoomSettings.load(config));
    }

    public LoomConfig config() {
        return config;
    }

    public LoomSettings settings() {
        return settings;
    }

    public LoomRuntime withSettings(LoomSettings next) {
        return new LoomRuntime(config, next);
    }

    public void init() {
        new Database(config).init();
    }

    public synchronized ProjectStore store() {
        if (store == null) {
            store = switch (settings.storage()) {
                case FILE -> new FileProjectStore(config.projectsDir());
                case SQLITE -> {
                    Database db = new Database(config);
                    db.init();
                    yield new SqliteProjectStore(db);
                }
                case MEMORY -> new InMemoryProjectStore();
            };
            log.info("Using {} project store under {}", settings.storage(), config.rootDir());
        }
        return store;
    }

    public List<ProjectSummary> listProjects(String ownerId) {
        return store().listProjects(ownerId);
    }

    public Optional<ProjectState> show(String projectId, String ownerId) {
        return store().load(projectId, ownerId);
    }

    /**
     * Loads an existing project or creates it. A project owned by someone else is
     * rejected rather than overwritten.
     */
    public ProjectMemory openMemory(String projectId, String ownerId) {
        ProjectMemory memory = new ProjectMemory(projectId, store());
        if (memory.load(projectId, ownerId).isPresent()) {
            return memory;
        }
        if (store().load(projectId, null).isPresent()) {
            throw new IllegalStateException("Project " + projectId + " is not accessible to " + ownerId);
        }
        if (ownerId != null && !ownerId.isBlank()) {
            memory.setOwner(ownerId);
        } else {
            memory.updatePhase(Phase.IDEATION);
        }
        log.info("Created project {}", projectId);
        return memory;
    }

    public ProjectState changePhase(String projectId, Phase phase, String ownerId) {
        ProjectMemory memory = new ProjectMemory(projectId, store());
        if (memory.load(projectId, ownerId).isEmpty()) {
            throw new IllegalArgumentException("Project not found: " + projectId);
        }
        memory.updatePhase(phase);
        return memory.snapshot();
    }

    public EventBus openBus() {
        if (!settings.brokerEnabled()) {
            return new InProcessEventBus();
        }
        return new BrokerEventBus(RedisBrokerTransport.connect(settings.redisUrl()), settings.channelPrefix());
    }

    public ExecutionSandbox openSandbox() {
        return new ExecutionSandbox(
                DockerContainerRuntime.connect(settings.dockerHost()),
                settings.sandboxMemoryBytes(),
                settings.sandboxNetworkMode()
        );
    }

    /**
     * Builds the worker roster: service-provided workers first, then configured script
     * workers, then the guideline learner when a {@link GuidelineSource} is available.
     */
    public WorkerRegistry assembleWorkers(WorkerContext context, ClassLoader loader) {
        WorkerRegistry registry = new WorkerRegistry();
        registry.discover(context, loader);
        registry.registerAll(ScriptWorkers.load(config, context));
        Optional<GuidelineSource> source = ServiceLoader.load(GuidelineSource.class, loader).findFirst();
        source.ifPresent(s -> registry.register(new GuidelineLearner(context.memory(), context.bus(), s)));
        return registry;
    }

    public RunOutcome run(String projectId, String ownerId, Coordinator.Sleeper sleeper) throws InterruptedException {
        try {
            Files.createDirectories(config.workspaceDir());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create workspace " + config.workspaceDir(), e);
        }
        ProjectMemory memory = openMemory(projectId, ownerId);
        try (EventBus bus = openBus(); ExecutionSandbox sandbox = openSandbox()) {
            RecentEvents recent = RecentEvents.attach(bus, settings.eventLogCapacity());
            WorkerContext context = new WorkerContext(memory, bus, sandbox, config, settings);
            Coordinator coordinator = new Coordinator(memory, bus, settings.tickIntervalMs(), sleeper);
            for (Worker worker : assembleWorkers(context, Thread.currentThread().getContextClassLoader()).workers()) {
                coordinator.register(worker);
            }
            Thread hook = new Thread(coordinator::stop, "agentloom-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                coordinator.run(settings.maxIterations());
            } finally {
                removeHook(hook);
            }
            ProjectState state = memory.snapshot();
            return new RunOutcome(
                    state.projectId(),
                    coordinator.iterations(),
                    coordinator.roles(),
                    state.phase(),
                    state.lastUpdated(),
                    recent.newestFirst()
            );
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
    }

    public record RunOutcome(
            String projectId,
            long iterations,
            List<String> workers,
            Phase phase,
            Instant lastUpdated,
            List<AgentEvent> recentEvents
    ) {
    }
}
