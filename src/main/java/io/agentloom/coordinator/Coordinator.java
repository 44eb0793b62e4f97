package io.agentloom.coordinator;

import io.agentloom.bus.EventBus;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.AgentContextPointer;
import io.agentloom.model.ProjectState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cooperative single-threaded scheduler. While any worker's pointer is {@code WORKING},
 * only workers that are themselves working may act; at most one worker changes state
 * per tick.
 */
public final class Coordinator {
    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final ProjectMemory memory;
    private final EventBus bus;
    private final long tickIntervalMs;
    private final Sleeper sleeper;
    private final List<Worker> workers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong iterations = new AtomicLong();

    public Coordinator(ProjectMemory memory, EventBus bus, long tickIntervalMs) {
        this(memory, bus, tickIntervalMs, Thread::sleep);
    }

    public Coordinator(ProjectMemory memory, EventBus bus, long tickIntervalMs, Sleeper sleeper) {
        if (memory == null || bus == null) {
            throw new IllegalArgumentException("memory and bus are required");
        }
        this.memory = memory;
        this.bus = bus;
        this.tickIntervalMs = Math.max(0L, tickIntervalMs);
        this.sleeper = sleeper == null ? Thread::sleep : sleeper;
    }

    public synchronized void register(Worker worker) {
        if (worker == null || worker.role() == null || worker.role().isBlank()) {
            throw new IllegalArgumentException("worker role cannot be empty");
        }
        for (Worker existing : workers) {
            if (existing.role().equals(worker.role())) {
                throw new IllegalArgumentException("worker already registered: " + worker.role());
            }
        }
        worker.initialize();
        workers.add(worker);
        log.info("Registered worker {}", worker.role());
    }

    public List<String> roles() {
        return workers.stream().map(Worker::role).toList();
    }

    public long iterations() {
        return iterations.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public TickOutcome tick() {
        long iteration = iterations.incrementAndGet();
        int dispatched = bus.dispatchPending();
        List<String> skipped = new ArrayList<>();
        List<String> faulted = new ArrayList<>();
        String acted = null;

        for (Worker worker : workers) {
            ProjectState snapshot = memory.snapshot();
            boolean busy = snapshot.agentContextPointers().values().stream()
                    .anyMatch(p -> p.currentlyWorkingOn().working());
            AgentContextPointer own = snapshot.pointerFor(worker.role());
            if (busy && !own.currentlyWorkingOn().working()) {
                skipped.add(worker.role());
                continue;
            }
            boolean changed;
            try {
                changed = worker.act();
            } catch (Exception e) {
                log.error("Worker {} failed during tick {}", worker.role(), iteration, e);
                faulted.add(worker.role());
                changed = false;
            }
            if (changed) {
                acted = worker.role();
                break;
            }
        }

        if (acted != null) {
            log.debug("Tick {} acted={} skipped={}", iteration, acted, skipped);
        }
        return new TickOutcome(iteration, dispatched, acted, skipped, faulted);
    }

    /**
     * Runs ticks until {@link #stop()} is called or {@code maxIterations} ticks have run.
     * A non-positive limit means no limit.
     */
    public void run(long maxIterations) throws InterruptedException {
        running.set(true);
        log.info("Coordinator started for project {} with {} worker(s)", memory.projectId(), workers.size());
        long count = 0;
        try {
            while (running.get() && (maxIterations <= 0 || count < maxIterations)) {
                tick();
                count++;
                if (running.get() && (maxIterations <= 0 || count < maxIterations)) {
                    sleeper.sleep(tickIntervalMs);
                }
            }
        } finally {
            running.set(false);
            log.info("Coordinator stopped after {} tick(s)", count);
        }
    }

    public void stop() {
        running.set(false);
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
