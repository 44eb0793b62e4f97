package io.agentloom.worker;

import io.agentloom.coordinator.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Ordered roster of workers keyed by role. Registration order is scheduling order.
 */
public final class WorkerRegistry {
    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final Map<String, Worker> workers = new LinkedHashMap<>();

    public synchronized void register(Worker worker) {
        if (worker == null || worker.role() == null || worker.role().isBlank()) {
            throw new IllegalArgumentException("worker role cannot be empty");
        }
        if (workers.containsKey(worker.role())) {
            throw new IllegalArgumentException("duplicate worker role: " + worker.role());
        }
        workers.put(worker.role(), worker);
    }

    public synchronized void registerAll(Collection<? extends Worker> batch) {
        for (Worker worker : batch) {
            register(worker);
        }
    }

    public synchronized Optional<Worker> findByRole(String role) {
        return Optional.ofNullable(workers.get(role));
    }

    public synchronized List<String> roles() {
        return List.copyOf(workers.keySet());
    }

    public synchronized List<Worker> workers() {
        return List.copyOf(workers.values());
    }

    public synchronized int size() {
        return workers.size();
    }

    /**
     * Asks every {@link WorkerFactory} on the class path for workers and registers them.
     */
    public int discover(WorkerContext context, ClassLoader loader) {
        List<Worker> found = new ArrayList<>();
        for (WorkerFactory factory : ServiceLoader.load(WorkerFactory.class, loader)) {
            List<Worker> created = factory.create(context);
            if (created != null) {
                found.addAll(created);
            }
            log.info("Worker factory {} supplied {} worker(s)",
                    factory.getClass().getName(), created == null ? 0 : created.size());
        }
        registerAll(found);
        return found.size();
    }
}
