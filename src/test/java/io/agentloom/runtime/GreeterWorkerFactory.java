package io.agentloom.runtime;

import io.agentloom.coordinator.Worker;
import io.agentloom.worker.AbstractWorker;
import io.agentloom.worker.WorkerContext;
import io.agentloom.worker.WorkerFactory;

import java.util.List;
import java.util.Map;

/**
 * Registered through META-INF/services so runtime tests exercise worker discovery.
 */
public final class GreeterWorkerFactory implements WorkerFactory {

    @Override
    public List<Worker> create(WorkerContext context) {
        return List.of(new GreeterWorker(context));
    }

    static final class GreeterWorker extends AbstractWorker {
        private boolean done;

        GreeterWorker(WorkerContext context) {
            super("greeter", context.memory(), context.bus());
        }

        @Override
        public boolean act() {
            if (done) {
                return false;
            }
            memory.updateDocument("greeting", Map.of("text", "hello"));
            done = true;
            return true;
        }
    }
}
