package io.agentloom.worker;

import io.agentloom.coordinator.Worker;

import java.util.List;

/**
 * Service-provider hook for supplying workers to {@code agentloom run}. Implementations
 * are listed in {@code META-INF/services/io.agentloom.worker.WorkerFactory}.
 */
public interface WorkerFactory {
    List<Worker> create(WorkerContext context);
}
