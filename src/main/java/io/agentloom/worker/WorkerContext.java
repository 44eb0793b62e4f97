package io.agentloom.worker;

import io.agentloom.bus.EventBus;
import io.agentloom.config.LoomConfig;
import io.agentloom.config.LoomSettings;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.sandbox.ExecutionSandbox;

/**
 * Collaborators handed to {@link WorkerFactory} implementations.
 */
public record WorkerContext(
        ProjectMemory memory,
        EventBus bus,
        ExecutionSandbox sandbox,
        LoomConfig config,
        LoomSettings settings
) {
}
