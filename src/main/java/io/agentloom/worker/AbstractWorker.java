package io.agentloom.worker;

import io.agentloom.bus.EventBus;
import io.agentloom.coordinator.Worker;
import io.agentloom.event.ActionFailed;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import io.agentloom.memory.ProjectMemory;
import io.agentloom.model.AgentContextPointer;
import io.agentloom.model.AgentContextUpdate;

import java.util.List;

/**
 * Base class for workers that share one project memory and bus. Subclasses subscribe
 * in {@link #initialize()} and do their work in {@link #act()}.
 */
public abstract class AbstractWorker implements Worker {
    protected final ProjectMemory memory;
    protected final EventBus bus;
    private final String role;

    protected AbstractWorker(String role, ProjectMemory memory, EventBus bus) {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("worker role cannot be empty");
        }
        if (memory == null || bus == null) {
            throw new IllegalArgumentException("memory and bus are required for worker " + role);
        }
        this.role = role.trim();
        this.memory = memory;
        this.bus = bus;
    }

    @Override
    public final String role() {
        return role;
    }

    @Override
    public void initialize() {
    }

    protected void on(EventType type, EventHandler handler) {
        bus.subscribe(type, handler);
    }

    protected AgentContextPointer myPointer() {
        return memory.snapshot().pointerFor(role);
    }

    protected boolean isWorking() {
        return myPointer().currentlyWorkingOn().working();
    }

    protected void startWorking(String task, List<String> nextTasks) {
        AgentContextUpdate update = AgentContextUpdate.working(task);
        memory.updateAgentContext(role, nextTasks == null ? update : update.withNextTasks(nextTasks));
    }

    protected void finishWorking() {
        memory.updateAgentContext(role, AgentContextUpdate.idle());
    }

    protected AgentEvent emit(EventType type, EventPayload payload) {
        return bus.emit(type, role, payload);
    }

    protected AgentEvent emitFailure(String action, String error) {
        return emit(EventType.ACTION_FAILED, new ActionFailed(action, error));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + role + "]";
    }
}
