package io.agentloom.bus;

import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;

/**
 * Typed publish/subscribe channel between workers. Delivery is best-effort and
 * at-most-once; callers must not depend on it for correctness.
 */
public interface EventBus extends AutoCloseable {

    void subscribe(EventType type, EventHandler handler);

    /**
     * Builds a new event with a fresh id and timestamp and delivers it.
     *
     * @throws IllegalArgumentException if {@code payload} is not the class {@code type} declares
     */
    AgentEvent emit(EventType type, String emittedBy, EventPayload payload);

    /**
     * Delivers events that arrived from other processes on the calling thread.
     * The coordinator calls this once per tick.
     *
     * @return number of events dispatched
     */
    default int dispatchPending() {
        return 0;
    }

    @Override
    default void close() {
    }
}
