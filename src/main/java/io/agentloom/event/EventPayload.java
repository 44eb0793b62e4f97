package io.agentloom.event;

/**
 * Marker for the payload records carried by {@link AgentEvent}. Each
 * {@link EventType} accepts exactly one implementation.
 */
public interface EventPayload {
}
