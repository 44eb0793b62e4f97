package io.agentloom.event;

@FunctionalInterface
public interface EventHandler {
    void handle(AgentEvent event);
}
