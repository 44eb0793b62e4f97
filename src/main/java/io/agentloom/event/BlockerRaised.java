package io.agentloom.event;

public record BlockerRaised(String description, String needsFrom) implements EventPayload {
}
