package io.agentloom.event;

public record ActionFailed(String action, String error) implements EventPayload {
}
