package io.agentloom.event;

public record DocumentReady(String document, String summary) implements EventPayload {
}
