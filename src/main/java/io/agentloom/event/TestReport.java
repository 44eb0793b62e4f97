package io.agentloom.event;

public record TestReport(String summary, String details) implements EventPayload {
}
