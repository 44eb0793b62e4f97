package io.agentloom.event;

public record IdeaSubmitted(String idea) implements EventPayload {
}
