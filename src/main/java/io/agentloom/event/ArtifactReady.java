package io.agentloom.event;

public record ArtifactReady(String artifact, String summary) implements EventPayload {
}
