package io.agentloom.model;

import java.time.Instant;

public record ProjectSummary(String id, String name, Instant lastUpdated) {
    public static final String UNTITLED = "Untitled Project";

    public static ProjectSummary of(ProjectState state) {
        String name = state.projectName() == null || state.projectName().isBlank()
                ? UNTITLED
                : state.projectName();
        return new ProjectSummary(state.projectId(), name, state.lastUpdated());
    }
}
