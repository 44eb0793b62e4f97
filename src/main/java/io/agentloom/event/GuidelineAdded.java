package io.agentloom.event;

import io.agentloom.model.Guideline;

public record GuidelineAdded(Guideline guideline) implements EventPayload {
}
