package io.agentloom.worker;

import io.agentloom.event.ActionFailed;
import io.agentloom.model.ProjectState;

/**
 * Produces a free-text guideline proposal for a failed action, typically by asking a
 * language model. The text should contain a JSON object with {@code trigger},
 * {@code condition} and {@code rule}.
 */
@FunctionalInterface
public interface GuidelineSource {
    String propose(ActionFailed failure, ProjectState snapshot) throws Exception;
}
