package io.agentloom.model;

import java.util.List;

/**
 * Partial pointer update. Null components keep the stored value.
 */
public record AgentContextUpdate(
        Activity currentlyWorkingOn,
        List<String> nextTasks,
        List<String> needsFromOthers
) {
    public static AgentContextUpdate working(String task) {
        return new AgentContextUpdate(Activity.working(task), null, null);
    }

    public static AgentContextUpdate idle() {
        return new AgentContextUpdate(Activity.idle(), null, null);
    }

    public AgentContextUpdate withNextTasks(List<String> tasks) {
        return new AgentContextUpdate(currentlyWorkingOn, tasks, needsFromOthers);
    }

    public AgentContextUpdate withNeedsFromOthers(List<String> needs) {
        return new AgentContextUpdate(currentlyWorkingOn, nextTasks, needs);
    }
}
