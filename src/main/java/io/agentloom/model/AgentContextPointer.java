package io.agentloom.model;

import java.util.List;

public record AgentContextPointer(
        Activity currentlyWorkingOn,
        List<String> nextTasks,
        List<String> needsFromOthers
) {
    public AgentContextPointer {
        currentlyWorkingOn = currentlyWorkingOn == null ? Activity.idle() : currentlyWorkingOn;
        nextTasks = nextTasks == null ? List.of() : List.copyOf(nextTasks);
        needsFromOthers = needsFromOthers == null ? List.of() : List.copyOf(needsFromOthers);
    }

    public static AgentContextPointer empty() {
        return new AgentContextPointer(Activity.idle(), List.of(), List.of());
    }

    public AgentContextPointer merge(AgentContextUpdate update) {
        if (update == null) {
            return this;
        }
        return new AgentContextPointer(
                update.currentlyWorkingOn() == null ? currentlyWorkingOn : update.currentlyWorkingOn(),
                update.nextTasks() == null ? nextTasks : update.nextTasks(),
                update.needsFromOthers() == null ? needsFromOthers : update.needsFromOthers()
        );
    }
}
