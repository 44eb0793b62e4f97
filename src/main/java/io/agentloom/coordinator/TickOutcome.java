package io.agentloom.coordinator;

import java.util.List;

public record TickOutcome(
        long iteration,
        int dispatchedEvents,
        String actedRole,
        List<String> skippedRoles,
        List<String> faultedRoles
) {
    public TickOutcome {
        skippedRoles = skippedRoles == null ? List.of() : List.copyOf(skippedRoles);
        faultedRoles = faultedRoles == null ? List.of() : List.copyOf(faultedRoles);
    }

    public boolean acted() {
        return actedRole != null;
    }
}
