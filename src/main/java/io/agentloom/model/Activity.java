package io.agentloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a worker is doing right now. Scheduling only looks at {@link #state()};
 * {@link #task()} is a free-text description for humans.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Activity(ActivityState state, String task) {
    private static final Activity IDLE = new Activity(ActivityState.IDLE, null);
    private static final String LEGACY_IDLE_TOKEN = "idle";
    private static final String LEGACY_IDLE_PLACEHOLDER = "Waiting for tasks...";

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Activity(@JsonProperty("state") ActivityState state, @JsonProperty("task") String task) {
        this.state = state == null ? ActivityState.IDLE : state;
        if (this.state == ActivityState.WORKING) {
            if (task == null || task.isBlank()) {
                throw new IllegalArgumentException("working activity needs a task description");
            }
            this.task = task.trim();
        } else {
            this.task = null;
        }
    }

    public static Activity idle() {
        return IDLE;
    }

    public static Activity working(String task) {
        return new Activity(ActivityState.WORKING, task);
    }

    /**
     * Older stored documents kept the pointer as a plain string where "", "idle" and
     * the dashboard placeholder all meant "not working".
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Activity fromLegacy(String raw) {
        if (raw == null) {
            return IDLE;
        }
        String value = raw.trim();
        if (value.isEmpty()
                || LEGACY_IDLE_TOKEN.equalsIgnoreCase(value)
                || LEGACY_IDLE_PLACEHOLDER.equalsIgnoreCase(value)) {
            return IDLE;
        }
        return working(value);
    }

    public boolean working() {
        return state == ActivityState.WORKING;
    }

    @Override
    public String toString() {
        return working() ? "WORKING(" + task + ")" : "IDLE";
    }
}
