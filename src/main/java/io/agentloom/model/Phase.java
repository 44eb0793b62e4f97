package io.agentloom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Phase {
    IDEATION("ideation"),
    REQUIREMENTS("requirements"),
    DESIGN("design"),
    DEVELOPMENT("development"),
    TESTING("testing"),
    DEPLOYMENT("deployment");

    private final String wireName;

    Phase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Phase fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Phase cannot be empty");
        }
        String value = raw.trim();
        for (Phase phase : values()) {
            if (phase.wireName.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + raw);
    }
}
