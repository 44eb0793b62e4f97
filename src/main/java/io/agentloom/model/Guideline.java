package io.agentloom.model;

public record Guideline(String trigger, String condition, String rule) {
    public Guideline {
        trigger = requireText(trigger, "trigger");
        condition = requireText(condition, "condition");
        rule = requireText(rule, "rule");
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("guideline " + field + " cannot be empty");
        }
        return value.trim();
    }
}
