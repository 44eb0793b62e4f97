package io.agentloom.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    USER_IDEA_SUBMITTED("user_idea_submitted", IdeaSubmitted.class),

    REQUIREMENTS_READY("requirements_ready", DocumentReady.class),
    REQUIREMENTS_REVIEW_NEEDED("requirements_review_needed", DocumentReady.class),
    REQUIREMENTS_APPROVED("requirements_approved", DocumentReady.class),
    REQUIREMENTS_CHANGED("requirements_changed", DocumentReady.class),

    UX_DESIGN_READY("ux_design_ready", DocumentReady.class),
    DESIGN_SYSTEM_UPDATED("design_system_updated", DocumentReady.class),
    SYSTEM_ARCHITECTURE_READY("system_architecture_ready", DocumentReady.class),

    API_CONTRACT_DEFINED("api_contract_defined", DocumentReady.class),
    API_CONTRACT_CHANGED("api_contract_changed", DocumentReady.class),
    FRONTEND_COMPONENT_READY("frontend_component_ready", ArtifactReady.class),
    BACKEND_ENDPOINT_READY("backend_endpoint_ready", ArtifactReady.class),
    BFF_LAYER_READY("bff_layer_ready", ArtifactReady.class),

    UNIT_TESTS_PASSING("unit_tests_passing", TestReport.class),
    INTEGRATION_TESTS_PASSING("integration_tests_passing", TestReport.class),
    E2E_TESTS_READY("e2e_tests_ready", TestReport.class),

    BLOCKER_RAISED("blocker_raised", BlockerRaised.class),
    CLARIFICATION_NEEDED("clarification_needed", BlockerRaised.class),
    DEPENDENCY_REQUEST("dependency_request", BlockerRaised.class),

    ACTION_FAILED("action_failed", ActionFailed.class),
    QUALITY_CHECK_FAILED("quality_check_failed", ActionFailed.class),
    NEW_GUIDELINE("new_guideline", GuidelineAdded.class);

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    EventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    public boolean accepts(EventPayload payload) {
        return payload != null && payloadType.isInstance(payload);
    }

    @JsonCreator
    public static EventType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be empty");
        }
        String value = raw.trim();
        for (EventType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown event type: " + raw);
    }
}
