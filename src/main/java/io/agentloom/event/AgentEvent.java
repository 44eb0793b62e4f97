package io.agentloom.event;

import java.time.Instant;
import java.util.UUID;

public record AgentEvent(
        String id,
        EventType type,
        String emittedBy,
        EventPayload payload,
        Instant timestamp
) {
    public AgentEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("event id cannot be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("event type cannot be null");
        }
        if (!type.accepts(payload)) {
            throw new IllegalArgumentException(
                    "event " + type.wireName() + " expects payload " + type.payloadType().getSimpleName()
                            + " but got " + (payload == null ? "null" : payload.getClass().getSimpleName())
            );
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static AgentEvent create(EventType type, String emittedBy, EventPayload payload) {
        return new AgentEvent(UUID.randomUUID().toString(), type, emittedBy, payload, Instant.now());
    }

    public <P extends EventPayload> P payload(Class<P> expected) {
        if (!expected.isInstance(payload)) {
            throw new IllegalStateException(
                    "event " + type.wireName() + " carries " + payload.getClass().getSimpleName()
                            + ", not " + expected.getSimpleName()
            );
        }
        return expected.cast(payload);
    }
}
