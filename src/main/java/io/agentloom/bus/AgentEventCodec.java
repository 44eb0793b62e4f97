package io.agentloom.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import io.agentloom.util.Jsons;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON wire form of {@link AgentEvent}:
 * {@code {"id", "type", "emittedBy", "payload", "timestamp"}} with the timestamp as
 * an ISO-8601 string. The payload class is chosen by {@code type}.
 */
public final class AgentEventCodec {

    private AgentEventCodec() {
    }

    public static String encode(AgentEvent event) {
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("id", event.id());
        root.put("type", event.type().wireName());
        root.put("emittedBy", event.emittedBy());
        root.set("payload", Jsons.mapper().valueToTree(event.payload()));
        root.put("timestamp", event.timestamp().toString());
        return Jsons.toCompactJson(root);
    }

    /**
     * @throws IllegalArgumentException when the message is not a well-formed event
     */
    public static AgentEvent decode(String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("empty event message");
        }
        try {
            JsonNode root = Jsons.mapper().readTree(message);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("event message is not a JSON object");
            }
            EventType type = EventType.fromString(requiredText(root, "type"));
            JsonNode payloadNode = root.get("payload");
            if (payloadNode == null || payloadNode.isNull()) {
                throw new IllegalArgumentException("event " + type.wireName() + " has no payload");
            }
            EventPayload payload = Jsons.mapper().treeToValue(payloadNode, type.payloadType());
            Instant timestamp = Instant.parse(requiredText(root, "timestamp"));
            return new AgentEvent(
                    requiredText(root, "id"),
                    type,
                    root.path("emittedBy").asText(""),
                    payload,
                    timestamp
            );
        } catch (JsonProcessingException | DateTimeParseException e) {
            throw new IllegalArgumentException("malformed event message: " + e.getMessage(), e);
        }
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new IllegalArgumentException("event field missing: " + field);
        }
        return node.asText();
    }
}
