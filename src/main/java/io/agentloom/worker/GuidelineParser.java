package io.agentloom.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentloom.model.Guideline;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Pulls a {@link Guideline} out of model output that may wrap the JSON in prose or
 * code fences.
 */
public final class GuidelineParser {
    private static final Logger log = LoggerFactory.getLogger(GuidelineParser.class);

    private GuidelineParser() {
    }

    public static Optional<Guideline> parse(String raw) {
        Optional<String> json = firstJsonObject(raw);
        if (json.isEmpty()) {
            log.warn("Guideline proposal contains no JSON object");
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(json.get());
        } catch (JsonProcessingException e) {
            log.warn("Guideline proposal is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        String trigger = text(node, "trigger");
        String condition = text(node, "condition");
        String rule = text(node, "rule");
        if (trigger == null || condition == null || rule == null) {
            log.warn("Guideline proposal missing trigger, condition or rule: {}", json.get());
            return Optional.empty();
        }
        return Optional.of(new Guideline(trigger, condition, rule));
    }

    /**
     * First balanced {@code {...}} block, skipping braces inside string literals.
     */
    static Optional<String> firstJsonObject(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int start = raw.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(raw, start);
            if (end > start) {
                return Optional.of(raw.substring(start, end + 1));
            }
            start = raw.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int matchingBrace(String raw, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
