package io.agentrelay.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentrelay.util.Jsons;

import java.util.Optional;

/**
 * Placeholder carried in {@code data} when the real result lives in the result store:
 * {@code {"$overflowRef": "<reference>"}}.
 */
public final class OverflowReference {
    public static final String FIELD = "$overflowRef";

    private OverflowReference() {
    }

    public static ObjectNode of(String reference) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put(FIELD, reference);
        return node;
    }

    public static Optional<String> referenceOf(JsonNode data) {
        if (data == null || !data.isObject() || data.size() != 1) {
            return Optional.empty();
        }
        JsonNode ref = data.get(FIELD);
        if (ref == null || !ref.isTextual() || ref.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(ref.asText());
    }
}
