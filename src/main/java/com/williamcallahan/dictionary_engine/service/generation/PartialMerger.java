package com.williamcallahan.dictionary_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Folds partial generation payloads into one progressively filled document.
 *
 * Rules, applied per top-level field of the incoming payload:
 * - scalars and objects replace the previous value wholesale
 * - arrays replace the previous value only when non-empty
 * - null, empty text, empty arrays and empty objects never overwrite a populated field
 *
 * Neither argument is modified.
 */
@Component
public class PartialMerger {

    public ObjectNode merge(ObjectNode previous, ObjectNode incoming) {
        ObjectNode merged = previous != null ? previous.deepCopy() : JsonNodeFactory.instance.objectNode();
        if (incoming == null) {
            return merged;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = incoming.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            if (isBlank(value)) {
                // keep the key visible, never blank out content already shown
                if (!merged.has(field.getKey())) {
                    merged.set(field.getKey(), value.deepCopy());
                }
                continue;
            }
            merged.set(field.getKey(), value.deepCopy());
        }
        return merged;
    }

    /**
     * True when a value carries no content: empty text, empty array or empty object
     */
    public static boolean isBlank(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isTextual()) {
            return value.asText().isEmpty();
        }
        if (value.isContainerNode()) {
            return value.isEmpty();
        }
        return false;
    }
}
