package com.jobJumper.careerAi.normalization.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobJumper.careerAi.normalization.util.FenceStripper;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Walks a located JSON value and cleans markdown/prose noise out of every string leaf.
 *
 * The returned tree is a new tree with the same shape as the input: sequences keep their
 * length and order, mappings keep their keys, and null, boolean and number leaves are
 * carried over unchanged. Code fences are not handled here; they are removed at locate time.
 */
@Component
public class TextSanitizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * Sanitizes every string leaf of the given value.
     *
     * @param value Located value, may be null
     * @return Sanitized copy; MissingNode for null input
     */
    public JsonNode sanitize(JsonNode value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        if (value.isTextual()) {
            return NODES.textNode(FenceStripper.cleanText(value.textValue()));
        }
        if (value.isArray()) {
            ArrayNode copy = NODES.arrayNode(value.size());
            for (JsonNode element : value) {
                copy.add(sanitize(element));
            }
            return copy;
        }
        if (value.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), sanitize(field.getValue()));
            }
            return copy;
        }
        return value;
    }
}
