package com.jobJumper.careerAi.normalization.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobJumper.careerAi.normalization.util.FenceStripper;
import com.jobJumper.careerAi.normalization.util.ScalarCoercer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Domain normalizers for resume-like values.
 *
 * Must run after {@link TextSanitizer}: the bullet decision below relies on "-"/"*"
 * list markers having already been rewritten to "•".
 */
@Component
public class DescriptionNormalizer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static final String DESCRIPTION_FIELD = "description";
    static final String SKILLS_FIELD = "skills";

    private static final String BULLET_PREFIX = FenceStripper.BULLET + " ";

    /**
     * Joins every sequence-valued "description" field (at any depth) into a single
     * newline-separated string with one "• " bullet per line.
     * Blank lines are dropped rather than kept as bare bullets.
     * Non-sequence descriptions are left as they are.
     *
     * @param value Sanitized value, may be null
     * @return Normalized copy
     */
    public JsonNode normalizeDescriptions(JsonNode value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        if (value.isArray()) {
            ArrayNode copy = NODES.arrayNode(value.size());
            for (JsonNode element : value) {
                copy.add(normalizeDescriptions(element));
            }
            return copy;
        }
        if (value.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode fieldValue = field.getValue();
                if (DESCRIPTION_FIELD.equals(field.getKey()) && fieldValue.isArray()) {
                    copy.put(field.getKey(), joinBullets(fieldValue));
                } else {
                    copy.set(field.getKey(), normalizeDescriptions(fieldValue));
                }
            }
            return copy;
        }
        return value;
    }

    /**
     * Joins a top-level "skills" sequence into one comma-separated string.
     *
     * @param value Sanitized value, may be null
     * @return Value with skills flattened; other fields untouched
     */
    public JsonNode normalizeSkills(JsonNode value) {
        if (value == null || !value.isObject()) {
            return value != null ? value : MissingNode.getInstance();
        }
        JsonNode skills = value.get(SKILLS_FIELD);
        if (skills == null || !skills.isArray()) {
            return value;
        }
        List<String> names = new ArrayList<>();
        for (String skill : ScalarCoercer.ensureStringArray(skills)) {
            if (!skill.isBlank()) {
                names.add(skill.trim());
            }
        }
        ObjectNode copy = ((ObjectNode) value).deepCopy();
        copy.put(SKILLS_FIELD, String.join(", ", names));
        return copy;
    }

    private String joinBullets(JsonNode lines) {
        List<String> bulleted = new ArrayList<>();
        for (String line : ScalarCoercer.ensureStringArray(lines)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            bulleted.add(trimmed.startsWith(FenceStripper.BULLET) ? trimmed : BULLET_PREFIX + trimmed);
        }
        return String.join("\n", bulleted);
    }
}
