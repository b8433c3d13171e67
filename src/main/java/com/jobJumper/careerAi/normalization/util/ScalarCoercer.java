package com.jobJumper.careerAi.normalization.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.StringJoiner;

/**
 * Utility class for coercing arbitrary JSON values into display strings.
 *
 * Both methods are total over every {@link JsonNode} (including null, NullNode and
 * MissingNode) and never throw. Every typed record field that carries text is built
 * through them.
 */
public class ScalarCoercer {

    /**
     * Content fields tried, in order, when a mapping has to be rendered as a single string.
     */
    private static final String[] CONTENT_FIELDS = {"text", "value", "description"};

    private ScalarCoercer() {}

    /**
     * Coerces a JSON value into one display string.
     *
     * - null / absent -> ""
     * - string -> itself
     * - number -> canonical decimal text
     * - boolean -> "true" / "false"
     * - sequence -> space-joined coercion of each element, nested sequences flattened
     * - mapping -> first present of text / value / description, else its JSON text
     *
     * @param value Value to coerce, may be null
     * @return Display string, never null
     */
    public static String ensureString(JsonNode value) {
        StringJoiner joiner = new StringJoiner(" ");
        Deque<JsonNode> pending = new ArrayDeque<>();
        pending.push(resolveContent(value));

        // Explicit stack: nesting depth cannot exhaust the call stack.
        while (!pending.isEmpty()) {
            JsonNode node = pending.pop();
            if (node.isArray()) {
                if (node.isEmpty()) {
                    joiner.add("");
                    continue;
                }
                for (int i = node.size() - 1; i >= 0; i--) {
                    pending.push(resolveContent(node.get(i)));
                }
                continue;
            }
            joiner.add(scalarText(node));
        }
        return joiner.toString();
    }

    /**
     * Coerces a JSON value into an ordered list of display strings.
     * Anything other than a sequence yields an empty list.
     *
     * @param value Value to coerce, may be null
     * @return Mutable list, same order and length as the input sequence
     */
    public static List<String> ensureStringArray(JsonNode value) {
        if (value == null || !value.isArray()) {
            return new ArrayList<>();
        }
        List<String> result = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            result.add(ensureString(element));
        }
        return result;
    }

    /**
     * Same as {@link #ensureStringArray(JsonNode)} but keeps at most {@code max} elements.
     */
    public static List<String> ensureStringArray(JsonNode value, int max) {
        List<String> all = ensureStringArray(value);
        return all.size() > max ? new ArrayList<>(all.subList(0, max)) : all;
    }

    /**
     * @return true for Java null, NullNode and MissingNode
     */
    public static boolean isAbsent(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    /**
     * Replaces a mapping by its preferred content field until a non-mapping value
     * (or a mapping without any content field) is reached.
     */
    private static JsonNode resolveContent(JsonNode value) {
        JsonNode current = value;
        while (current != null && current.isObject()) {
            JsonNode content = contentField(current);
            if (content == null) {
                return current;
            }
            current = content;
        }
        return current != null ? current : MissingNode.getInstance();
    }

    private static JsonNode contentField(JsonNode mapping) {
        for (String field : CONTENT_FIELDS) {
            JsonNode candidate = mapping.get(field);
            if (!isAbsent(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static String scalarText(JsonNode node) {
        if (isAbsent(node)) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return numberText(node);
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "true" : "false";
        }
        if (node.isObject()) {
            // Diagnostic fallback: keep the raw structure inspectable.
            return node.toString();
        }
        // Binary and POJO nodes only appear in programmatically built trees.
        String text = node.asText();
        return text != null ? text : "";
    }

    private static String numberText(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.bigIntegerValue().toString();
        }
        double d = node.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return String.valueOf(d);
        }
        BigDecimal decimal = node.decimalValue().stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }
}
