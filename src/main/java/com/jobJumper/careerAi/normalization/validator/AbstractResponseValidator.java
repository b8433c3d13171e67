package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.jobJumper.careerAi.normalization.model.SoftLabel;
import com.jobJumper.careerAi.normalization.util.ScalarCoercer;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Field accessors shared by the strict validators.
 *
 * Every accessor tolerates a null, non-object or otherwise unexpected parent and
 * returns the documented default: "" for text, an empty list for sequences,
 * 0 for numbers, OTHER/"" for soft labels.
 */
public abstract class AbstractResponseValidator<T> implements ResponseValidator<T> {

    /**
     * @return The named field, or MissingNode when the parent is not a mapping
     */
    protected JsonNode field(JsonNode parent, String name) {
        if (parent == null || !parent.isObject()) {
            return MissingNode.getInstance();
        }
        return parent.path(name);
    }

    /**
     * @return The named field when it is a mapping, MissingNode otherwise
     */
    protected JsonNode object(JsonNode parent, String name) {
        JsonNode value = field(parent, name);
        return value.isObject() ? value : MissingNode.getInstance();
    }

    protected String text(JsonNode parent, String name) {
        return ScalarCoercer.ensureString(field(parent, name));
    }

    protected List<String> texts(JsonNode parent, String name) {
        return ScalarCoercer.ensureStringArray(field(parent, name));
    }

    protected List<String> texts(JsonNode parent, String name, int max) {
        return ScalarCoercer.ensureStringArray(field(parent, name), max);
    }

    /**
     * Text of a sequence element: the named field when the element is a mapping,
     * the coerced element itself otherwise (a bare string stands for the primary field).
     */
    protected String primaryText(JsonNode element, String name) {
        if (element != null && element.isObject()) {
            return text(element, name);
        }
        return ScalarCoercer.ensureString(element);
    }

    /**
     * Numeric fields are type-checked, never parsed from strings.
     *
     * @return Rounded value when the field is a JSON number, 0 otherwise
     */
    protected int wholeNumber(JsonNode parent, String name) {
        JsonNode value = field(parent, name);
        if (!value.isNumber()) {
            return 0;
        }
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return 0;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, Math.round(d)));
    }

    /**
     * @return Value when the field is a finite JSON number, 0 otherwise
     */
    protected double decimal(JsonNode parent, String name) {
        JsonNode value = field(parent, name);
        if (!value.isNumber()) {
            return 0;
        }
        double d = value.doubleValue();
        return Double.isFinite(d) ? d : 0;
    }

    protected <E extends Enum<E>> SoftLabel<E> label(JsonNode parent, String name, Class<E> type) {
        JsonNode value = field(parent, name);
        if (ScalarCoercer.isAbsent(value)) {
            return SoftLabel.absent(type);
        }
        return SoftLabel.parse(ScalarCoercer.ensureString(value), type);
    }

    /**
     * Validates each element of a sequence field independently.
     *
     * @param max Maximum number of elements kept, in original order
     * @return Validated elements; empty when the field is not a sequence
     */
    protected <R> List<R> elements(JsonNode parent, String name, Function<JsonNode, R> elementValidator, int max) {
        JsonNode value = field(parent, name);
        List<R> result = new ArrayList<>();
        if (!value.isArray()) {
            return result;
        }
        for (JsonNode element : value) {
            if (result.size() >= max) {
                break;
            }
            result.add(elementValidator.apply(element));
        }
        return result;
    }

    protected <R> List<R> elements(JsonNode parent, String name, Function<JsonNode, R> elementValidator) {
        return elements(parent, name, elementValidator, Integer.MAX_VALUE);
    }
}
