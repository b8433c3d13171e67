package com.jobJumper.careerAi.normalization.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Converts a sanitized JSON value into one fully populated typed record.
 *
 * Implementations must be total: {@link #validate(JsonNode)} accepts any value
 * (null, MissingNode, scalars, unrelated shapes), never throws, and never leaves
 * a field of the returned record null.
 *
 * @param <T> Record type produced
 */
public interface ResponseValidator<T> {

    /**
     * @return Short name of the record shape, used in logs and error messages
     */
    String getShapeName();

    /**
     * Domain-specific reshaping applied after sanitizing and before validation.
     *
     * @param sanitized Sanitized value
     * @return Normalized value; identity by default
     */
    default JsonNode normalize(JsonNode sanitized) {
        return sanitized;
    }

    /**
     * Builds the typed record, substituting the documented default for every
     * absent or mistyped field.
     *
     * @param value Value to validate, may be null
     * @return Fully populated record
     */
    T validate(JsonNode value);

    /**
     * Record returned when no JSON object could be located and the caller asked
     * for a substitute instead of an error.
     *
     * @param placeholder Placeholder text for the record's primary text field
     * @return Fully defaulted record
     */
    default T fallback(String placeholder) {
        return validate(MissingNode.getInstance());
    }
}
