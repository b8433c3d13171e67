package com.jobJumper.careerAi.normalization.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Result of locating a JSON object inside raw model text.
 * Either holds the parsed value or a {@link ParseError} with a human-readable detail.
 */
public class LocateResult {

    private final JsonNode value;
    private final ParseError error;
    private final String detail;

    private LocateResult(JsonNode value, ParseError error, String detail) {
        this.value = value;
        this.error = error;
        this.detail = detail;
    }

    public static LocateResult found(JsonNode value) {
        return new LocateResult(value, null, null);
    }

    public static LocateResult unparsable(String detail) {
        return new LocateResult(null, ParseError.UNPARSABLE, detail);
    }

    public boolean isFound() {
        return error == null;
    }

    /**
     * @return The located value, or {@link MissingNode} when nothing was found
     */
    public JsonNode getValue() {
        return value != null ? value : MissingNode.getInstance();
    }

    public ParseError getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isFound() ? "LocateResult[found]" : "LocateResult[" + error + ": " + detail + "]";
    }
}
