package com.jobJumper.careerAi.normalization.json;

/**
 * Kinds of structural failure reported by {@link JsonLocator}.
 */
public enum ParseError {

    /**
     * No JSON object could be located in the text, or every candidate span failed to parse.
     */
    UNPARSABLE
}
