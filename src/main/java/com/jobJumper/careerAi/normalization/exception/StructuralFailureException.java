package com.jobJumper.careerAi.normalization.exception;

/**
 * Exception thrown when no JSON object (or, for documents, no text) can be recovered
 * from model output and the caller asked for failures to propagate.
 */
public class StructuralFailureException extends RuntimeException {

    private final String shapeName;

    public StructuralFailureException(String shapeName, String message) {
        super(message);
        this.shapeName = shapeName;
    }

    public StructuralFailureException(String shapeName, String message, Throwable cause) {
        super(message, cause);
        this.shapeName = shapeName;
    }

    public String getShapeName() {
        return shapeName;
    }
}
