package com.jobJumper.careerAi.normalization.exception;

/**
 * Exception thrown when a requested record shape or document kind does not exist.
 */
public class UnknownShapeException extends RuntimeException {

    public UnknownShapeException(String message) {
        super(message);
    }
}
