package com.jobJumper.careerAi.generation.exception;

/**
 * Exception thrown when the text-generation service cannot be reached or rejects the call.
 * Distinct from a structural failure: no model text was received at all.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
