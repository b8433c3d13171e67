package com.jobJumper.careerAi.normalization.model;

/**
 * Sentiment of an employee quote (soft enum, see {@link SoftLabel}).
 */
public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE,
    MIXED,
    OTHER
}
