package com.jobJumper.careerAi.normalization.model;

/**
 * Interview question difficulty (soft enum, see {@link SoftLabel}).
 */
public enum Difficulty {
    EASY,
    MEDIUM,
    HARD,
    OTHER
}
