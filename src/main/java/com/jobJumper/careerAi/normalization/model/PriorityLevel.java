package com.jobJumper.careerAi.normalization.model;

/**
 * Priority label (soft enum, see {@link SoftLabel}).
 */
public enum PriorityLevel {
    HIGH,
    MEDIUM,
    LOW,
    OTHER
}
