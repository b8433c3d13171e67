package com.jobJumper.careerAi.normalization.model;

/**
 * Risk or severity label (soft enum, see {@link SoftLabel}).
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    OTHER
}
