package com.jobJumper.careerAi.normalization.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a required skill is covered by the candidate. Strict: unknown values become MISSING.
 */
public enum SkillStatus {

    MATCHED("matched"),
    MISSING("missing");

    private final String literal;

    SkillStatus(String literal) {
        this.literal = literal;
    }

    @JsonValue
    public String getLiteral() {
        return literal;
    }

    /**
     * @param raw Model-supplied status, may be null
     * @return MATCHED only for an exact (trimmed, case-insensitive) "matched"; MISSING otherwise
     */
    public static SkillStatus fromLiteral(String raw) {
        if (raw != null && MATCHED.literal.equalsIgnoreCase(raw.trim())) {
            return MATCHED;
        }
        return MISSING;
    }
}
