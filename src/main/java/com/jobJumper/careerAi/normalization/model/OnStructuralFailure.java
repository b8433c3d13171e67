package com.jobJumper.careerAi.normalization.model;

/**
 * What a caller wants to happen when no JSON object can be recovered from model output.
 */
public enum OnStructuralFailure {

    /**
     * Throw {@link com.jobJumper.careerAi.normalization.exception.StructuralFailureException}.
     * Used where a defaulted answer would be misleading (scoring, fit analysis, tailoring, documents).
     */
    PROPAGATE,

    /**
     * Return a fully defaulted record carrying placeholder text.
     * Used where an empty panel is better than a broken one (interview prep, company research).
     */
    SUBSTITUTE_DEFAULT
}
