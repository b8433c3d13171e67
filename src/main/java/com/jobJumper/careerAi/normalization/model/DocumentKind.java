package com.jobJumper.careerAi.normalization.model;

/**
 * Free-text documents produced by the model, with the placeholder shown when
 * generation fails and the caller asked for a substitute instead of an error.
 */
public enum DocumentKind {

    COVER_LETTER("Failed to generate cover letter."),
    INTERVIEW_GUIDE("Failed to generate interview guide."),
    NEGOTIATION_STRATEGY("Failed to generate negotiation strategy."),
    RESUME_SECTION("Failed to generate."),
    CHAT_REPLY("I didn't catch that. Could you say it again?");

    private final String failurePlaceholder;

    DocumentKind(String failurePlaceholder) {
        this.failurePlaceholder = failurePlaceholder;
    }

    public String getFailurePlaceholder() {
        return failurePlaceholder;
    }
}
