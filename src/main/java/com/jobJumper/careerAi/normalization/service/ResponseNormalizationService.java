package com.jobJumper.careerAi.normalization.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.jobJumper.careerAi.normalization.exception.StructuralFailureException;
import com.jobJumper.careerAi.normalization.json.JsonLocator;
import com.jobJumper.careerAi.normalization.json.LocateResult;
import com.jobJumper.careerAi.normalization.model.DocumentKind;
import com.jobJumper.careerAi.normalization.model.GeneratedDocument;
import com.jobJumper.careerAi.normalization.model.OnStructuralFailure;
import com.jobJumper.careerAi.normalization.util.FenceStripper;
import com.jobJumper.careerAi.normalization.validator.ResponseValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Service for turning raw model text into typed, UI-safe records.
 *
 * Pipeline:
 * - LOCATE - find and parse the JSON object inside the text
 * - SANITIZE - clean markdown/prose noise out of every string leaf
 * - NORMALIZE - shape-specific reshaping (e.g. resume bullet descriptions)
 * - VALIDATE - build the typed record with documented defaults
 *
 * Only one outcome can escape: a {@link StructuralFailureException} when nothing could be
 * located and the caller passed {@link OnStructuralFailure#PROPAGATE}. Field-level drift is
 * always absorbed by the validators.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResponseNormalizationService {

    private final JsonLocator jsonLocator;
    private final TextSanitizer textSanitizer;

    @Value("${normalization.failure-placeholder:Failed to generate.}")
    private String failurePlaceholder = "Failed to generate.";

    /**
     * Runs the full pipeline for one record shape.
     *
     * @param rawText Raw model text, may be null
     * @param validator Validator for the expected record shape
     * @param policy What to do when no JSON object can be located
     * @return Fully populated record
     * @throws StructuralFailureException only when the policy is PROPAGATE and nothing was located
     */
    public <T> T normalize(String rawText, ResponseValidator<T> validator, OnStructuralFailure policy) {
        String shape = validator.getShapeName();
        log.debug("Step LOCATE - shape: {}, text length: {}", shape, rawText != null ? rawText.length() : 0);

        LocateResult located = jsonLocator.locate(rawText);
        if (!located.isFound()) {
            return onStructuralFailure(validator, policy, located.getDetail(), null);
        }

        try {
            log.debug("Step SANITIZE - shape: {}", shape);
            JsonNode sanitized = textSanitizer.sanitize(located.getValue());

            log.debug("Step NORMALIZE - shape: {}", shape);
            JsonNode normalized = validator.normalize(sanitized);

            log.debug("Step VALIDATE - shape: {}", shape);
            return validator.validate(normalized);
        } catch (RuntimeException e) {
            log.error("Unexpected error normalizing response - shape: {}, error: {}", shape, e.getMessage(), e);
            return onStructuralFailure(validator, policy, "normalization failed: " + e.getMessage(), e);
        }
    }

    /**
     * Cleans a free-text document. Blank text after cleanup counts as a structural failure.
     *
     * @param rawText Raw model text, may be null
     * @param kind Document kind, provides the substitute placeholder
     * @param policy What to do when no text remains
     * @return Cleaned document
     * @throws StructuralFailureException only when the policy is PROPAGATE and no text remains
     */
    public GeneratedDocument normalizeDocument(String rawText, DocumentKind kind, OnStructuralFailure policy) {
        String content = FenceStripper.strip(rawText);
        if (!content.isBlank()) {
            return GeneratedDocument.builder()
                    .kind(kind)
                    .content(content)
                    .build();
        }

        String shape = "document:" + kind.name().toLowerCase();
        if (policy == OnStructuralFailure.PROPAGATE) {
            log.warn("Structural failure, propagating - shape: {}, detail: empty document text", shape);
            throw new StructuralFailureException(shape, "Model returned no usable text for " + shape);
        }
        log.warn("Structural failure, substituting placeholder - shape: {}", shape);
        return GeneratedDocument.builder()
                .kind(kind)
                .content(kind.getFailurePlaceholder())
                .build();
    }

    private <T> T onStructuralFailure(ResponseValidator<T> validator, OnStructuralFailure policy,
                                      String detail, Throwable cause) {
        String shape = validator.getShapeName();
        if (policy == OnStructuralFailure.PROPAGATE) {
            log.warn("Structural failure, propagating - shape: {}, detail: {}", shape, detail);
            String message = "No usable " + shape + " result in model response: " + detail;
            throw cause != null
                    ? new StructuralFailureException(shape, message, cause)
                    : new StructuralFailureException(shape, message);
        }
        log.warn("Structural failure, substituting defaults - shape: {}, detail: {}", shape, detail);
        return validator.fallback(failurePlaceholder);
    }
}
