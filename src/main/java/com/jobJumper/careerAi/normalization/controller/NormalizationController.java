package com.jobJumper.careerAi.normalization.controller;

import com.jobJumper.careerAi.normalization.dto.NormalizeRequest;
import com.jobJumper.careerAi.normalization.exception.UnknownShapeException;
import com.jobJumper.careerAi.normalization.model.DocumentKind;
import com.jobJumper.careerAi.normalization.model.GeneratedDocument;
import com.jobJumper.careerAi.normalization.model.OnStructuralFailure;
import com.jobJumper.careerAi.normalization.service.ResponseNormalizationService;
import com.jobJumper.careerAi.normalization.validator.ResponseValidator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Normalization REST controller - runs the pipeline on model text the client already has,
 * without calling the model.
 */
@RestController
@RequestMapping("/api/v1/normalize")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
public class NormalizationController {

    private final ResponseNormalizationService normalizationService;
    private final Map<String, ResponseValidator<?>> validatorsByShape;

    public NormalizationController(ResponseNormalizationService normalizationService,
                                   List<ResponseValidator<?>> validators) {
        this.normalizationService = normalizationService;
        this.validatorsByShape = validators.stream()
                .collect(Collectors.toMap(ResponseValidator::getShapeName, Function.identity()));
    }

    /**
     * @param shape Record shape name (match-score, job-fit, company-research, interview-prep, resume)
     * @param policy Structural-failure policy, PROPAGATE by default
     */
    @PostMapping("/{shape}")
    public ResponseEntity<Object> normalize(
            @PathVariable("shape") String shape,
            @RequestParam(value = "policy", defaultValue = "PROPAGATE") OnStructuralFailure policy,
            @RequestBody NormalizeRequest request) {

        ResponseValidator<?> validator = validatorsByShape.get(shape);
        if (validator == null) {
            throw new UnknownShapeException("Unknown record shape: " + shape);
        }
        Object record = normalizationService.normalize(request.getRawText(), validator, policy);
        return ResponseEntity.ok(record);
    }

    /**
     * @param kind Document kind, e.g. cover-letter
     */
    @PostMapping("/document/{kind}")
    public ResponseEntity<GeneratedDocument> normalizeDocument(
            @PathVariable("kind") String kind,
            @RequestParam(value = "policy", defaultValue = "PROPAGATE") OnStructuralFailure policy,
            @RequestBody NormalizeRequest request) {

        DocumentKind documentKind = Arrays.stream(DocumentKind.values())
                .filter(k -> k.name().equalsIgnoreCase(kind.replace('-', '_')))
                .findFirst()
                .orElseThrow(() -> new UnknownShapeException("Unknown document kind: " + kind));
        return ResponseEntity.ok(normalizationService.normalizeDocument(request.getRawText(), documentKind, policy));
    }
}
