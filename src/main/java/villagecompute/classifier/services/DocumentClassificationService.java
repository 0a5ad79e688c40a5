/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import villagecompute.classifier.api.types.CascadeOutcomeType;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.ModelUsed;
import villagecompute.classifier.api.types.RetrievalContextType;
import villagecompute.classifier.api.types.ValidatorOutcomeType;
import villagecompute.classifier.exceptions.EmbeddingUnavailableException;
import villagecompute.classifier.observability.ClassificationMetrics;
import villagecompute.classifier.observability.LoggingConfig;

/**
 * Entry point of the classification engine.
 *
 * <p>
 * Data flow: text, retrieval context, cascade, validator, combiner. {@link #classify(String, String)} is total: it
 * never throws and always returns a result. An unreachable embedding server only drops the retrieval context; the
 * cascade still runs without grounding. Any other failure outside the cascade (validator, combiner) is handled like a
 * cascade failure by running the pattern rules as the emergency stage. If even that fails, or the combined result
 * breaks its bean constraints, the {@link ClassificationResultType#NO_MATCH_CATEGORY} sentinel is returned for
 * review.
 *
 * <p>
 * Each call runs with {@code classification_id} and {@code document_name} in the logging MDC.
 */
@ApplicationScoped
public class DocumentClassificationService {

    private static final Logger LOG = Logger.getLogger(DocumentClassificationService.class);

    @Inject
    ContextRetrievalService contextRetrievalService;

    @Inject
    ClassifierCascadeService cascadeService;

    @Inject
    ValidationService validationService;

    @Inject
    ResultCombinerService resultCombinerService;

    @Inject
    ClassificationMetrics metrics;

    @Inject
    Validator validator;

    /**
     * Classifies one document.
     *
     * @param text
     *            extracted document text; null and empty are accepted and degrade the result
     * @param filename
     *            source filename, may be null
     * @return classification result, never null
     */
    public ClassificationResultType classify(String text, String filename) {
        long start = System.nanoTime();
        String safeText = text == null ? "" : text;
        String safeName = filename == null ? "" : filename;

        LoggingConfig.enrichWithTraceContext();
        LoggingConfig.setClassificationId(UUID.randomUUID().toString());
        LoggingConfig.setDocumentName(safeName);
        try {
            ClassificationResultType result;
            try {
                result = classifyDocument(safeText, safeName);
            } catch (RuntimeException e) {
                result = emergencyResult(safeText, safeName, e);
            }
            result = checked(result);
            record(result, Duration.ofNanos(System.nanoTime() - start));
            return result;
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private ClassificationResultType classifyDocument(String text, String filename) {
        LOG.debugf("Classifying %s (%d chars)", filename, text.length());
        RetrievalContextType context;
        try {
            context = contextRetrievalService.retrieve(text);
        } catch (EmbeddingUnavailableException e) {
            LOG.warnf("Retrieval context unavailable for %s, classifying without it: %s", filename, e.getMessage());
            context = RetrievalContextType.empty();
        }
        CascadeOutcomeType outcome = cascadeService.run(text, filename, context);

        ValidatorOutcomeType validation = outcome.isEmergency()
                ? ValidatorOutcomeType.unavailable("Skipped after emergency classification")
                : validationService.validate(text, outcome.accepted().category(), outcome.accepted().documentType());

        return resultCombinerService.combine(text, filename, outcome, validation);
    }

    private ClassificationResultType emergencyResult(String text, String filename, RuntimeException cause) {
        try {
            CascadeOutcomeType outcome = cascadeService.emergency(text, filename, List.of(), cause);
            return resultCombinerService.combine(text, filename, outcome,
                    ValidatorOutcomeType.unavailable("Skipped after emergency classification"));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Emergency classification failed for %s, returning unclassified result", filename);
            return noMatch(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }
    }

    private ClassificationResultType checked(ClassificationResultType result) {
        Set<ConstraintViolation<ClassificationResultType>> violations = validator.validate(result);
        if (violations.isEmpty()) {
            return result;
        }
        String detail = violations.stream().map(v -> v.getPropertyPath() + " " + v.getMessage()).sorted()
                .collect(Collectors.joining(", "));
        LOG.errorf("Discarding invalid classification result for document type %s: %s", result.documentType(),
                detail);
        return noMatch("Invalid classification result: " + detail);
    }

    static ClassificationResultType noMatch(String diagnosticError) {
        return new ClassificationResultType(ClassificationResultType.NO_MATCH_DOCUMENT_TYPE,
                ClassificationResultType.NO_MATCH_CATEGORY, ConfidenceLevel.UNCERTAIN, 0.0,
                "No stage could classify the document", Set.of(), List.of(), true, ModelUsed.EMERGENCY,
                ConfidenceLevel.UNCERTAIN, List.of(), ValidatorOutcomeType.unavailable("Not run"), diagnosticError);
    }

    private void record(ClassificationResultType result, Duration duration) {
        try {
            metrics.recordClassification(result, duration);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not record classification metrics");
        }
    }
}
