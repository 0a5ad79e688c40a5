/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.CascadeOutcomeType;
import villagecompute.classifier.api.types.CascadeStage;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.HeuristicScoreType;
import villagecompute.classifier.api.types.ModelUsed;
import villagecompute.classifier.api.types.ParsedClassificationType;
import villagecompute.classifier.api.types.RawClassificationType;
import villagecompute.classifier.api.types.RetrievalContextType;
import villagecompute.classifier.api.types.StageErrorKind;
import villagecompute.classifier.api.types.StageErrorType;
import villagecompute.classifier.api.types.StageResultType;
import villagecompute.classifier.config.CascadeThresholds;
import villagecompute.classifier.exceptions.ModelUnavailableException;
import villagecompute.classifier.integration.ai.ModelHandle;
import villagecompute.classifier.integration.ai.ModelHandles;
import villagecompute.classifier.observability.ClassificationMetrics;
import villagecompute.classifier.observability.LoggingConfig;
import villagecompute.classifier.util.ClassificationResponseParser;

/**
 * Runs the classification cascade {@code Primary -> Fallback -> PatternBased} and returns the single accepted stage.
 *
 * <p>
 * <b>Acceptance:</b>
 * <ul>
 * <li>Primary legal model: stage confidence at or above {@code classifier.cascade.primary-acceptance} (0.70)</li>
 * <li>Fallback: the remote general-purpose endpoint first, then the local instance, each accepted at or above
 * {@code classifier.cascade.fallback-acceptance} (0.60)</li>
 * <li>Pattern-based rules: always accepted</li>
 * </ul>
 *
 * <p>
 * <b>Stage confidence</b> for model stages is the heuristic overall confidence of the parsed answer, so the model's own
 * claims never raise it. An answer that names no taxonomy category is kept as a zero-confidence result and rejected by
 * the threshold check; an answer whose document type cannot be mapped scores nothing for the type keywords and carries
 * {@link #FLAG_UNMAPPED_RESPONSE}.
 *
 * <p>
 * Every stage that was passed over is reported as a {@link StageErrorType} on the outcome. Any unexpected exception
 * switches to {@link #emergency}, which runs the pattern rules directly with {@link ModelUsed#EMERGENCY}.
 */
@ApplicationScoped
public class ClassifierCascadeService {

    private static final Logger LOG = Logger.getLogger(ClassifierCascadeService.class);

    public static final String FLAG_UNMAPPED_RESPONSE = "Model response did not map cleanly onto the taxonomy";

    @Inject
    ModelHandles modelHandles;

    @Inject
    ClassificationPromptBuilder promptBuilder;

    @Inject
    HeuristicScoringService scoringService;

    @Inject
    PatternClassificationService patternService;

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    @Inject
    CascadeThresholds thresholds;

    @Inject
    ClassificationMetrics metrics;

    /**
     * Classifies one document through the cascade.
     *
     * @param text
     *            document text, may be empty
     * @param filename
     *            source filename, used by the pattern rules
     * @param context
     *            retrieved context for the prompts
     * @return the accepted classification with the errors of every skipped stage, never null
     */
    public CascadeOutcomeType run(String text, String filename, RetrievalContextType context) {
        List<StageErrorType> stageErrors = new ArrayList<>();
        try {
            LoggingConfig.setCascadeStage(CascadeStage.PRIMARY.tagValue());
            String primaryPrompt = promptBuilder.buildPrimaryPrompt(text, context);
            StageResultType primary = attempt(modelHandles.primary(), CascadeStage.PRIMARY, ModelUsed.PRIMARY,
                    primaryPrompt, text);
            if (accepted(primary, modelHandles.primary(), thresholds.primaryAcceptance(), stageErrors)) {
                return outcome(primary, stageErrors);
            }

            LoggingConfig.setCascadeStage(CascadeStage.FALLBACK.tagValue());
            String fallbackPrompt = promptBuilder.buildFallbackPrompt(text, context);
            StageResultType remote = attempt(modelHandles.fallbackApi(), CascadeStage.FALLBACK,
                    ModelUsed.FALLBACK_API, fallbackPrompt, text);
            if (accepted(remote, modelHandles.fallbackApi(), thresholds.fallbackAcceptance(), stageErrors)) {
                return outcome(remote, stageErrors);
            }
            StageResultType local = attempt(modelHandles.fallbackLocal(), CascadeStage.FALLBACK, ModelUsed.FALLBACK,
                    fallbackPrompt, text);
            if (accepted(local, modelHandles.fallbackLocal(), thresholds.fallbackAcceptance(), stageErrors)) {
                return outcome(local, stageErrors);
            }

            LoggingConfig.setCascadeStage(CascadeStage.PATTERN_BASED.tagValue());
            RawClassificationType pattern = patternService.classify(text, filename, ModelUsed.PATTERN_BASED);
            LOG.infof("Accepted pattern-based classification %s / %s (%s) after %d skipped stage(s)",
                    pattern.category(), pattern.documentType(), pattern.stageConfidence().getLabel(),
                    stageErrors.size());
            return new CascadeOutcomeType(pattern, null, stageErrors, null);

        } catch (RuntimeException e) {
            return emergency(text, filename, stageErrors, e);
        }
    }

    /**
     * Classifies with the pattern rules after an unexpected failure.
     *
     * @param stageErrors
     *            errors collected before the failure
     * @param cause
     *            the failure, attached to the outcome as diagnostic text
     * @return emergency outcome
     */
    public CascadeOutcomeType emergency(String text, String filename, List<StageErrorType> stageErrors,
            Throwable cause) {
        LoggingConfig.setCascadeStage(CascadeStage.EMERGENCY.tagValue());
        LOG.errorf(cause, "Classification cascade failed, using emergency pattern classification");
        String diagnostic = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        RawClassificationType raw = patternService.classify(text, filename, ModelUsed.EMERGENCY);
        return new CascadeOutcomeType(raw, null, stageErrors, diagnostic);
    }

    /**
     * Calls one model and scores its answer. Model failures become failed stage results, never exceptions.
     */
    StageResultType attempt(ModelHandle handle, CascadeStage stage, ModelUsed modelUsed, String prompt, String text) {
        String response;
        try {
            response = handle.complete(prompt);
        } catch (ModelUnavailableException e) {
            LOG.warnf("Stage %s (%s) failed with %s: %s", stage.tagValue(), handle.getName(), e.getKind(),
                    e.getMessage());
            return StageResultType.failure(new StageErrorType(stage, handle.getName(), e.getKind(), e.getMessage()));
        }

        ParsedClassificationType parsed = ClassificationResponseParser.parse(response,
                taxonomyRegistry.categoryNames(), taxonomyRegistry.documentTypeNames(),
                taxonomyRegistry.defaultCategory(), taxonomyRegistry.defaultDocumentType());

        if (!parsed.categoryMatched()) {
            String message = response.isBlank() ? "Empty model response"
                    : "Model response named no taxonomy category";
            LOG.warnf("Stage %s (%s): %s", stage.tagValue(), handle.getName(), message);
            RawClassificationType raw = new RawClassificationType(parsed.category(), parsed.documentType(), 0.0,
                    modelUsed, response, parsed.reasoning(), ConfidenceLevel.UNCERTAIN);
            return new StageResultType(stage, raw, null,
                    new StageErrorType(stage, handle.getName(), StageErrorKind.UNUSABLE_RESPONSE, message));
        }

        HeuristicScoreType heuristic;
        if (parsed.documentTypeMatched()) {
            heuristic = scoringService.score(text, parsed.category(), parsed.documentType(), response);
        } else {
            heuristic = scoringService.score(text, parsed.category(), null, response)
                    .withFlag(FLAG_UNMAPPED_RESPONSE);
        }
        double confidence = scoringService.overallConfidence(heuristic);

        RawClassificationType raw = new RawClassificationType(parsed.category(), parsed.documentType(), confidence,
                modelUsed, response, parsed.reasoning(), null);
        LOG.debugf("Stage %s (%s) answered %s / %s with confidence %.2f", stage.tagValue(), handle.getName(),
                raw.category(), raw.documentType(), confidence);
        return StageResultType.success(stage, raw, heuristic);
    }

    private boolean accepted(StageResultType result, ModelHandle handle, double threshold,
            List<StageErrorType> stageErrors) {
        if (result.meets(threshold) && result.error() == null) {
            return true;
        }
        StageErrorType error = result.error();
        if (error == null) {
            RawClassificationType raw = result.classification();
            error = new StageErrorType(result.stage(), handle.getName(), StageErrorKind.BELOW_THRESHOLD,
                    String.format(Locale.ROOT, "Confidence %.2f below acceptance threshold %.2f",
                            raw.confidenceScore(), threshold));
            LOG.infof("Stage %s rejected: %s", result.stage().tagValue(), error.message());
        }
        stageErrors.add(error);
        metrics.recordStageFailure(error);
        return false;
    }

    private static CascadeOutcomeType outcome(StageResultType result, List<StageErrorType> stageErrors) {
        RawClassificationType raw = result.classification();
        LOG.infof("Accepted %s classification %s / %s with confidence %.2f", raw.modelUsed().getLabel(),
                raw.category(), raw.documentType(), raw.confidenceScore());
        return new CascadeOutcomeType(raw, result.heuristic(), stageErrors, null);
    }
}
