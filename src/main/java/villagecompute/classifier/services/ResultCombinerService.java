/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.AlternativeClassificationType;
import villagecompute.classifier.api.types.CascadeOutcomeType;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.HeuristicScoreType;
import villagecompute.classifier.api.types.RawClassificationType;
import villagecompute.classifier.api.types.ValidatorOutcomeType;

/**
 * Merges the accepted cascade answer, its heuristic score and the validator outcome into the final result.
 *
 * <p>
 * <b>Confidence:</b> model stages already carry the heuristic overall confidence of their answer and reuse it. Pattern
 * and emergency answers are scored here: keyword confidence plus the structure, legal-formatting and length bonuses,
 * minus the OCR and per-flag penalties, clamped to [0,1].
 *
 * <p>
 * <b>Human review</b> is required when any of these holds:
 * <ul>
 * <li>confidence level is Low or Uncertain</li>
 * <li>more than two scoring flags</li>
 * <li>OCR damage was detected</li>
 * </ul>
 * Validator disagreement is added to the flags as an advisory note and counts toward neither the penalty nor the
 * review rule.
 *
 * <p>
 * Successful non-emergency results are stored as past documents. Storage failures are logged and never fail the
 * classification.
 */
@ApplicationScoped
public class ResultCombinerService {

    private static final Logger LOG = Logger.getLogger(ResultCombinerService.class);

    static final int REVIEW_FLAG_LIMIT = 2;

    @Inject
    HeuristicScoringService scoringService;

    @Inject
    SimilarityIndexService similarityIndexService;

    /**
     * Builds the final result for one document.
     *
     * @param text
     *            document text
     * @param filename
     *            source filename
     * @param outcome
     *            accepted cascade answer
     * @param validation
     *            validator outcome, possibly unavailable
     * @return final result
     */
    public ClassificationResultType combine(String text, String filename, CascadeOutcomeType outcome,
            ValidatorOutcomeType validation) {
        RawClassificationType raw = outcome.accepted();

        HeuristicScoreType heuristic;
        double score;
        if (outcome.heuristic() != null) {
            heuristic = outcome.heuristic();
            score = raw.confidenceScore();
        } else {
            heuristic = scoringService.score(text, raw.category(), raw.documentType());
            score = scoringService.overallConfidence(heuristic);
        }
        score = HeuristicScoringService.clamp(score);
        ConfidenceLevel level = ConfidenceLevel.fromScore(score);

        Set<String> flags = new LinkedHashSet<>(heuristic.uncertaintyFlags());
        if (validation != null && validation.disagreesOnCategory()) {
            flags.add(validatorFlag(validation));
        }

        boolean review = needsHumanReview(level, heuristic.uncertaintyFlags().size(),
                heuristic.qualityMetrics().ocrQualityIssues());
        List<AlternativeClassificationType> alternatives = scoringService.alternatives(text, raw.category());

        ClassificationResultType result = new ClassificationResultType(raw.documentType(), raw.category(), level,
                score, raw.reasoning(), flags, alternatives, review, raw.modelUsed(), raw.stageConfidence(),
                outcome.stageErrors(), validation, outcome.emergencyError());

        LOG.infof("Classified as %s / %s: %s (%.2f) via %s, review=%s", result.documentCategory(),
                result.documentType(), level.getLabel(), score, raw.modelUsed().getLabel(), review);

        if (!outcome.isEmergency() && text != null && !text.isBlank()) {
            persist(text, filename, result);
        }
        return result;
    }

    /**
     * Review rule. Each condition triggers review on its own.
     *
     * @param level
     *            final confidence level
     * @param scoringFlagCount
     *            uncertainty flags raised by scoring, excluding advisory validator notes
     * @param ocrIssues
     *            whether OCR damage was detected
     */
    public static boolean needsHumanReview(ConfidenceLevel level, int scoringFlagCount, boolean ocrIssues) {
        return level.requiresReview() || scoringFlagCount > REVIEW_FLAG_LIMIT || ocrIssues;
    }

    static String validatorFlag(ValidatorOutcomeType validation) {
        return String.format(Locale.ROOT, "Validator suggests category '%s' (score %.2f)",
                validation.validatorCategory(), validation.categoryConfidence());
    }

    private void persist(String text, String filename, ClassificationResultType result) {
        try {
            similarityIndexService.storePastDocument(text, filename, result);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Could not store classified document %s for future retrieval", filename);
        }
    }
}
