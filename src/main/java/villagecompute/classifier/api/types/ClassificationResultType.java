/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Final, immutable classification returned to callers.
 *
 * <p>
 * <b>Guarantees:</b>
 * <ul>
 * <li>{@code confidenceScore} lies in [0,1] and {@code confidenceLevel} is its bucket</li>
 * <li>{@code documentCategory} is a taxonomy category, or {@link #NO_MATCH_CATEGORY} when every stage failed</li>
 * <li>{@code needsHumanReview} is set by the review rule, never by validator disagreement alone</li>
 * </ul>
 *
 * <p>
 * The trailing fields are diagnostics: which stage was accepted, that stage's own confidence label, failures of
 * earlier stages, the validator outcome, and the exception message when the emergency path ran.
 *
 * @param documentType
 *            chosen document type
 * @param documentCategory
 *            chosen category
 * @param confidenceLevel
 *            bucket of {@code confidenceScore}
 * @param confidenceScore
 *            combined confidence
 * @param reasoning
 *            explanation of the classification
 * @param uncertaintyFlags
 *            reasons to distrust the result, including advisory validator notes
 * @param alternativeClassifications
 *            up to two runner-up categories, highest score first
 * @param needsHumanReview
 *            whether the result must be checked by a person
 * @param modelUsed
 *            accepted cascade stage
 * @param stageConfidence
 *            accepted stage's own confidence label
 * @param stageErrors
 *            failures of stages passed over
 * @param validation
 *            zero-shot validator outcome
 * @param diagnosticError
 *            emergency exception message, null otherwise
 */
public record ClassificationResultType(@NotNull String documentType, @NotNull String documentCategory,
        @NotNull ConfidenceLevel confidenceLevel, @DecimalMin("0.0") @DecimalMax("1.0") double confidenceScore,
        String reasoning, Set<String> uncertaintyFlags, List<AlternativeClassificationType> alternativeClassifications,
        boolean needsHumanReview, @NotNull ModelUsed modelUsed, ConfidenceLevel stageConfidence,
        List<StageErrorType> stageErrors, ValidatorOutcomeType validation, String diagnosticError) {

    /** Sentinel category used only when even the rule-based floor could not run. */
    public static final String NO_MATCH_CATEGORY = "Unclassified";

    /** Sentinel document type paired with {@link #NO_MATCH_CATEGORY}. */
    public static final String NO_MATCH_DOCUMENT_TYPE = "Unclassified";

    public ClassificationResultType {
        uncertaintyFlags = uncertaintyFlags == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(uncertaintyFlags));
        alternativeClassifications = alternativeClassifications == null ? List.of()
                : List.copyOf(alternativeClassifications);
        stageErrors = stageErrors == null ? List.of() : List.copyOf(stageErrors);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
