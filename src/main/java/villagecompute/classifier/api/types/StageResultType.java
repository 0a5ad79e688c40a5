/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Result of one model-backed stage attempt: either a scored classification or a stage error.
 *
 * <p>
 * Exactly one of {@code classification} and {@code error} is non-null.
 *
 * @param stage
 *            cascade stage
 * @param classification
 *            parsed and scored answer on success
 * @param heuristic
 *            heuristic assessment the stage confidence was derived from, on success
 * @param error
 *            failure detail
 */
public record StageResultType(CascadeStage stage, RawClassificationType classification, HeuristicScoreType heuristic,
        StageErrorType error) {

    public static StageResultType success(CascadeStage stage, RawClassificationType classification,
            HeuristicScoreType heuristic) {
        return new StageResultType(stage, classification, heuristic, null);
    }

    public static StageResultType failure(StageErrorType error) {
        return new StageResultType(error.stage(), null, null, error);
    }

    public boolean isSuccess() {
        return classification != null;
    }

    /**
     * Whether the stage succeeded with a confidence of at least {@code threshold}.
     */
    public boolean meets(double threshold) {
        return isSuccess() && classification.confidenceScore() >= threshold;
    }
}
