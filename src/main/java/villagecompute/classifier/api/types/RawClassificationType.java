/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Output of a single cascade stage.
 *
 * @param category
 *            chosen category
 * @param documentType
 *            chosen document type
 * @param confidenceScore
 *            stage confidence in [0,1]
 * @param modelUsed
 *            which stage or endpoint produced the answer
 * @param rawResponse
 *            unparsed model output, empty for rule-based stages
 * @param reasoning
 *            explanation of the choice
 * @param stageConfidence
 *            discrete label of the stage's own confidence
 */
public record RawClassificationType(String category, String documentType, double confidenceScore,
        ModelUsed modelUsed, String rawResponse, String reasoning, ConfidenceLevel stageConfidence) {

    public RawClassificationType {
        confidenceScore = Math.max(0.0, Math.min(1.0, confidenceScore));
        rawResponse = rawResponse == null ? "" : rawResponse;
        reasoning = reasoning == null ? "" : reasoning;
        if (stageConfidence == null) {
            stageConfidence = ConfidenceLevel.fromScore(confidenceScore);
        }
    }
}
