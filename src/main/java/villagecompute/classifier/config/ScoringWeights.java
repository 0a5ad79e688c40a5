/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.config;

/**
 * Additive bonuses and penalties applied to keyword confidence when computing a classification's confidence score.
 *
 * @param structureBonus
 *            added when numbered sections or formal headers are present
 * @param legalFormattingBonus
 *            added when court captions, case numbers or dated signature blocks are present
 * @param wordCountBonus
 *            added when the document is longer than {@code longDocumentWords}
 * @param ocrPenalty
 *            subtracted when OCR damage is detected
 * @param flagPenalty
 *            subtracted once per uncertainty flag
 * @param longDocumentWords
 *            word count above which the word-count bonus applies
 * @param shortDocumentWords
 *            word count below which the document is flagged as too short
 */
public record ScoringWeights(double structureBonus, double legalFormattingBonus, double wordCountBonus,
        double ocrPenalty, double flagPenalty, int longDocumentWords, int shortDocumentWords) {

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.20, 0.15, 0.10, 0.20, 0.10, 200, 50);
    }
}
