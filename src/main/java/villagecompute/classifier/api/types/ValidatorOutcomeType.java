/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Zero-shot cross-check of the cascade's chosen labels.
 *
 * <p>
 * The validator never overrides the cascade; it only annotates agreement. When it could not run,
 * {@code available} is false and only {@code unavailableReason} is meaningful.
 *
 * @param available
 *            whether the validator produced an answer
 * @param validatorCategory
 *            top category according to the validator
 * @param validatorDocType
 *            top document type according to the validator
 * @param categoryConfidence
 *            validator score of its top category
 * @param docTypeConfidence
 *            validator score of its top document type
 * @param categoryMatch
 *            whether the validator agrees with the chosen category
 * @param docTypeMatch
 *            whether the validator agrees with the chosen document type
 * @param overallConfidence
 *            mean of the two validator scores
 * @param unavailableReason
 *            why the validator could not run, null when available
 */
public record ValidatorOutcomeType(boolean available, String validatorCategory, String validatorDocType,
        double categoryConfidence, double docTypeConfidence, boolean categoryMatch, boolean docTypeMatch,
        double overallConfidence, String unavailableReason) {

    public static ValidatorOutcomeType unavailable(String reason) {
        return new ValidatorOutcomeType(false, null, null, 0.0, 0.0, false, false, 0.0, reason);
    }

    /**
     * True only when the validator ran and picked a different category.
     */
    public boolean disagreesOnCategory() {
        return available && !categoryMatch;
    }
}
