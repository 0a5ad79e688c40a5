/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Structured fields recovered from a language model's free-text answer.
 *
 * <p>
 * When a label cannot be mapped onto the taxonomy the default label is substituted and the matching flag is
 * false.
 *
 * @param category
 *            taxonomy category, or the default category
 * @param documentType
 *            taxonomy document type, or the default document type
 * @param reasoning
 *            model reasoning text, empty if none was given
 * @param categoryMatched
 *            whether the category was found verbatim in the taxonomy
 * @param documentTypeMatched
 *            whether the document type was found verbatim in the taxonomy
 */
public record ParsedClassificationType(String category, String documentType, String reasoning,
        boolean categoryMatched, boolean documentTypeMatched) {

    public boolean fullyMatched() {
        return categoryMatched && documentTypeMatched;
    }
}
