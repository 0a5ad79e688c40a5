/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Runner-up category suggested by keyword overlap.
 *
 * @param category
 *            alternative category
 * @param score
 *            keyword-match ratio against the document text
 * @param reason
 *            human-readable explanation
 */
public record AlternativeClassificationType(String category, double score, String reason) {
}
