/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Previously classified document stored for future retrieval context.
 *
 * @param id
 *            deterministic identifier derived from filename and text prefix
 * @param filename
 *            original filename, may be empty
 * @param textExcerpt
 *            leading excerpt of the document text
 * @param documentType
 *            final document type
 * @param documentCategory
 *            final category
 * @param confidenceLevel
 *            final confidence bucket label
 * @param confidenceScore
 *            final confidence score
 */
public record PastDocType(String id, String filename, String textExcerpt, String documentType,
        String documentCategory, String confidenceLevel, double confidenceScore) {
}
