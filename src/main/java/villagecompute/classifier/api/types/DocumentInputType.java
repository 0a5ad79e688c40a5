/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Extracted text of one document queued for classification.
 *
 * @param text
 *            extracted document text
 * @param filename
 *            source filename, may be empty
 */
public record DocumentInputType(String text, String filename) {
}
