/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Curated example document used as a few-shot illustration in classification prompts.
 *
 * @param id
 *            stable identifier
 * @param text
 *            representative excerpt
 * @param category
 *            expected category
 * @param documentType
 *            expected document type
 * @param reasoning
 *            why the example belongs to that classification
 */
public record ExampleDocType(String id, String text, String category, String documentType, String reasoning) {
}
