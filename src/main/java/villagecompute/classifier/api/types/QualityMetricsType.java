/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Text-quality signals derived from the raw document text.
 *
 * @param wordCount
 *            whitespace-separated token count
 * @param hasStructure
 *            numbered or lettered sections or formal section headers present
 * @param hasLegalFormatting
 *            court captions, case numbers or dated signature blocks present
 * @param ocrQualityIssues
 *            OCR damage indicators present
 */
public record QualityMetricsType(int wordCount, boolean hasStructure, boolean hasLegalFormatting,
        boolean ocrQualityIssues) {
}
