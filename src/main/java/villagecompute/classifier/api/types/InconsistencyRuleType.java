/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Known document type and category pairing that indicates an internally inconsistent classification.
 *
 * @param documentType
 *            document type label
 * @param category
 *            category label
 * @param message
 *            uncertainty flag raised when the pairing is seen
 */
public record InconsistencyRuleType(String documentType, String category, String message) {

    public boolean matches(String candidateType, String candidateCategory) {
        return documentType.equals(candidateType) && category.equals(candidateCategory);
    }
}
