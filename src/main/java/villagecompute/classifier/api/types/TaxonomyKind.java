/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Kind of taxonomy definition.
 */
public enum TaxonomyKind {
    CATEGORY, DOCUMENT_TYPE
}
