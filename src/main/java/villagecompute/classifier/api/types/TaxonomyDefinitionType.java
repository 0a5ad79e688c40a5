/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import java.util.List;

/**
 * Parsed form of the taxonomy resource file.
 *
 * @param defaultCategory
 *            category used when nothing matches; must be one of {@code categories}
 * @param defaultDocumentType
 *            document type used when nothing matches; must be one of {@code documentTypes}
 * @param categories
 *            category definitions in pattern-rule priority order
 * @param documentTypes
 *            document type definitions in pattern-rule priority order
 * @param inconsistencies
 *            known type/category mismatches
 * @param validatorDocumentTypes
 *            representative document-type subset offered to the zero-shot validator
 */
public record TaxonomyDefinitionType(String defaultCategory, String defaultDocumentType,
        List<TaxonomyEntryType> categories, List<TaxonomyEntryType> documentTypes,
        List<InconsistencyRuleType> inconsistencies, List<String> validatorDocumentTypes) {

    public TaxonomyDefinitionType {
        categories = categories == null ? List.of()
                : categories.stream().map(c -> c.withKind(TaxonomyKind.CATEGORY)).toList();
        documentTypes = documentTypes == null ? List.of()
                : documentTypes.stream().map(t -> t.withKind(TaxonomyKind.DOCUMENT_TYPE)).toList();
        inconsistencies = inconsistencies == null ? List.of() : List.copyOf(inconsistencies);
        validatorDocumentTypes = validatorDocumentTypes == null ? List.of() : List.copyOf(validatorDocumentTypes);
    }
}
