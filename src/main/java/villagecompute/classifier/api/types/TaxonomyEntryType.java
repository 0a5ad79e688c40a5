/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import java.util.List;
import java.util.Set;

/**
 * A single category or document type definition from the taxonomy resource.
 *
 * <p>
 * Besides the natural-language description and keyword list used for scoring and retrieval, an entry may carry
 * rule hints for the pattern-based classifier:
 * <ul>
 * <li>{@code textPatterns} - case-insensitive regular expressions matched against document text</li>
 * <li>{@code filenameHints} - case-insensitive regular expressions matched against the filename, consulted only
 * when no text pattern of any entry matched</li>
 * <li>{@code fallbackCategory} - for document types, the category assigned when no category rule matches</li>
 * </ul>
 *
 * <p>
 * Entries are immutable. The embedding is attached once at startup via {@link #withEmbedding(float[])}.
 *
 * @param name
 *            exact taxonomy label (case-sensitive)
 * @param kind
 *            category or document type
 * @param description
 *            natural-language definition
 * @param keywords
 *            ordered lower-case keyword list
 * @param exampleDocumentTypes
 *            document types typically filed under this category
 * @param textPatterns
 *            pattern-rule regexes against text
 * @param filenameHints
 *            pattern-rule regexes against the filename
 * @param fallbackCategory
 *            default category for a document type, may be null
 * @param embedding
 *            vector of the description and keywords, null until initialized
 */
public record TaxonomyEntryType(String name, TaxonomyKind kind, String description, List<String> keywords,
        Set<String> exampleDocumentTypes, List<String> textPatterns, List<String> filenameHints,
        String fallbackCategory, float[] embedding) {

    public TaxonomyEntryType {
        keywords = keywords == null ? List.of() : keywords.stream().map(k -> k.toLowerCase().trim()).toList();
        exampleDocumentTypes = exampleDocumentTypes == null ? Set.of() : Set.copyOf(exampleDocumentTypes);
        textPatterns = textPatterns == null ? List.of() : List.copyOf(textPatterns);
        filenameHints = filenameHints == null ? List.of() : List.copyOf(filenameHints);
        description = description == null ? "" : description;
    }

    public TaxonomyEntryType withKind(TaxonomyKind newKind) {
        return new TaxonomyEntryType(name, newKind, description, keywords, exampleDocumentTypes, textPatterns,
                filenameHints, fallbackCategory, embedding);
    }

    public TaxonomyEntryType withEmbedding(float[] vector) {
        return new TaxonomyEntryType(name, kind, description, keywords, exampleDocumentTypes, textPatterns,
                filenameHints, fallbackCategory, vector);
    }

    /**
     * Text that is embedded into the definitions collection.
     */
    public String embeddingText() {
        return name + ": " + description + " Keywords: " + String.join(", ", keywords);
    }
}
