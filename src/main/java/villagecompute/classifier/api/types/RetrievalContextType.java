/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import java.util.List;

/**
 * Similarity-search results used to ground one classification attempt.
 *
 * <p>
 * Every list is ordered by descending score. Any list may be empty when the corresponding collection is empty or
 * unreachable.
 *
 * @param similarCategories
 *            nearest taxonomy definitions
 * @param similarExamples
 *            nearest curated examples
 * @param similarDocuments
 *            nearest previously classified documents
 */
public record RetrievalContextType(List<ScoredMatchType<TaxonomyEntryType>> similarCategories,
        List<ScoredMatchType<ExampleDocType>> similarExamples, List<ScoredMatchType<PastDocType>> similarDocuments) {

    public RetrievalContextType {
        similarCategories = similarCategories == null ? List.of() : List.copyOf(similarCategories);
        similarExamples = similarExamples == null ? List.of() : List.copyOf(similarExamples);
        similarDocuments = similarDocuments == null ? List.of() : List.copyOf(similarDocuments);
    }

    public static RetrievalContextType empty() {
        return new RetrievalContextType(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return similarCategories.isEmpty() && similarExamples.isEmpty() && similarDocuments.isEmpty();
    }
}
