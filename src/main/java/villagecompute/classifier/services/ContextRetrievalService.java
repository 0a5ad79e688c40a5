/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import static villagecompute.classifier.services.SimilarityIndexService.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.ExampleDocType;
import villagecompute.classifier.api.types.PastDocType;
import villagecompute.classifier.api.types.RetrievalContextType;
import villagecompute.classifier.api.types.ScoredMatchType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.api.types.TaxonomyKind;
import villagecompute.classifier.config.CascadeThresholds;
import villagecompute.classifier.exceptions.EmbeddingUnavailableException;
import villagecompute.classifier.integration.store.SimilarityCollection;
import villagecompute.classifier.integration.store.SimilarityHit;
import villagecompute.classifier.integration.store.SimilarityStore;

/**
 * Assembles the {@link RetrievalContextType} that grounds each classification attempt.
 *
 * <p>
 * The first 1,000 characters of the document are encoded once and used for three independent searches: taxonomy
 * definitions, curated examples and past documents. No minimum score is applied; prompt builders and callers judge
 * relevance from the scores themselves.
 *
 * <p>
 * <b>Degradation:</b> each search that fails yields an empty list without affecting the others. Only a failure to
 * encode the text is fatal ({@link EmbeddingUnavailableException}). Blank text yields an empty context without
 * encoding. Collections left unseeded by a failed startup are seeded before the first search that finds the
 * embedding server reachable.
 */
@ApplicationScoped
public class ContextRetrievalService {

    private static final Logger LOG = Logger.getLogger(ContextRetrievalService.class);

    static final int QUERY_CHARS = 1000;
    static final double NO_MIN_SCORE = 0.0;

    @Inject
    EmbeddingService embeddingService;

    @Inject
    SimilarityStore similarityStore;

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    @Inject
    CascadeThresholds thresholds;

    @Inject
    SimilarityIndexService similarityIndexService;

    /**
     * Retrieves context with the configured depth.
     */
    public RetrievalContextType retrieve(String text) {
        return retrieve(text, thresholds.retrievalTopK());
    }

    /**
     * Retrieves up to {@code topK} matches from each collection.
     *
     * @param text
     *            document text
     * @param topK
     *            maximum matches per collection
     * @return context, lists ordered by descending score
     * @throws EmbeddingUnavailableException
     *             if the text cannot be encoded
     */
    public RetrievalContextType retrieve(String text, int topK) {
        if (text == null || text.isBlank()) {
            LOG.debug("Blank document text, returning empty retrieval context");
            return RetrievalContextType.empty();
        }

        float[] query = embeddingService.encode(prefix(text, QUERY_CHARS));
        similarityIndexService.ensureSeeded();

        List<ScoredMatchType<TaxonomyEntryType>> categories = search(SimilarityCollection.CATEGORIES, query, topK,
                this::toTaxonomyEntry);
        List<ScoredMatchType<ExampleDocType>> examples = search(SimilarityCollection.EXAMPLES, query, topK,
                ContextRetrievalService::toExample);
        List<ScoredMatchType<PastDocType>> documents = search(SimilarityCollection.DOCUMENTS, query, topK,
                ContextRetrievalService::toPastDoc);

        LOG.debugf("Retrieved context: %d definitions, %d examples, %d past documents", categories.size(),
                examples.size(), documents.size());
        return new RetrievalContextType(categories, examples, documents);
    }

    private <T> List<ScoredMatchType<T>> search(SimilarityCollection collection, float[] query, int topK,
            Function<SimilarityHit, Optional<T>> mapper) {
        try {
            List<SimilarityHit> hits = similarityStore.search(collection, query, topK, NO_MIN_SCORE);
            List<ScoredMatchType<T>> matches = new ArrayList<>(hits.size());
            for (SimilarityHit hit : hits) {
                mapper.apply(hit).ifPresent(item -> matches.add(new ScoredMatchType<>(item, hit.score())));
            }
            return matches;
        } catch (RuntimeException e) {
            LOG.warnf("Similarity search in %s failed, continuing without it: %s", collection.getCollectionName(),
                    e.getMessage());
            return List.of();
        }
    }

    private Optional<TaxonomyEntryType> toTaxonomyEntry(SimilarityHit hit) {
        TaxonomyKind kind;
        try {
            kind = TaxonomyKind.valueOf(hit.payloadString(KEY_KIND));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return taxonomyRegistry.entry(kind, hit.payloadString(KEY_NAME));
    }

    private static Optional<ExampleDocType> toExample(SimilarityHit hit) {
        return Optional.of(new ExampleDocType(hit.payloadString(KEY_ID), hit.payloadString(KEY_TEXT),
                hit.payloadString(KEY_CATEGORY), hit.payloadString(KEY_DOCUMENT_TYPE),
                hit.payloadString(KEY_REASONING)));
    }

    private static Optional<PastDocType> toPastDoc(SimilarityHit hit) {
        return Optional.of(new PastDocType(hit.id(), hit.payloadString(KEY_FILENAME),
                hit.payloadString(KEY_TEXT_EXCERPT), hit.payloadString(KEY_DOC_TYPE),
                hit.payloadString(KEY_DOC_CATEGORY), hit.payloadString(KEY_CONFIDENCE_LEVEL),
                hit.payloadDouble(KEY_CONFIDENCE_SCORE)));
    }

    private static String prefix(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
