/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.ExampleDocType;
import villagecompute.classifier.api.types.PastDocType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.integration.store.SimilarityCollection;
import villagecompute.classifier.integration.store.SimilarityStore;
import villagecompute.classifier.util.TaxonomyLoader;

/**
 * Writes to the similarity store: taxonomy definitions and curated examples at startup, past documents after each
 * successful classification.
 *
 * <p>
 * <b>Payloads:</b>
 * <ul>
 * <li>{@code categories} - {@code name}, {@code kind}</li>
 * <li>{@code examples} - {@code id}, {@code text}, {@code category}, {@code document_type}, {@code reasoning}</li>
 * <li>{@code documents} - {@code filename}, {@code text_excerpt}, {@code doc_type}, {@code doc_category},
 * {@code confidence_level}, {@code confidence_score}</li>
 * </ul>
 *
 * <p>
 * Past-document ids are name-based UUIDs of the filename plus the first 100 characters of text, so re-classifying
 * the same document replaces its earlier entry.
 */
@ApplicationScoped
public class SimilarityIndexService {

    private static final Logger LOG = Logger.getLogger(SimilarityIndexService.class);

    public static final String KEY_NAME = "name";
    public static final String KEY_KIND = "kind";
    public static final String KEY_ID = "id";
    public static final String KEY_TEXT = "text";
    public static final String KEY_CATEGORY = "category";
    public static final String KEY_DOCUMENT_TYPE = "document_type";
    public static final String KEY_REASONING = "reasoning";
    public static final String KEY_FILENAME = "filename";
    public static final String KEY_TEXT_EXCERPT = "text_excerpt";
    public static final String KEY_DOC_TYPE = "doc_type";
    public static final String KEY_DOC_CATEGORY = "doc_category";
    public static final String KEY_CONFIDENCE_LEVEL = "confidence_level";
    public static final String KEY_CONFIDENCE_SCORE = "confidence_score";

    static final int ID_PREFIX_CHARS = 100;
    static final int EMBEDDED_TEXT_CHARS = 2000;
    static final int EXCERPT_CHARS = 500;

    @ConfigProperty(
            name = "classifier.taxonomy.examples-resource",
            defaultValue = "taxonomy/curated-examples.json")
    String examplesResource;

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    @Inject
    EmbeddingService embeddingService;

    @Inject
    SimilarityStore similarityStore;

    @Inject
    ObjectMapper objectMapper;

    private volatile boolean seeded;

    /**
     * Seeds the definition and example collections at startup. An embedding service that is down at startup leaves
     * the collections empty and does not block startup; {@link #ensureSeeded()} retries on the next retrieval.
     */
    void onStart(@Observes StartupEvent event) {
        ensureSeeded();
    }

    /**
     * Seeds the definition and example collections unless an earlier attempt already succeeded.
     *
     * @return true when both collections are seeded
     */
    public boolean ensureSeeded() {
        if (seeded) {
            return true;
        }
        synchronized (this) {
            if (seeded) {
                return true;
            }
            try {
                seedTaxonomy();
                seedExamples(
                        TaxonomyLoader.loadExamples(examplesResource, objectMapper, taxonomyRegistry.definition()));
                seeded = true;
            } catch (RuntimeException e) {
                LOG.warnf("Similarity collections not seeded, will retry on next retrieval: %s", e.getMessage());
            }
            return seeded;
        }
    }

    /**
     * Embeds every taxonomy entry and upserts it into the definitions collection.
     *
     * @return number of entries indexed
     */
    public int seedTaxonomy() {
        List<TaxonomyEntryType> entries = taxonomyRegistry.initializeEmbeddings(embeddingService::encode);
        for (TaxonomyEntryType entry : entries) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(KEY_NAME, entry.name());
            payload.put(KEY_KIND, entry.kind().name());
            similarityStore.upsert(SimilarityCollection.CATEGORIES, definitionId(entry), entry.embedding(), payload);
        }
        LOG.infof("Indexed %d taxonomy definitions", entries.size());
        return entries.size();
    }

    /**
     * Upserts curated examples when the example collection is empty.
     *
     * @return number of examples indexed, 0 when the collection was already populated
     */
    public int seedExamples(List<ExampleDocType> examples) {
        if (similarityStore.count(SimilarityCollection.EXAMPLES) > 0) {
            LOG.debug("Example collection already populated, skipping seed");
            return 0;
        }
        for (ExampleDocType example : examples) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(KEY_ID, example.id());
            payload.put(KEY_TEXT, example.text());
            payload.put(KEY_CATEGORY, example.category());
            payload.put(KEY_DOCUMENT_TYPE, example.documentType());
            payload.put(KEY_REASONING, example.reasoning());
            similarityStore.upsert(SimilarityCollection.EXAMPLES, example.id(),
                    embeddingService.encode(example.text()), payload);
        }
        LOG.infof("Indexed %d curated examples", examples.size());
        return examples.size();
    }

    /**
     * Stores a finished classification as a past document.
     *
     * @param text
     *            document text, must not be blank
     * @param filename
     *            source filename, may be empty
     * @param result
     *            final classification
     * @return the stored past document
     */
    public PastDocType storePastDocument(String text, String filename, ClassificationResultType result) {
        String safeName = filename == null ? "" : filename;
        PastDocType pastDoc = new PastDocType(pastDocumentId(text, safeName), safeName, prefix(text, EXCERPT_CHARS),
                result.documentType(), result.documentCategory(), result.confidenceLevel().getLabel(),
                result.confidenceScore());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(KEY_FILENAME, pastDoc.filename());
        payload.put(KEY_TEXT_EXCERPT, pastDoc.textExcerpt());
        payload.put(KEY_DOC_TYPE, pastDoc.documentType());
        payload.put(KEY_DOC_CATEGORY, pastDoc.documentCategory());
        payload.put(KEY_CONFIDENCE_LEVEL, pastDoc.confidenceLevel());
        payload.put(KEY_CONFIDENCE_SCORE, pastDoc.confidenceScore());

        similarityStore.upsert(SimilarityCollection.DOCUMENTS, pastDoc.id(),
                embeddingService.encode(prefix(text, EMBEDDED_TEXT_CHARS)), payload);
        LOG.debugf("Stored past document %s (%s / %s)", pastDoc.id(), pastDoc.documentCategory(),
                pastDoc.documentType());
        return pastDoc;
    }

    /**
     * Deterministic past-document id for a filename and text.
     */
    public static String pastDocumentId(String text, String filename) {
        String key = (filename == null ? "" : filename) + prefix(text, ID_PREFIX_CHARS);
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String definitionId(TaxonomyEntryType entry) {
        String key = entry.kind().name() + ":" + entry.name();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    static String prefix(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
