/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.InconsistencyRuleType;
import villagecompute.classifier.api.types.TaxonomyDefinitionType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.api.types.TaxonomyKind;
import villagecompute.classifier.util.TaxonomyLoader;

/**
 * Fixed taxonomy of categories and document types, read-only once initialized.
 *
 * <p>
 * The definition is loaded from {@code classifier.taxonomy.resource} at startup. Entry embeddings are attached exactly
 * once by {@link #initializeEmbeddings(Function)}; afterwards the registry never changes for the lifetime of the
 * process.
 *
 * <p>
 * Entries keep the order of the resource file. That order is the priority order of the pattern-based classifier.
 */
@ApplicationScoped
public class TaxonomyRegistry {

    private static final Logger LOG = Logger.getLogger(TaxonomyRegistry.class);

    @ConfigProperty(
            name = "classifier.taxonomy.resource",
            defaultValue = "taxonomy/legal-taxonomy.json")
    String taxonomyResource;

    @Inject
    ObjectMapper objectMapper;

    private volatile TaxonomyDefinitionType definition;
    private volatile Map<String, TaxonomyEntryType> categories = Map.of();
    private volatile Map<String, TaxonomyEntryType> documentTypes = Map.of();
    private volatile boolean embeddingsInitialized;

    public TaxonomyRegistry() {
    }

    /**
     * Creates a registry from an already parsed definition, bypassing resource loading.
     */
    public static TaxonomyRegistry of(TaxonomyDefinitionType definition) {
        TaxonomyRegistry registry = new TaxonomyRegistry();
        registry.install(definition);
        return registry;
    }

    @PostConstruct
    void load() {
        if (definition == null) {
            install(TaxonomyLoader.loadTaxonomy(taxonomyResource, objectMapper));
        }
    }

    private void install(TaxonomyDefinitionType loaded) {
        Map<String, TaxonomyEntryType> categoryMap = new LinkedHashMap<>();
        loaded.categories().forEach(c -> categoryMap.put(c.name(), c));
        Map<String, TaxonomyEntryType> typeMap = new LinkedHashMap<>();
        loaded.documentTypes().forEach(t -> typeMap.put(t.name(), t));
        this.categories = Collections.unmodifiableMap(categoryMap);
        this.documentTypes = Collections.unmodifiableMap(typeMap);
        this.definition = loaded;
    }

    /**
     * Computes and attaches an embedding to every entry. Only the first call has an effect.
     *
     * @param encoder
     *            maps an entry's embedding text to its vector
     * @return all entries with embeddings attached
     */
    public synchronized List<TaxonomyEntryType> initializeEmbeddings(Function<String, float[]> encoder) {
        if (!embeddingsInitialized) {
            Map<String, TaxonomyEntryType> categoryMap = new LinkedHashMap<>();
            for (TaxonomyEntryType c : categories.values()) {
                categoryMap.put(c.name(), c.withEmbedding(encoder.apply(c.embeddingText())));
            }
            Map<String, TaxonomyEntryType> typeMap = new LinkedHashMap<>();
            for (TaxonomyEntryType t : documentTypes.values()) {
                typeMap.put(t.name(), t.withEmbedding(encoder.apply(t.embeddingText())));
            }
            categories = Collections.unmodifiableMap(categoryMap);
            documentTypes = Collections.unmodifiableMap(typeMap);
            embeddingsInitialized = true;
            LOG.infof("Computed embeddings for %d taxonomy entries", categoryMap.size() + typeMap.size());
        }
        return allEntries();
    }

    public boolean hasEmbeddings() {
        return embeddingsInitialized;
    }

    public List<TaxonomyEntryType> categories() {
        return List.copyOf(categories.values());
    }

    public List<TaxonomyEntryType> documentTypes() {
        return List.copyOf(documentTypes.values());
    }

    /**
     * Categories followed by document types.
     */
    public List<TaxonomyEntryType> allEntries() {
        List<TaxonomyEntryType> all = new ArrayList<>(categories.values());
        all.addAll(documentTypes.values());
        return all;
    }

    public List<String> categoryNames() {
        return List.copyOf(categories.keySet());
    }

    public List<String> documentTypeNames() {
        return List.copyOf(documentTypes.keySet());
    }

    public Optional<TaxonomyEntryType> category(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(categories.get(name));
    }

    public Optional<TaxonomyEntryType> documentType(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(documentTypes.get(name));
    }

    public Optional<TaxonomyEntryType> entry(TaxonomyKind kind, String name) {
        return kind == TaxonomyKind.CATEGORY ? category(name) : documentType(name);
    }

    public boolean isCategory(String name) {
        return name != null && categories.containsKey(name);
    }

    public boolean isDocumentType(String name) {
        return name != null && documentTypes.containsKey(name);
    }

    public String defaultCategory() {
        return definition.defaultCategory();
    }

    public String defaultDocumentType() {
        return definition.defaultDocumentType();
    }

    public List<InconsistencyRuleType> inconsistencies() {
        return definition.inconsistencies();
    }

    /**
     * Representative document-type subset offered to the zero-shot validator. Falls back to every document type when
     * the taxonomy does not name a subset.
     */
    public List<String> validatorDocumentTypes() {
        List<String> subset = definition.validatorDocumentTypes();
        return subset.isEmpty() ? documentTypeNames() : subset;
    }

    public TaxonomyDefinitionType definition() {
        return definition;
    }
}
