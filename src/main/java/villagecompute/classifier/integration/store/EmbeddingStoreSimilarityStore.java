package villagecompute.classifier.integration.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * {@link SimilarityStore} backed by one LangChain4j {@link InMemoryEmbeddingStore} per collection.
 *
 * <p>
 * Relevance scores are cosine similarity rescaled to [0,1] by the embedding store. Payloads are kept beside the
 * vectors, keyed by entry id.
 *
 * <p>
 * When {@code classifier.store.documents-path} is set, the {@link SimilarityCollection#DOCUMENTS} collection is
 * written to that JSON file after every upsert and reloaded at startup, so past classifications survive restarts.
 * The taxonomy and example collections are rebuilt from resources at every startup and never persisted.
 */
@ApplicationScoped
public class EmbeddingStoreSimilarityStore implements SimilarityStore {

    private static final Logger LOG = Logger.getLogger(EmbeddingStoreSimilarityStore.class);

    @ConfigProperty(
            name = "classifier.store.documents-path")
    Optional<String> documentsPath;

    @Inject
    ObjectMapper objectMapper;

    private final Map<SimilarityCollection, CollectionState> collections = new EnumMap<>(SimilarityCollection.class);

    /** Held from snapshot through rename so the file always ends with the newest snapshot. */
    private final Object persistLock = new Object();

    public EmbeddingStoreSimilarityStore() {
        for (SimilarityCollection collection : SimilarityCollection.values()) {
            collections.put(collection, new CollectionState());
        }
    }

    /**
     * Reloads persisted past documents, if a documents file is configured and exists.
     */
    @PostConstruct
    void loadPersistedDocuments() {
        Optional<Path> path = persistencePath();
        if (path.isEmpty() || !Files.exists(path.get())) {
            return;
        }
        try {
            List<PersistedEntry> entries = objectMapper.readValue(path.get().toFile(),
                    new TypeReference<List<PersistedEntry>>() {
                    });
            CollectionState state = collections.get(SimilarityCollection.DOCUMENTS);
            synchronized (state) {
                for (PersistedEntry entry : entries) {
                    state.put(entry.id(), entry.vector(), entry.payload());
                }
            }
            LOG.infof("Loaded %d past documents from %s", entries.size(), path.get());
        } catch (IOException e) {
            LOG.errorf(e, "Failed to load past documents from %s, starting with an empty collection", path.get());
        }
    }

    @Override
    public void upsert(SimilarityCollection collection, String id, float[] vector, Map<String, Object> payload) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Similarity store entries require an id");
        }
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Similarity store entries require a non-empty vector");
        }
        CollectionState state = collections.get(collection);
        synchronized (state) {
            state.put(id, vector, payload == null ? Map.of() : payload);
        }
        LOG.debugf("Upserted %s into %s", id, collection.getCollectionName());

        if (collection == SimilarityCollection.DOCUMENTS) {
            persistDocuments();
        }
    }

    @Override
    public List<SimilarityHit> search(SimilarityCollection collection, float[] vector, int limit, double minScore) {
        CollectionState state = collections.get(collection);
        if (limit <= 0 || state.payloads.isEmpty()) {
            return List.of();
        }
        EmbeddingSearchRequest request = EmbeddingSearchRequest.builder().queryEmbedding(Embedding.from(vector))
                .maxResults(limit).minScore(minScore).build();
        List<EmbeddingMatch<TextSegment>> matches = state.store.search(request).matches();

        List<SimilarityHit> hits = new ArrayList<>(matches.size());
        for (EmbeddingMatch<TextSegment> match : matches) {
            Map<String, Object> payload = state.payloads.get(match.embeddingId());
            if (payload != null) {
                hits.add(new SimilarityHit(match.embeddingId(), Collections.unmodifiableMap(payload),
                        match.score()));
            }
        }
        return hits;
    }

    @Override
    public int count(SimilarityCollection collection) {
        return collections.get(collection).payloads.size();
    }

    private void persistDocuments() {
        Optional<Path> path = persistencePath();
        if (path.isEmpty()) {
            return;
        }
        synchronized (persistLock) {
            writeDocuments(path.get());
        }
    }

    private void writeDocuments(Path target) {
        CollectionState state = collections.get(SimilarityCollection.DOCUMENTS);
        List<PersistedEntry> entries = new ArrayList<>();
        synchronized (state) {
            state.payloads
                    .forEach((id, payload) -> entries.add(new PersistedEntry(id, state.vectors.get(id), payload)));
        }
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), entries);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist past documents to " + target, e);
        }
    }

    private Optional<Path> persistencePath() {
        if (documentsPath == null) {
            return Optional.empty();
        }
        return documentsPath.filter(p -> !p.isBlank()).map(Paths::get);
    }

    /**
     * Vectors and payloads of one collection. Mutations are synchronized on the instance.
     */
    private static final class CollectionState {

        private final InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
        private final Map<String, Map<String, Object>> payloads = new ConcurrentHashMap<>();
        private final Map<String, float[]> vectors = new ConcurrentHashMap<>();

        void put(String id, float[] vector, Map<String, Object> payload) {
            if (payloads.containsKey(id)) {
                store.removeAll(List.of(id));
            }
            store.add(id, Embedding.from(vector));
            vectors.put(id, vector);
            payloads.put(id, new LinkedHashMap<>(payload));
        }
    }

    /**
     * On-disk form of a past document entry.
     */
    record PersistedEntry(String id, float[] vector, Map<String, Object> payload) {
    }
}
