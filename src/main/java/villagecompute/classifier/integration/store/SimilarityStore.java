package villagecompute.classifier.integration.store;

import java.util.List;
import java.util.Map;

/**
 * Vector similarity store with one logical collection per {@link SimilarityCollection}.
 *
 * <p>
 * Implementations must return search results ordered by descending score, keeping the engine's native order for
 * ties. Scores lie in [0,1].
 */
public interface SimilarityStore {

    /**
     * Inserts an entry or replaces the entry with the same id.
     *
     * @param collection
     *            target collection
     * @param id
     *            entry identifier
     * @param vector
     *            embedding vector
     * @param payload
     *            values returned with search hits
     */
    void upsert(SimilarityCollection collection, String id, float[] vector, Map<String, Object> payload);

    /**
     * Finds the entries nearest to {@code vector}.
     *
     * @param collection
     *            collection to search
     * @param vector
     *            query embedding
     * @param limit
     *            maximum number of hits
     * @param minScore
     *            hits scoring below this are dropped; 0.0 keeps everything
     * @return hits in descending score order
     */
    List<SimilarityHit> search(SimilarityCollection collection, float[] vector, int limit, double minScore);

    /**
     * Number of entries in a collection.
     */
    int count(SimilarityCollection collection);
}
