package villagecompute.classifier.integration.store;

/**
 * Logical collections of the similarity store.
 */
public enum SimilarityCollection {

    /** Taxonomy category and document type definitions. */
    CATEGORIES("categories"),

    /** Curated few-shot example documents. */
    EXAMPLES("examples"),

    /** Previously classified documents. */
    DOCUMENTS("documents");

    private final String collectionName;

    SimilarityCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
