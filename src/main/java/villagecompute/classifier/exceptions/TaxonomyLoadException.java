package villagecompute.classifier.exceptions;

/**
 * Exception thrown when the taxonomy or curated example resources are missing or malformed. Aborts startup.
 */
public class TaxonomyLoadException extends RuntimeException {

    public TaxonomyLoadException(String message) {
        super(message);
    }

    public TaxonomyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
