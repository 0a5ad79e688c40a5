package villagecompute.classifier.exceptions;

/**
 * Exception thrown when document text cannot be encoded into the embedding space.
 *
 * <p>
 * This is the only hard failure of context retrieval. The classification service answers it with the emergency
 * path.
 */
public class EmbeddingUnavailableException extends RuntimeException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
