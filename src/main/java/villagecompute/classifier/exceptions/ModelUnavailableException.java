package villagecompute.classifier.exceptions;

import villagecompute.classifier.api.types.StageErrorKind;

/**
 * Exception thrown when a language-model handle cannot produce a completion.
 *
 * <p>
 * Covers unreachable endpoints, timeouts, models that fail to load, and callers that could not obtain the model's
 * inference slot in time. The cascade converts it into a stage failure and moves on to the next stage; it never
 * reaches callers of the classification service.
 */
public class ModelUnavailableException extends RuntimeException {

    private final StageErrorKind kind;

    public ModelUnavailableException(StageErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelUnavailableException(StageErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public StageErrorKind getKind() {
        return kind;
    }
}
