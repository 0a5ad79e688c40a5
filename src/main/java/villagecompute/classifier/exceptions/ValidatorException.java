package villagecompute.classifier.exceptions;

/**
 * Exception thrown when the zero-shot validator endpoint fails or returns an unreadable payload.
 */
public class ValidatorException extends RuntimeException {

    public ValidatorException(String message) {
        super(message);
    }

    public ValidatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
