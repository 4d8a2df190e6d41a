package villagecompute.autopost.exceptions;

/**
 * Exception thrown when a scheduling request is rejected before any work starts (unknown aspect ratio, image count out
 * of range, run-now on a post that already published).
 *
 * <p>
 * Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
