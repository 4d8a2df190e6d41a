package villagecompute.autopost.exceptions;

/**
 * Exception thrown when a requested scheduled post, account or reference group does not exist.
 *
 * <p>
 * Mapped to HTTP 404 Not Found in REST resources. Store lookups return {@code Optional.empty()} instead; this exception
 * is raised by the service layer once absence becomes a caller error.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
