package villagecompute.autopost.exceptions;

/**
 * A generation collaborator (chat model or image API) failed, timed out, or returned output that could not be parsed.
 */
public class GenerationException extends RuntimeException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
