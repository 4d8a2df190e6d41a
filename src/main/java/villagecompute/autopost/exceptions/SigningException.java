package villagecompute.autopost.exceptions;

/**
 * Raised when request signing failed after the full retry and re-initialization budget.
 *
 * <p>
 * Callers must not retry: a signer that survived a reload and six attempts is broken until an operator looks at it.
 */
public class SigningException extends RuntimeException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
