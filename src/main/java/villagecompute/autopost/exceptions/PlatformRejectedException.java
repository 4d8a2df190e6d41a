package villagecompute.autopost.exceptions;

/**
 * The platform returned an explicit failure envelope, or a response that could not be read as one.
 *
 * <p>
 * Carries the platform's own code and message so they can be surfaced unchanged in the post's error text.
 */
public class PlatformRejectedException extends RuntimeException {

    private final Integer code;

    public PlatformRejectedException(String message) {
        this(null, message);
    }

    public PlatformRejectedException(Integer code, String message) {
        super(message);
        this.code = code;
    }

    public PlatformRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.code = null;
    }

    public Integer getCode() {
        return code;
    }
}
