package villagecompute.autopost.exceptions;

/**
 * Timer registration failed. The stored post is left untouched.
 */
public class SchedulingException extends RuntimeException {

    public SchedulingException(String message) {
        super(message);
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
    }
}
