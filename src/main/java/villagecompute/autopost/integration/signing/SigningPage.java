package villagecompute.autopost.integration.signing;

/**
 * A browser page logged in as one account with the platform's web client loaded.
 *
 * <p>
 * Not thread-safe; {@link BrowserRequestSigner} serializes all access.
 */
public interface SigningPage extends AutoCloseable {

    /**
     * Launches the browser if needed, injects the session cookies and loads the platform home page.
     */
    void open(String cookie);

    /**
     * Evaluates a JavaScript expression in the page.
     *
     * @return the expression value as text; callers wrap expressions in {@code JSON.stringify}
     */
    String evaluate(String expression);

    /**
     * Reloads the page with the cookies last passed to {@link #open}, relaunching the browser if it is gone.
     */
    void reload();

    @Override
    void close();
}
