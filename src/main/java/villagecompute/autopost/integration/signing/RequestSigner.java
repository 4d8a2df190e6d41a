package villagecompute.autopost.integration.signing;

/**
 * Computes the authentication headers the platform requires on every request.
 *
 * <p>
 * Two strategies exist: {@link ScriptRequestSigner} runs the signing script in an embedded engine, and
 * {@link BrowserRequestSigner} lets a real page compute the signature. Production code talks to a
 * {@link RetryingRequestSigner} wrapping whichever strategy {@code signing.strategy} selects.
 */
public interface RequestSigner extends AutoCloseable {

    /**
     * Signs one request.
     *
     * @throws villagecompute.autopost.exceptions.SigningException
     *             if the signature could not be produced
     */
    SignatureHeaders sign(SigningRequest request);

    /**
     * Rebuilds the underlying resource (script context or browser page). Called after an attempt budget is exhausted.
     */
    void reinitialize();

    @Override
    default void close() {
    }
}
