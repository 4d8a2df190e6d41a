package villagecompute.autopost.integration.signing;

import java.util.List;

/**
 * Pure-function evaluator for the bundled signing scripts.
 *
 * <p>
 * Arguments and results cross the boundary as JSON text so implementations do not leak engine value types.
 * Implementations must allow concurrent {@link #call} invocations.
 */
public interface ScriptEvaluator extends AutoCloseable {

    /**
     * Invokes a global function.
     *
     * @param function
     *            global name, may be dotted ({@code window.getMnsToken})
     * @param jsonArgs
     *            arguments, each as a JSON literal ({@code "\"/api\""}, {@code "null"}, an object)
     * @return the function result serialized as JSON
     */
    String call(String function, List<String> jsonArgs);

    /**
     * Drops any loaded state and re-reads the scripts.
     */
    void reload();

    @Override
    void close();
}
