package villagecompute.autopost.jobs;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a pipeline stage: a value, or the stage that failed and why.
 *
 * <p>
 * {@link #then} runs the next stage only on success and tags any exception it throws with that stage, so the stage
 * a failure belongs to is decided where the stage is named rather than by whoever catches the exception.
 *
 * @param <T>
 *            value type on success
 */
public final class StageResult<T> {

    private final T value;
    private final PipelineStage failedStage;
    private final RuntimeException cause;

    private StageResult(T value, PipelineStage failedStage, RuntimeException cause) {
        this.value = value;
        this.failedStage = failedStage;
        this.cause = cause;
    }

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(value, null, null);
    }

    public static <T> StageResult<T> failed(PipelineStage stage, RuntimeException cause) {
        return new StageResult<>(null, Objects.requireNonNull(stage), Objects.requireNonNull(cause));
    }

    /**
     * Runs a first stage.
     */
    public static <T> StageResult<T> run(PipelineStage stage, Supplier<? extends T> step) {
        try {
            return ok(step.get());
        } catch (RuntimeException e) {
            return failed(stage, e);
        }
    }

    /**
     * Runs {@code step} as {@code stage} if this result is a success.
     */
    public <R> StageResult<R> then(PipelineStage stage, Function<? super T, ? extends R> step) {
        if (!isOk()) {
            return propagate();
        }
        try {
            return ok(step.apply(value));
        } catch (RuntimeException e) {
            return failed(stage, e);
        }
    }

    /**
     * Continues with a step that already produces stage-tagged results.
     */
    public <R> StageResult<R> flatThen(Function<? super T, StageResult<R>> step) {
        return isOk() ? step.apply(value) : propagate();
    }

    public boolean isOk() {
        return failedStage == null;
    }

    /**
     * @throws IllegalStateException
     *             if this result is a failure
     */
    public T value() {
        if (!isOk()) {
            throw new IllegalStateException("No value: stage " + failedStage.getCode() + " failed", cause);
        }
        return value;
    }

    public PipelineStage failedStage() {
        return failedStage;
    }

    public RuntimeException cause() {
        return cause;
    }

    @SuppressWarnings("unchecked")
    private <R> StageResult<R> propagate() {
        return (StageResult<R>) this;
    }
}
