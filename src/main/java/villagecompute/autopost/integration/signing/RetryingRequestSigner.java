package villagecompute.autopost.integration.signing;

import java.time.Duration;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import villagecompute.autopost.exceptions.SigningException;

/**
 * Retry policy shared by both signing strategies.
 *
 * <p>
 * Up to {@code attempts} tries with a fixed backoff. If every try fails, the delegate is re-initialized exactly once
 * and gets a fresh budget. If that budget is also exhausted a {@link SigningException} is thrown; callers must treat it
 * as final.
 */
public class RetryingRequestSigner implements RequestSigner {

    private static final Logger LOG = Logger.getLogger(RetryingRequestSigner.class);

    private final RequestSigner delegate;
    private final int attempts;
    private final Duration backoff;
    private final MeterRegistry meterRegistry;

    public RetryingRequestSigner(RequestSigner delegate, int attempts, Duration backoff, MeterRegistry meterRegistry) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1");
        }
        this.delegate = delegate;
        this.attempts = attempts;
        this.backoff = backoff;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public SignatureHeaders sign(SigningRequest request) {
        RuntimeException last;
        try {
            return attemptBudget(request);
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            last = e;
        }

        LOG.warnf("Signing %s failed %d times, re-initializing signer: %s", request.uri(), attempts,
                last.getMessage());
        record("reinitialized");
        try {
            delegate.reinitialize();
            return attemptBudget(request);
        } catch (RuntimeException e) {
            record("exhausted");
            LOG.errorf(e, "Signing %s failed after re-initialization", request.uri());
            throw new SigningException("Request signing failed after re-initialization: " + e.getMessage(), e);
        }
    }

    private SignatureHeaders attemptBudget(SigningRequest request) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                SignatureHeaders headers = delegate.sign(request);
                record("success");
                return headers;
            } catch (RuntimeException e) {
                last = e;
                record("failure");
                LOG.debugf("Signing attempt %d/%d for %s failed: %s", attempt, attempts, request.uri(),
                        e.getMessage());
                if (attempt < attempts) {
                    pause();
                }
            }
        }
        throw last;
    }

    private void pause() {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SigningException("Interrupted between signing attempts", e);
        }
    }

    private void record(String outcome) {
        if (meterRegistry != null) {
            meterRegistry.counter("autopost.signing.attempts", "outcome", outcome).increment();
        }
    }

    @Override
    public void reinitialize() {
        delegate.reinitialize();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
