package villagecompute.autopost.integration.signing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import villagecompute.autopost.exceptions.SigningException;

/**
 * Unit tests for {@link RetryingRequestSigner}.
 */
class RetryingRequestSignerTest {

    private static final SigningRequest REQUEST = new SigningRequest("/api/sns/web/v1/user/selfinfo", null, "a1=abc");
    private static final SignatureHeaders HEADERS = new SignatureHeaders("XYS_1", "1700000000000", null, null, null);

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void testSign_twoFailuresThenSuccessNoReinitialize() {
        FlakySigner delegate = new FlakySigner(2);
        RetryingRequestSigner signer = new RetryingRequestSigner(delegate, 3, Duration.ZERO, meterRegistry);

        assertSame(HEADERS, signer.sign(REQUEST));
        assertEquals(3, delegate.calls.get());
        assertEquals(0, delegate.reinitializations.get());
        assertEquals(2.0, meterRegistry.counter("autopost.signing.attempts", "outcome", "failure").count());
        assertEquals(1.0, meterRegistry.counter("autopost.signing.attempts", "outcome", "success").count());
    }

    @Test
    void testSign_threeFailuresReinitializeOnceWithFreshBudget() {
        FlakySigner delegate = new FlakySigner(5);
        RetryingRequestSigner signer = new RetryingRequestSigner(delegate, 3, Duration.ZERO, meterRegistry);

        assertSame(HEADERS, signer.sign(REQUEST));
        assertEquals(6, delegate.calls.get());
        assertEquals(1, delegate.reinitializations.get());
        assertEquals(1.0, meterRegistry.counter("autopost.signing.attempts", "outcome", "reinitialized").count());
    }

    @Test
    void testSign_exhaustedAfterReinitialize() {
        FlakySigner delegate = new FlakySigner(Integer.MAX_VALUE);
        RetryingRequestSigner signer = new RetryingRequestSigner(delegate, 3, Duration.ZERO, meterRegistry);

        SigningException e = assertThrows(SigningException.class, () -> signer.sign(REQUEST));

        assertEquals(6, delegate.calls.get());
        assertEquals(1, delegate.reinitializations.get());
        assertTrue(e.getMessage().contains("after re-initialization"));
        assertEquals(1.0, meterRegistry.counter("autopost.signing.attempts", "outcome", "exhausted").count());
    }

    @Test
    void testSign_backoffBetweenAttempts() {
        FlakySigner delegate = new FlakySigner(2);
        RetryingRequestSigner signer = new RetryingRequestSigner(delegate, 3, Duration.ofMillis(50), null);

        long started = System.nanoTime();
        signer.sign(REQUEST);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(elapsedMillis >= 100, "expected two pauses, took " + elapsedMillis + "ms");
    }

    @Test
    void testConstructor_rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryingRequestSigner(new FlakySigner(0), 0, Duration.ZERO, null));
    }

    /**
     * Fails the first {@code failures} calls, then succeeds.
     */
    private static class FlakySigner implements RequestSigner {

        final AtomicInteger calls = new AtomicInteger();
        final AtomicInteger reinitializations = new AtomicInteger();
        private final int failures;

        FlakySigner(int failures) {
            this.failures = failures;
        }

        @Override
        public SignatureHeaders sign(SigningRequest request) {
            if (calls.incrementAndGet() <= failures) {
                throw new SigningException("script error");
            }
            return HEADERS;
        }

        @Override
        public void reinitialize() {
            reinitializations.incrementAndGet();
        }
    }
}
