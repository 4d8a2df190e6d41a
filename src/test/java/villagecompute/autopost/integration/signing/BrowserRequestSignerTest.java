package villagecompute.autopost.integration.signing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Unit tests for {@link BrowserRequestSigner}.
 */
class BrowserRequestSignerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakePage page;
    private BrowserRequestSigner signer;

    @BeforeEach
    void setUp() {
        page = new FakePage();
        signer = new BrowserRequestSigner(page, new CommonSignatureEncoder(objectMapper, "3.7.8-2", "4.27.2"),
                objectMapper);
    }

    @Test
    void testSign_buildsHeadersFromPage() {
        SignatureHeaders headers = signer.sign(new SigningRequest("/api/sns/web/v1/user/selfinfo", null,
                "a1=18f0c2d5e7; web_session=040069"));

        assertEquals("XYS_page", headers.xS());
        assertEquals("1700000000000", headers.xT());
        assertNotNull(headers.xSCommon());
        assertEquals(16, headers.traceId().length());
        assertEquals(List.of("a1=18f0c2d5e7; web_session=040069"), page.opened);
        assertTrue(page.expressions.get(0).contains("\"/api/sns/web/v1/user/selfinfo\", undefined"));
    }

    @Test
    void testSign_reopensOnlyWhenSessionChanges() {
        signer.sign(new SigningRequest("/a", null, "a1=one"));
        signer.sign(new SigningRequest("/b", null, "a1=one"));
        signer.sign(new SigningRequest("/c", null, "a1=two"));

        assertEquals(List.of("a1=one", "a1=two"), page.opened);
    }

    @Test
    void testSign_emptySignatureFails() {
        page.signature = "{}";

        assertThrows(SigningException.class, () -> signer.sign(new SigningRequest("/a", null, "a1=one")));
    }

    @Test
    void testSign_callsAreSerialized() throws Exception {
        page.evaluateDelayMillis = 20;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<SignatureHeaders>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String uri = "/api/" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return signer.sign(new SigningRequest(uri, null, "a1=one"));
                }));
            }
            start.countDown();
            for (Future<SignatureHeaders> future : futures) {
                assertEquals("XYS_page", future.get(10, TimeUnit.SECONDS).xS());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, page.maxConcurrent.get());
    }

    @Test
    void testReinitialize_reloadsOnlyAfterOpen() {
        signer.reinitialize();
        assertEquals(0, page.reloads);

        signer.sign(new SigningRequest("/a", null, "a1=one"));
        signer.reinitialize();
        assertEquals(1, page.reloads);
    }

    private static class FakePage implements SigningPage {

        final List<String> opened = new ArrayList<>();
        final List<String> expressions = new ArrayList<>();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxConcurrent = new AtomicInteger();
        volatile String signature = "{\"X-s\":\"XYS_page\",\"X-t\":\"1700000000000\"}";
        volatile long evaluateDelayMillis;
        int reloads;

        @Override
        public void open(String cookie) {
            opened.add(cookie);
        }

        @Override
        public String evaluate(String expression) {
            int current = inFlight.incrementAndGet();
            maxConcurrent.accumulateAndGet(current, Math::max);
            try {
                if (evaluateDelayMillis > 0) {
                    Thread.sleep(evaluateDelayMillis);
                }
                synchronized (expressions) {
                    expressions.add(expression);
                }
                return expression.contains("_webmsxyw") ? signature : "\"I38rHdgsjopgIvesdVwgIC+oIELmBZ5e3VwXLgFTIxS3\"";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SigningException("interrupted", e);
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public void reload() {
            reloads++;
        }

        @Override
        public void close() {
        }
    }
}
