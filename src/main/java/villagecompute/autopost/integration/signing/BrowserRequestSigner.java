package villagecompute.autopost.integration.signing;

import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Lets the platform's own web client compute the signature inside a logged-in page.
 *
 * <p>
 * The page evaluates {@code window._webmsxyw(uri, data)} for {@code X-s}/{@code X-t}; the common-signature blob is
 * then assembled from the {@code a1} cookie and the page's {@code b1} fingerprint. A page can only serve one request
 * at a time, so every operation holds a single fair lock. The page is opened lazily and re-opened whenever a request
 * arrives for a different session.
 */
public class BrowserRequestSigner implements RequestSigner {

    private static final Logger LOG = Logger.getLogger(BrowserRequestSigner.class);

    private final SigningPage page;
    private final CommonSignatureEncoder encoder;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock(true);

    private String loadedCookie;

    public BrowserRequestSigner(SigningPage page, CommonSignatureEncoder encoder, ObjectMapper objectMapper) {
        this.page = page;
        this.encoder = encoder;
        this.objectMapper = objectMapper;
    }

    @Override
    public SignatureHeaders sign(SigningRequest request) {
        lock.lock();
        try {
            if (!request.cookie().equals(loadedCookie)) {
                page.open(request.cookie());
                loadedCookie = request.cookie();
            }
            String bodyJson = request.bodyJson();
            JsonNode encrypted = read(page.evaluate("JSON.stringify(window._webmsxyw(" + quote(request.uri()) + ", "
                    + (bodyJson == null ? "undefined" : bodyJson) + "))"));
            String xS = encrypted.path("X-s").asText("");
            String xT = encrypted.path("X-t").asText("");
            if (xS.isEmpty()) {
                throw new SigningException("Page returned no X-s for " + request.uri());
            }
            String b1 = read(page.evaluate("JSON.stringify(window.localStorage.getItem('b1') || '')")).asText("");
            String a1 = CookieParser.parse(request.cookie()).getOrDefault("a1", "");
            LOG.debugf("Browser-signed %s", request.uri());
            return encoder.encode(a1, b1, xS, xT);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reinitialize() {
        lock.lock();
        try {
            if (loadedCookie == null) {
                return;
            }
            page.reload();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            page.close();
            loadedCookie = null;
        } finally {
            lock.unlock();
        }
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SigningException("Cannot encode signing argument", e);
        }
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SigningException("Page returned malformed JSON", e);
        }
    }
}
