package villagecompute.autopost.integration.signing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Signs requests by calling the bundled script's {@code sign(uri, data, cookie)} function, and, when an auxiliary
 * function is configured, {@code getMnsToken(uri, data, md5(data))} for the {@code x-mns} header.
 *
 * <p>
 * Safe for concurrent use; each call is an independent evaluation.
 */
public class ScriptRequestSigner implements RequestSigner {

    private static final Logger LOG = Logger.getLogger(ScriptRequestSigner.class);

    public static final String SIGN_FUNCTION = "sign";

    private final ScriptEvaluator evaluator;
    private final ObjectMapper objectMapper;
    private final String mnsFunction;

    /**
     * @param mnsFunction
     *            global name of the auxiliary token function, or null to skip {@code x-mns}
     */
    public ScriptRequestSigner(ScriptEvaluator evaluator, ObjectMapper objectMapper, String mnsFunction) {
        this.evaluator = evaluator;
        this.objectMapper = objectMapper;
        this.mnsFunction = mnsFunction;
    }

    @Override
    public SignatureHeaders sign(SigningRequest request) {
        String uriArg = quote(request.uri());
        String bodyJson = request.bodyJson();
        String bodyArg = bodyJson == null ? "null" : bodyJson;

        JsonNode result = read(evaluator.call(SIGN_FUNCTION, List.of(uriArg, bodyArg, quote(request.cookie()))));
        String xS = result.path("x-s").asText("");
        if (xS.isEmpty()) {
            throw new SigningException("Signing script returned no x-s for " + request.uri());
        }
        SignatureHeaders headers = new SignatureHeaders(xS, result.path("x-t").asText(""),
                result.path("x-s-common").asText(null), result.path("x-b3-traceid").asText(null), null);

        if (mnsFunction != null) {
            List<String> args = new ArrayList<>(List.of(uriArg, bodyArg, quote(md5(request.digestJson()))));
            headers = headers.withMns(read(evaluator.call(mnsFunction, args)).asText(null));
        }
        LOG.debugf("Script-signed %s", request.uri());
        return headers;
    }

    @Override
    public void reinitialize() {
        evaluator.reload();
    }

    @Override
    public void close() {
        evaluator.close();
    }

    /**
     * MD5 hex of the compact body JSON; null hashes the empty string.
     */
    static String md5(String bodyJson) {
        try {
            MessageDigest digest = MessageDigest.getInstance("MD5");
            byte[] hash = digest.digest((bodyJson == null ? "" : bodyJson).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
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
            throw new SigningException("Signing script returned malformed JSON", e);
        }
    }
}
