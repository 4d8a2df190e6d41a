package villagecompute.autopost.integration.signing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Unit tests for {@link ScriptRequestSigner}.
 */
class ScriptRequestSignerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RecordingEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new RecordingEvaluator();
    }

    @Test
    void testSign_passesUriBodyAndCookie() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, null);
        ObjectNode body = objectMapper.createObjectNode().put("keyword", "咖啡");

        SignatureHeaders headers = signer.sign(new SigningRequest("/web_api/sns/v1/search/topic", body, "a1=x"));

        assertEquals("XYW_sig", headers.xS());
        assertEquals("1700000000000", headers.xT());
        assertEquals("common", headers.xSCommon());
        assertNull(headers.xMns());
        assertEquals(List.of("sign"), evaluator.functions);
        assertEquals(List.of("\"/web_api/sns/v1/search/topic\"", "{\"keyword\":\"咖啡\"}", "\"a1=x\""),
                evaluator.arguments.get(0));
    }

    @Test
    void testSign_getRequestPassesNullBody() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, null);

        signer.sign(new SigningRequest("/api/sns/web/v1/user/selfinfo", null, "a1=x"));

        assertEquals("null", evaluator.arguments.get(0).get(1));
    }

    @Test
    void testSign_addsMnsToken() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, "window.getMnsToken");

        SignatureHeaders headers = signer.sign(new SigningRequest("/api/sns/web/v1/user/selfinfo", null, "a1=x"));

        assertEquals("mns-token", headers.xMns());
        assertEquals(List.of("sign", "window.getMnsToken"), evaluator.functions);
        // md5 of the empty string
        assertEquals("\"d41d8cd98f00b204e9800998ecf8427e\"", evaluator.arguments.get(1).get(2));
        assertEquals("mns-token", headers.toHeaderMap().get("x-mns"));
    }

    @Test
    void testSign_emptyBodyDigestsEmptyString() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, "window.getMnsToken");

        signer.sign(new SigningRequest("/api/sns/web/v1/user_posted?num=30", objectMapper.createObjectNode(), "a1=x"));

        assertEquals("\"d41d8cd98f00b204e9800998ecf8427e\"", evaluator.arguments.get(1).get(2));
    }

    @Test
    void testSign_mnsDigestCoversCompactBody() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, "window.getMnsToken");
        ObjectNode body = objectMapper.createObjectNode().put("keyword", "咖啡");

        signer.sign(new SigningRequest("/web_api/sns/v1/search/topic", body, "a1=x"));

        String digest = ScriptRequestSigner.md5("{\"keyword\":\"咖啡\"}");
        assertEquals("\"" + digest + "\"", evaluator.arguments.get(1).get(2));
        assertEquals("{\"keyword\":\"咖啡\"}", evaluator.arguments.get(1).get(1));
    }

    @Test
    void testSign_missingSignatureFails() {
        evaluator.signResult = "{\"x-t\":\"1\"}";
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, null);

        assertThrows(SigningException.class, () -> signer.sign(new SigningRequest("/a", null, "")));
    }

    @Test
    void testReinitialize_reloadsScripts() {
        ScriptRequestSigner signer = new ScriptRequestSigner(evaluator, objectMapper, null);

        signer.reinitialize();

        assertEquals(1, evaluator.reloads);
    }

    @Test
    void testHeaderMap_skipsBlankValues() {
        Map<String, String> headers = new SignatureHeaders("s", "t", "", null, null).toHeaderMap();

        assertEquals(Map.of("x-s", "s", "x-t", "t"), headers);
    }

    @Test
    void testCookieParser() {
        Map<String, String> cookies = CookieParser.parse(" a1=18f0c2; web_session=0400; broken; =x; webId=abc=def");

        assertEquals("18f0c2", cookies.get("a1"));
        assertEquals("0400", cookies.get("web_session"));
        assertEquals("abc=def", cookies.get("webId"));
        assertEquals(3, cookies.size());
    }

    private static class RecordingEvaluator implements ScriptEvaluator {

        final List<String> functions = new ArrayList<>();
        final List<List<String>> arguments = new ArrayList<>();
        String signResult = "{\"x-s\":\"XYW_sig\",\"x-t\":\"1700000000000\",\"x-s-common\":\"common\"}";
        int reloads;

        @Override
        public String call(String function, List<String> jsonArgs) {
            functions.add(function);
            arguments.add(List.copyOf(jsonArgs));
            return "sign".equals(function) ? signResult : "\"mns-token\"";
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
