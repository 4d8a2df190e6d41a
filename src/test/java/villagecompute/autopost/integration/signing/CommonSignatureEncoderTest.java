package villagecompute.autopost.integration.signing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.CRC32;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unit tests for {@link CommonSignatureEncoder}.
 */
class CommonSignatureEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testShuffledBase64_mapsAlphabet() {
        assertEquals(64, CommonSignatureEncoder.SHUFFLED_ALPHABET.chars().distinct().count());
        // standard "MQ==": M (12) becomes P, Q (16) becomes c, padding is kept
        assertEquals("Pc==", CommonSignatureEncoder.shuffledBase64("1".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testEncode_roundTripsThroughShuffledAlphabet() throws Exception {
        CommonSignatureEncoder encoder = new CommonSignatureEncoder(objectMapper, "3.7.8-2", "4.27.2");

        SignatureHeaders headers = encoder.encode("18f0c2d5e7", "b1value", "XYS_abc", "1700000000000");

        JsonNode common = objectMapper.readTree(unshuffle(headers.xSCommon()));
        assertEquals(3, common.path("s0").asInt());
        assertEquals("3.7.8-2", common.path("x1").asText());
        assertEquals("xhs-pc-web", common.path("x3").asText());
        assertEquals("18f0c2d5e7", common.path("x5").asText());
        assertEquals("1700000000000", common.path("x6").asText());
        assertEquals("XYS_abc", common.path("x7").asText());
        assertEquals("b1value", common.path("x8").asText());
        assertEquals(CommonSignatureEncoder.checksum("1700000000000XYS_abcb1value"), common.path("x9").asInt());
        assertEquals(154, common.path("x10").asInt());
        assertEquals(16, headers.traceId().length());
        assertTrue(headers.traceId().matches("[a-f0-9]{16}"));
    }

    @Test
    void testChecksum_usesFirst57Characters() {
        String base = "a".repeat(57);
        assertEquals(CommonSignatureEncoder.checksum(base), CommonSignatureEncoder.checksum(base + "tail"));
        assertNotEquals(CommonSignatureEncoder.checksum(base), CommonSignatureEncoder.checksum("b" + base));

        CRC32 crc = new CRC32();
        crc.update("abc".getBytes(StandardCharsets.ISO_8859_1));
        assertEquals((int) (crc.getValue() ^ 0xEDB88320L), CommonSignatureEncoder.checksum("abc"));
    }

    private static String unshuffle(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            int idx = CommonSignatureEncoder.SHUFFLED_ALPHABET.indexOf(c);
            out.append(idx < 0 ? c : CommonSignatureEncoder.STANDARD_ALPHABET.charAt(idx));
        }
        return new String(Base64.getDecoder().decode(out.toString()), StandardCharsets.UTF_8);
    }
}
