package villagecompute.autopost.integration.signing;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.autopost.exceptions.SigningException;

/**
 * Builds the {@code x-s-common} header from the page-computed {@code X-s}/{@code X-t} pair.
 *
 * <p>
 * The blob is compact JSON describing the client (platform code, web build, the {@code a1} cookie and {@code b1}
 * device fingerprint) plus a checksum over {@code X-t + X-s + b1}, encoded with the web client's shuffled base64
 * alphabet.
 */
public class CommonSignatureEncoder {

    static final String STANDARD_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";
    static final String SHUFFLED_ALPHABET = "ZmserbBoHQtNP+wOcza/LpngG8yJq42KWYj0DSfdikx3VT16IlUAFM97hECvuRX5";

    private static final String TRACE_ALPHABET = "abcdef0123456789";
    private static final int CHECKSUM_PREFIX = 57;
    private static final long CHECKSUM_MASK = 0xEDB88320L;

    private final ObjectMapper objectMapper;
    private final String clientVersion;
    private final String webBuild;
    private final SecureRandom random = new SecureRandom();

    public CommonSignatureEncoder(ObjectMapper objectMapper, String clientVersion, String webBuild) {
        this.objectMapper = objectMapper;
        this.clientVersion = clientVersion;
        this.webBuild = webBuild;
    }

    public SignatureHeaders encode(String a1, String b1, String xS, String xT) {
        String safeB1 = b1 == null ? "" : b1;
        Map<String, Object> common = new LinkedHashMap<>();
        common.put("s0", 3);
        common.put("s1", "");
        common.put("x0", "1");
        common.put("x1", clientVersion);
        common.put("x2", "Mac OS");
        common.put("x3", "xhs-pc-web");
        common.put("x4", webBuild);
        common.put("x5", a1 == null ? "" : a1);
        common.put("x6", xT);
        common.put("x7", xS);
        common.put("x8", safeB1);
        common.put("x9", checksum(xT + xS + safeB1));
        common.put("x10", 154);
        try {
            byte[] json = objectMapper.writeValueAsString(common).getBytes(StandardCharsets.UTF_8);
            return new SignatureHeaders(xS, xT, shuffledBase64(json), traceId(), null);
        } catch (JsonProcessingException e) {
            throw new SigningException("Failed to encode common signature", e);
        }
    }

    /**
     * CRC-32 over the first 57 characters, xored with the polynomial and read as a signed int.
     */
    static int checksum(String value) {
        String prefix = value.length() > CHECKSUM_PREFIX ? value.substring(0, CHECKSUM_PREFIX) : value;
        CRC32 crc = new CRC32();
        crc.update(prefix.getBytes(StandardCharsets.ISO_8859_1));
        return (int) (crc.getValue() ^ CHECKSUM_MASK);
    }

    static String shuffledBase64(byte[] data) {
        String standard = Base64.getEncoder().encodeToString(data);
        StringBuilder out = new StringBuilder(standard.length());
        for (int i = 0; i < standard.length(); i++) {
            char c = standard.charAt(i);
            int idx = STANDARD_ALPHABET.indexOf(c);
            out.append(idx < 0 ? c : SHUFFLED_ALPHABET.charAt(idx));
        }
        return out.toString();
    }

    String traceId() {
        StringBuilder sb = new StringBuilder(16);
        for (int i = 0; i < 16; i++) {
            sb.append(TRACE_ALPHABET.charAt(random.nextInt(TRACE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
