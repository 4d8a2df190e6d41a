package villagecompute.autopost.integration.signing;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authentication headers for one platform request.
 *
 * @param xS
 *            signature value
 * @param xT
 *            signature timestamp (milliseconds)
 * @param xSCommon
 *            encoded common-signature blob
 * @param traceId
 *            b3 trace id
 * @param xMns
 *            auxiliary token, absent when the signer does not produce one
 */
public record SignatureHeaders(String xS, String xT, String xSCommon, String traceId, String xMns) {

    public SignatureHeaders withMns(String mns) {
        return new SignatureHeaders(xS, xT, xSCommon, traceId, mns);
    }

    /**
     * Header map in the casing the web client sends. Blank values are left out.
     */
    public Map<String, String> toHeaderMap() {
        Map<String, String> headers = new LinkedHashMap<>();
        put(headers, "x-s", xS);
        put(headers, "x-t", xT);
        put(headers, "x-s-common", xSCommon);
        put(headers, "x-b3-traceid", traceId);
        put(headers, "x-mns", xMns);
        return headers;
    }

    private static void put(Map<String, String> headers, String name, String value) {
        if (value != null && !value.isBlank()) {
            headers.put(name, value);
        }
    }
}
