package villagecompute.autopost.integration.signing;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input to one signing call.
 *
 * @param uri
 *            request path including the query string, without host (e.g. {@code /api/sns/web/v1/user_posted?num=30})
 * @param body
 *            JSON body for POST requests, null for GET
 * @param cookie
 *            full session cookie string of the account making the request
 */
public record SigningRequest(String uri, JsonNode body, String cookie) {

    public SigningRequest {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri is required");
        }
        if (cookie == null) {
            cookie = "";
        }
    }

    /**
     * @return compact JSON of the body, or null when there is none
     */
    public String bodyJson() {
        return body == null || body.isNull() ? null : body.toString();
    }

    /**
     * @return compact JSON the body digest is taken over; empty when there is no body or the body is an empty object
     */
    public String digestJson() {
        if (body == null || body.isNull() || (body.isContainerNode() && body.size() == 0)) {
            return "";
        }
        return body.toString();
    }
}
