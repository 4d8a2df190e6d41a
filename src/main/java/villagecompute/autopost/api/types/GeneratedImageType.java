package villagecompute.autopost.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One synthesized image slot, as stored in a post's result payload.
 *
 * @param prompt
 *            final prompt sent to the image API
 * @param url
 *            URL returned by the image API, or null if the API answered with inline data
 * @param inlineData
 *            base64 image data when no URL was returned
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeneratedImageType(String prompt, String url, @JsonProperty("inline_data") String inlineData) {

    public boolean isEmpty() {
        return (url == null || url.isBlank()) && (inlineData == null || inlineData.isBlank());
    }

    /**
     * Placeholder for a slot whose generation failed.
     */
    public static GeneratedImageType empty(String prompt) {
        return new GeneratedImageType(prompt, null, null);
    }

    /**
     * @return a reference usable by the image API (URL, or a data URI for inline results)
     */
    public String asReference() {
        if (url != null && !url.isBlank()) {
            return url;
        }
        return inlineData == null ? null : "data:image/png;base64," + inlineData;
    }
}
