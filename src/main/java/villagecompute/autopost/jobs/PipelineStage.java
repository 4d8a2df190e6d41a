package villagecompute.autopost.jobs;

/**
 * The ordered stages of publishing one post. The code is what appears in error text and metrics.
 */
public enum PipelineStage {

    CONTENT_GENERATION("content-generation"),
    PROMPT_GENERATION("prompt-generation"),
    IMAGE_GENERATION("image-generation"),
    ASSET_RETRIEVAL("asset-retrieval"),
    PUBLISH("publish");

    private final String code;

    PipelineStage(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
