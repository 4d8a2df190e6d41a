package villagecompute.autopost.data.models;

import java.util.List;
import java.util.Locale;

/**
 * The single visual style family that governs every image of one post.
 *
 * <p>
 * {@link #POSTER} needs visual continuity across images, so its images are generated one after another with the first
 * result passed back as a reference. {@link #PHOTO} images are independent and generated concurrently.
 */
public enum VisualStyle {

    PHOTO("photo", "手机随手抓拍的真实生活照片，构图随意略有倾斜，自然光偶有过曝，带轻微噪点和手持晃动感，不加滤镜，",
            List.of("随手抓拍", "生活照片", "手持晃动", "抓拍风格")),
    POSTER("poster", "海报设计风格，画面无水印，", List.of("海报设计风格", "商业海报", "构图精准"));

    private final String code;
    private final String promptPrefix;
    private final List<String> keywords;

    VisualStyle(String code, String promptPrefix, List<String> keywords) {
        this.code = code;
        this.promptPrefix = promptPrefix;
        this.keywords = keywords;
    }

    public String getCode() {
        return code;
    }

    public boolean requiresContinuity() {
        return this == POSTER;
    }

    /**
     * Prepends the style prefix unless the prompt already names the style.
     *
     * @param prompt
     *            resolved image prompt
     * @return prompt ready for the image API
     */
    public String decorate(String prompt) {
        for (String keyword : keywords) {
            if (prompt.contains(keyword)) {
                return prompt;
            }
        }
        return promptPrefix + prompt;
    }

    /**
     * Lenient parse of generator output. Anything mentioning "poster" is {@link #POSTER}, everything else
     * {@link #PHOTO}.
     */
    public static VisualStyle parse(String value) {
        if (value != null && value.toLowerCase(Locale.ROOT).contains(POSTER.code)) {
            return POSTER;
        }
        return PHOTO;
    }
}
