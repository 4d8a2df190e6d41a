package villagecompute.autopost.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.autopost.data.models.VisualStyle;

/**
 * Generated copy for one note plus the per-slot image prompts.
 *
 * @param title
 *            note title (the platform limits titles to 20 characters)
 * @param body
 *            note body without hashtags
 * @param hashtags
 *            topic names without the leading {@code #}
 * @param imagePrompts
 *            one draft prompt per image slot, in order
 * @param visualStyle
 *            unified style for every image of the note
 */
public record NoteContentType(String title, String body, List<String> hashtags,
        @JsonProperty("image_prompts") List<String> imagePrompts,
        @JsonProperty("visual_style") VisualStyle visualStyle) {

    /**
     * Description text sent to the platform: body, a blank line, then space-separated {@code #tag}s.
     */
    public String description() {
        if (hashtags == null || hashtags.isEmpty()) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body == null ? "" : body).append("\n\n");
        for (int i = 0; i < hashtags.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append('#').append(hashtags.get(i));
        }
        return sb.toString();
    }
}
