package villagecompute.autopost.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A note already posted on an account, as returned by the user-posted listing.
 *
 * @param noteId
 *            platform note id
 * @param title
 *            display title
 * @param type
 *            {@code normal} for image notes, {@code video} for videos
 * @param likedCount
 *            like count as displayed (the platform abbreviates large numbers, e.g. "1.2万")
 * @param coverUrl
 *            cover image URL
 */
public record PlatformNoteType(@JsonProperty("note_id") String noteId, String title, String type,
        @JsonProperty("liked_count") String likedCount, @JsonProperty("cover_url") String coverUrl) {
}
