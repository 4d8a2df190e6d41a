package villagecompute.autopost.api.types;

/**
 * Platform topic attached to a note so the hashtag becomes a clickable link.
 */
public record TopicType(String id, String name, String link) {
}
