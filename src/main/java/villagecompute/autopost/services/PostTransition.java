package villagecompute.autopost.services;

import java.util.List;

import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.data.models.ScheduledPost;

/**
 * Fields written together with a status change. Null fields are left as stored.
 */
public record PostTransition(String resultTitle, String resultBody, List<String> resultHashtags,
        List<GeneratedImageType> resultImages, String noteId, String error, String failedStage, String errorKind) {

    private static final PostTransition NONE = new PostTransition(null, null, null, null, null, null, null, null);

    public static PostTransition none() {
        return NONE;
    }

    public static PostTransition published(NoteContentType content, List<GeneratedImageType> images, String noteId) {
        return new PostTransition(content.title(), content.body(), content.hashtags(), images, noteId, null, null,
                null);
    }

    public static PostTransition failed(String failedStage, String errorKind, String error) {
        return new PostTransition(null, null, null, null, null, error, failedStage, errorKind);
    }

    public void applyTo(ScheduledPost post) {
        if (resultTitle != null) {
            post.resultTitle = resultTitle;
        }
        if (resultBody != null) {
            post.resultBody = resultBody;
        }
        if (resultHashtags != null) {
            post.resultHashtags = List.copyOf(resultHashtags);
        }
        if (resultImages != null) {
            post.resultImages = List.copyOf(resultImages);
        }
        if (noteId != null) {
            post.noteId = noteId;
        }
        if (error != null) {
            post.error = error;
        }
        if (failedStage != null) {
            post.failedStage = failedStage;
        }
        if (errorKind != null) {
            post.errorKind = errorKind;
        }
    }
}
