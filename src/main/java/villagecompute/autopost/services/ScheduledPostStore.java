package villagecompute.autopost.services;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;

/**
 * Durable record of scheduled posts.
 *
 * <p>
 * Every status change is a compare-and-set: {@link #transition} succeeds only if the stored status still equals
 * {@code from}, which is how the scheduler and a manual run-now trigger avoid executing the same post twice. Storage
 * failures are not caught here; they propagate to the caller.
 */
public interface ScheduledPostStore {

    /**
     * Persists a new post in PENDING state.
     *
     * @return assigned id
     */
    long create(ScheduledPost post);

    /**
     * @return the post, or empty if no row has this id
     */
    Optional<ScheduledPost> get(long id);

    List<ScheduledPost> list(PostFilter filter);

    /**
     * Atomically moves a post from {@code from} to {@code to} and applies {@code fields} in the same unit of work.
     *
     * @return false if the stored status was not {@code from} (race lost or row missing)
     * @throws IllegalArgumentException
     *             if {@code from -> to} is not a forward transition
     */
    boolean transition(long id, PostStatus from, PostStatus to, PostTransition fields);

    /**
     * Resets a DONE or FAILED post to PENDING at a new time and clears its error fields. The only way out of a
     * terminal status.
     *
     * @return false if the post is missing or not terminal
     */
    boolean requeue(long id, Instant runAt);

    boolean delete(long id);

    /**
     * List filter; null fields match everything.
     */
    record PostFilter(PostStatus status, String accountId, Long goalId) {

        public static PostFilter all() {
            return new PostFilter(null, null, null);
        }

        public static PostFilter byStatus(PostStatus status) {
            return new PostFilter(status, null, null);
        }

        public boolean matches(ScheduledPost post) {
            return (status == null || status == post.status) && (accountId == null || accountId.equals(post.accountId))
                    && (goalId == null || goalId.equals(post.goalId));
        }
    }
}
