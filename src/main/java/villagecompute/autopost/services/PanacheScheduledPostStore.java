package villagecompute.autopost.services;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;

/**
 * PostgreSQL-backed store. The status compare-and-set is a single {@code UPDATE ... WHERE status = ?}, so two
 * concurrent transitions from the same status serialize on the row lock and only one sees an updated row.
 */
@ApplicationScoped
public class PanacheScheduledPostStore implements ScheduledPostStore {

    private static final Logger LOG = Logger.getLogger(PanacheScheduledPostStore.class);

    @Inject
    Clock clock;

    @Override
    @Transactional
    public long create(ScheduledPost post) {
        Instant now = clock.instant();
        post.status = PostStatus.PENDING;
        post.createdAt = now;
        post.updatedAt = now;
        post.persist();
        LOG.infof("Created scheduled post %d (account=%s, topic=%s, scheduled=%s)", post.id, post.accountId, post.topic,
                post.scheduledAt);
        return post.id;
    }

    @Override
    @Transactional
    public Optional<ScheduledPost> get(long id) {
        return ScheduledPost.findByIdOptional(id);
    }

    @Override
    @Transactional
    public List<ScheduledPost> list(PostFilter filter) {
        PostFilter f = filter == null ? PostFilter.all() : filter;
        List<String> clauses = new ArrayList<>();
        Parameters params = new Parameters();
        if (f.status() != null) {
            clauses.add("status = :status");
            params.and("status", f.status());
        }
        if (f.accountId() != null) {
            clauses.add("accountId = :accountId");
            params.and("accountId", f.accountId());
        }
        if (f.goalId() != null) {
            clauses.add("goalId = :goalId");
            params.and("goalId", f.goalId());
        }
        if (clauses.isEmpty()) {
            return ScheduledPost.listAll(Sort.by("scheduledAt"));
        }
        return ScheduledPost.list(String.join(" AND ", clauses) + " ORDER BY scheduledAt ASC", params);
    }

    @Override
    @Transactional
    public boolean transition(long id, PostStatus from, PostStatus to, PostTransition fields) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalArgumentException("Illegal status transition " + from + " -> " + to);
        }
        int updated = ScheduledPost.compareAndSetStatus(id, from, to, clock.instant());
        if (updated == 0) {
            LOG.debugf("Transition %s -> %s lost for post %d", from, to, id);
            return false;
        }
        ScheduledPost post = ScheduledPost.findById(id);
        if (fields != null) {
            fields.applyTo(post);
        }
        LOG.infof("Post %d: %s -> %s", id, from, to);
        return true;
    }

    @Override
    @Transactional
    public boolean requeue(long id, Instant runAt) {
        int updated = ScheduledPost.update(
                "status = ?1, scheduledAt = ?2, error = null, failedStage = null, errorKind = null, updatedAt = ?3 "
                        + "WHERE id = ?4 AND status IN (?5, ?6)",
                PostStatus.PENDING, runAt, clock.instant(), id, PostStatus.DONE, PostStatus.FAILED);
        if (updated > 0) {
            LOG.infof("Post %d re-queued for %s", id, runAt);
        }
        return updated > 0;
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        boolean deleted = ScheduledPost.deleteById(id);
        if (deleted) {
            LOG.infof("Deleted scheduled post %d", id);
        }
        return deleted;
    }
}
