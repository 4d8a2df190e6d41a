/* Copyright (c) 2025 VillageCompute Inc. All rights reserved. */
package villagecompute.autopost.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.autopost.api.types.CreateScheduledPostRequestType;
import villagecompute.autopost.data.models.AspectRatio;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;
import villagecompute.autopost.exceptions.ResourceNotFoundException;
import villagecompute.autopost.exceptions.SchedulingException;
import villagecompute.autopost.exceptions.ValidationException;
import villagecompute.autopost.jobs.PostScheduler;
import villagecompute.autopost.jobs.PublishPipelineExecutor;
import villagecompute.autopost.services.ScheduledPostStore.PostFilter;

/**
 * Entry point for creating and triggering scheduled posts.
 *
 * <p>
 * Goal planning and the REST resource both go through here so that the store and the scheduler's timers never
 * disagree: every row created gets a timer, and every row removed loses its timer first.
 *
 * <p>
 * <b>Run-now rules:</b>
 * <ul>
 * <li>PENDING: timer cancelled, executed immediately</li>
 * <li>FAILED: re-queued, then executed immediately</li>
 * <li>RUNNING or DONE: rejected</li>
 * </ul>
 *
 * @see PostScheduler
 * @see PublishPipelineExecutor
 */
@ApplicationScoped
public class ScheduledPostService {

    private static final Logger LOG = Logger.getLogger(ScheduledPostService.class);

    static final int MIN_IMAGES = 1;

    static final int MAX_IMAGES = ScheduledPost.MAX_IMAGES;

    @Inject
    ScheduledPostStore store;

    @Inject
    PostScheduler scheduler;

    @Inject
    PublishPipelineExecutor pipeline;

    @Inject
    AccountService accountService;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "autopost.scheduler.misfire-grace",
            defaultValue = "300s")
    Duration misfireGrace;

    /**
     * Validates and creates a batch of posts, then registers a timer for each. Nothing is created if any request is
     * invalid.
     *
     * @return ids of the created posts, in request order
     * @throws ValidationException
     *             if an account is unknown, an image count or ratio is out of range, or the time is already further
     *             in the past than the misfire grace window
     */
    public List<Long> schedulePosts(List<CreateScheduledPostRequestType> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<ScheduledPost> posts = new ArrayList<>(requests.size());
        for (CreateScheduledPostRequestType request : requests) {
            posts.add(toPost(request));
        }

        List<Long> ids = new ArrayList<>(posts.size());
        for (ScheduledPost post : posts) {
            long id = store.create(post);
            ids.add(id);
            try {
                scheduler.schedule(id, post.scheduledAt);
            } catch (SchedulingException e) {
                // row stays PENDING; the next startup recovery registers it
                LOG.errorf(e, "Post %d created without a timer", id);
            }
        }
        LOG.infof("Scheduled %d posts", ids.size());
        return ids;
    }

    /**
     * Runs a post now instead of at its scheduled time.
     *
     * @return completion of the asynchronous run
     * @throws ResourceNotFoundException
     *             if the post does not exist
     * @throws ValidationException
     *             if the post is RUNNING or DONE
     * @throws SchedulingException
     *             if the pipeline pool refuses the run; the post is left PENDING with a timer
     */
    public CompletableFuture<Optional<ScheduledPost>> runNow(long id) {
        ScheduledPost post = require(id);
        Instant runAt = post.scheduledAt;
        switch (post.status) {
            case RUNNING -> throw new ValidationException("Post " + id + " is already running");
            case DONE -> throw new ValidationException("Post " + id + " is already published; re-queue it first");
            case FAILED -> {
                runAt = clock.instant();
                if (!store.requeue(id, runAt)) {
                    throw new ValidationException("Post " + id + " changed state, try again");
                }
                LOG.infof("Post %d re-queued for run-now", id);
            }
            case PENDING -> {
                // timer cancelled once the run is accepted
            }
        }
        CompletableFuture<Optional<ScheduledPost>> run;
        try {
            run = pipeline.executeAsync(id, "run-now");
        } catch (RejectedExecutionException e) {
            LOG.errorf(e, "Pipeline pool rejected run-now for post %d", id);
            scheduler.schedule(id, runAt);
            throw new SchedulingException("Post " + id + " could not be started, it stays scheduled for " + runAt, e);
        }
        // the timer stays until the run is accepted; whichever claims the post first wins
        scheduler.cancel(id);
        return run;
    }

    /**
     * Cancels a post: its timer is removed and the row deleted.
     */
    public void cancel(long id) {
        require(id);
        scheduler.cancel(id);
        store.delete(id);
        LOG.infof("Post %d cancelled", id);
    }

    /**
     * Deletes a post in any status. A run already in progress is not interrupted.
     */
    public void delete(long id) {
        scheduler.cancel(id);
        if (!store.delete(id)) {
            throw new ResourceNotFoundException("Scheduled post not found: " + id);
        }
    }

    /**
     * Moves a DONE or FAILED post back to PENDING and schedules it.
     *
     * @throws ValidationException
     *             if the post is PENDING or RUNNING
     */
    public void requeue(long id, LocalDateTime runAt) {
        ScheduledPost post = require(id);
        if (!post.status.isTerminal()) {
            throw new ValidationException("Post " + id + " is " + post.status + ", only DONE or FAILED can be re-queued");
        }
        Instant at = runAt == null ? clock.instant() : notExpired(runAt.atZone(clock.getZone()).toInstant());
        if (!store.requeue(id, at)) {
            throw new ValidationException("Post " + id + " changed state, try again");
        }
        scheduler.schedule(id, at);
    }

    public List<ScheduledPost> list(PostStatus status, String accountId) {
        return store.list(new PostFilter(status, accountId, null));
    }

    public ScheduledPost get(long id) {
        return require(id);
    }

    private ScheduledPost require(long id) {
        return store.get(id).orElseThrow(() -> new ResourceNotFoundException("Scheduled post not found: " + id));
    }

    private ScheduledPost toPost(CreateScheduledPostRequestType request) {
        if (request.accountId() == null || !accountService.exists(request.accountId())) {
            throw new ValidationException("Unknown account: " + request.accountId());
        }
        if (request.topic() == null || request.topic().isBlank()) {
            throw new ValidationException("Topic is required");
        }
        int imageCount = request.imageCount() == null ? 0 : request.imageCount();
        if (imageCount < MIN_IMAGES || imageCount > MAX_IMAGES) {
            throw new ValidationException(
                    "Image count must be between " + MIN_IMAGES + " and " + MAX_IMAGES + ", got " + imageCount);
        }
        if (request.scheduledAt() == null) {
            throw new ValidationException("Scheduled time is required");
        }

        ScheduledPost post = new ScheduledPost();
        post.goalId = request.goalId();
        post.accountId = request.accountId();
        post.topic = request.topic().trim();
        post.style = request.style();
        post.aspectRatio = AspectRatio.fromLabel(request.aspectRatio());
        post.imageCount = imageCount;
        post.referenceGroupIds = request.referenceGroupIds() == null
                ? new ArrayList<>()
                : new ArrayList<>(request.referenceGroupIds());
        post.scheduledAt = notExpired(request.scheduledAt().atZone(clock.getZone()).toInstant());
        return post;
    }

    /**
     * Times inside the grace window fire at once; older ones would only ever expire.
     */
    private Instant notExpired(Instant at) {
        Instant earliest = clock.instant().minus(misfireGrace);
        if (at.isBefore(earliest)) {
            throw new ValidationException("Scheduled time " + LocalDateTime.ofInstant(at, clock.getZone())
                    + " is more than " + misfireGrace.toMinutes() + " minutes in the past");
        }
        return at;
    }
}
