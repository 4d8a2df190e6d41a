/* Copyright (c) 2025 VillageCompute Inc. All rights reserved. */
package villagecompute.autopost.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import villagecompute.autopost.config.ExecutorConfig;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;
import villagecompute.autopost.exceptions.SchedulingException;
import villagecompute.autopost.observability.LoggingConfig;
import villagecompute.autopost.services.ScheduledPostStore;
import villagecompute.autopost.services.ScheduledPostStore.PostFilter;

/**
 * In-memory one-shot timers for PENDING posts.
 *
 * <p>
 * Timers live on the single-thread {@code timer} executor and only hand work to the {@code pipeline} pool, so a slow
 * publish never delays another post's timer. At most one timer exists per post: {@link #schedule} replaces any
 * earlier registration inside one {@link ConcurrentHashMap#compute} call.
 *
 * <p>
 * Timers do not survive a restart. {@link #recover()} rebuilds them from the store at startup and fails every PENDING
 * post whose time has already passed. A timer that fires more than {@code autopost.scheduler.misfire-grace} late is
 * treated the same way, with the expiry itself run on the pipeline pool. When that pool refuses a fired post the timer
 * is put back and retried.
 */
@ApplicationScoped
public class PostScheduler {

    private static final Logger LOG = Logger.getLogger(PostScheduler.class);

    static final String EXPIRED_REASON = "expired during downtime";

    static final Duration REJECTED_RETRY = Duration.ofSeconds(30);

    private final ConcurrentHashMap<Long, ScheduledTimer> timers = new ConcurrentHashMap<>();

    private final AtomicLong registrations = new AtomicLong();

    @Inject
    ScheduledPostStore store;

    @Inject
    PublishPipelineExecutor pipeline;

    @Inject
    @Named(ExecutorConfig.TIMER)
    ScheduledExecutorService timerExecutor;

    @Inject
    @Named(ExecutorConfig.PIPELINE)
    ExecutorService pipelineExecutor;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry meterRegistry;

    @ConfigProperty(
            name = "autopost.scheduler.misfire-grace",
            defaultValue = "300s")
    Duration misfireGrace;

    @ConfigProperty(
            name = "autopost.scheduler.recover-on-startup",
            defaultValue = "true")
    boolean recoverOnStartup;

    /**
     * Result of a startup recovery pass.
     */
    public record RecoveryReport(int scheduled, int expired) {
    }

    void onStart(@Observes StartupEvent event) {
        if (!recoverOnStartup) {
            LOG.info("Startup recovery disabled");
            return;
        }
        recover();
    }

    /**
     * Re-registers timers for every PENDING post and expires the ones already in the past.
     */
    public RecoveryReport recover() {
        List<ScheduledPost> pending = store.list(PostFilter.byStatus(PostStatus.PENDING));
        Instant now = clock.instant();
        int scheduled = 0;
        int expired = 0;

        for (ScheduledPost post : pending) {
            if (post.scheduledAt.isBefore(now)) {
                if (pipeline.expire(post.id, EXPIRED_REASON)) {
                    expired++;
                }
            } else {
                try {
                    schedule(post.id, post.scheduledAt);
                    scheduled++;
                } catch (SchedulingException e) {
                    LOG.errorf(e, "Could not restore timer for post %d", post.id);
                }
            }
        }

        LOG.infof("Recovered %d pending posts: %d scheduled, %d expired", pending.size(), scheduled, expired);
        return new RecoveryReport(scheduled, expired);
    }

    /**
     * Registers a one-shot timer for a post, replacing any earlier timer for the same post. A time in the past fires
     * immediately.
     *
     * @throws SchedulingException
     *             if the timer executor rejects the registration
     */
    public void schedule(long postId, Instant runAt) {
        register(postId, runAt, Math.max(0, Duration.between(clock.instant(), runAt).toMillis()), true);
        LOG.debugf("Post %d scheduled for %s", postId, runAt);
    }

    private void register(long postId, Instant runAt, long delayMillis, boolean replace) {
        try {
            timers.compute(postId, (id, previous) -> {
                if (previous != null) {
                    if (!replace) {
                        return previous;
                    }
                    previous.future().cancel(false);
                }
                long seq = registrations.incrementAndGet();
                ScheduledFuture<?> future = timerExecutor.schedule(() -> fire(postId, seq, runAt), delayMillis,
                        TimeUnit.MILLISECONDS);
                return new ScheduledTimer(seq, future, runAt);
            });
        } catch (RejectedExecutionException e) {
            LOG.errorf(e, "Timer registration rejected for post %d", postId);
            throw new SchedulingException("Could not schedule post " + postId, e);
        }
    }

    /**
     * Cancels a timer that has not fired yet.
     *
     * @return true if a timer was removed
     */
    public boolean cancel(long postId) {
        ScheduledTimer timer = timers.remove(postId);
        if (timer == null) {
            return false;
        }
        timer.future().cancel(false);
        LOG.debugf("Timer for post %d cancelled", postId);
        return true;
    }

    public boolean isScheduled(long postId) {
        return timers.containsKey(postId);
    }

    public Set<Long> scheduledJobIds() {
        return Set.copyOf(timers.keySet());
    }

    void fire(long postId, long seq, Instant runAt) {
        // blocks until a compute() still registering this timer has stored it
        AtomicBoolean claimed = new AtomicBoolean();
        timers.computeIfPresent(postId, (id, current) -> {
            if (current.seq() != seq) {
                return current;
            }
            claimed.set(true);
            return null;
        });
        if (!claimed.get()) {
            // replaced or cancelled after this run was already queued
            return;
        }

        LoggingConfig.setJobId(postId);
        LoggingConfig.setRequestOrigin("timer");
        try {
            Duration lateness = Duration.between(runAt, clock.instant());
            if (lateness.compareTo(misfireGrace) > 0) {
                LOG.warnf("Post %d fired %ds late, beyond the %ds grace window", postId, lateness.toSeconds(),
                        misfireGrace.toSeconds());
                pipelineExecutor.execute(() -> {
                    LoggingConfig.setRequestOrigin("timer");
                    pipeline.expire(postId, EXPIRED_REASON);
                });
                meterRegistry.counter("autopost.scheduler.fired", "outcome", "expired").increment();
                return;
            }
            pipelineExecutor.execute(() -> {
                LoggingConfig.setRequestOrigin("timer");
                pipeline.execute(postId);
            });
            meterRegistry.counter("autopost.scheduler.fired", "outcome", "submitted").increment();
        } catch (RejectedExecutionException e) {
            retryRejected(postId, runAt, e);
            meterRegistry.counter("autopost.scheduler.fired", "outcome", "rejected").increment();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Timer for post %d failed", postId);
            meterRegistry.counter("autopost.scheduler.fired", "outcome", "error").increment();
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Puts a timer back for a post the pipeline pool refused. The original run time is kept, so a post refused past
     * its grace window is expired on the retry.
     */
    private void retryRejected(long postId, Instant runAt, RejectedExecutionException cause) {
        try {
            // a schedule() that got in first wins
            register(postId, runAt, REJECTED_RETRY.toMillis(), false);
            LOG.warnf(cause, "Pipeline pool rejected post %d, retrying in %ds", postId, REJECTED_RETRY.toSeconds());
        } catch (SchedulingException e) {
            LOG.errorf(e, "Pipeline pool rejected post %d and its timer could not be restored; "
                    + "it stays PENDING until startup recovery", postId);
        }
    }

    @PreDestroy
    void shutdown() {
        int cancelled = 0;
        for (Long postId : List.copyOf(timers.keySet())) {
            if (cancel(postId)) {
                cancelled++;
            }
        }
        LOG.infof("Scheduler stopped, %d timers cancelled", cancelled);
    }

    private record ScheduledTimer(long seq, ScheduledFuture<?> future, Instant runAt) {
    }
}
