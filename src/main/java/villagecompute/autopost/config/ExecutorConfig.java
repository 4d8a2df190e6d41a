package villagecompute.autopost.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.autopost.data.models.ScheduledPost;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Thread pools and clock for scheduling and pipeline execution.
 *
 * <ul>
 * <li>{@code timer}: single thread firing post timers; never runs pipeline work</li>
 * <li>{@code pipeline}: one task per fired post ({@code autopost.workers}, default 4)</li>
 * <li>{@code images}: concurrent image synthesis for photo-style posts, one thread per image slot of every
 * pipeline worker</li>
 * </ul>
 */
@ApplicationScoped
public class ExecutorConfig {

    private static final Logger LOG = Logger.getLogger(ExecutorConfig.class);

    public static final String TIMER = "timer";
    public static final String PIPELINE = "pipeline";
    public static final String IMAGES = "images";

    @ConfigProperty(
            name = "autopost.workers",
            defaultValue = "4")
    int workers;

    @ConfigProperty(
            name = "autopost.timezone",
            defaultValue = "Asia/Shanghai")
    String timezone;

    @Produces
    @Singleton
    @Named(TIMER)
    ScheduledExecutorService timerExecutor() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("autopost-timer"));
    }

    @Produces
    @Singleton
    @Named(PIPELINE)
    ExecutorService pipelineExecutor() {
        return Executors.newFixedThreadPool(workers, namedThreads("autopost-pipeline"));
    }

    @Produces
    @Singleton
    @Named(IMAGES)
    ExecutorService imageExecutor() {
        return Executors.newFixedThreadPool(imagePoolSize(workers), namedThreads("autopost-images"));
    }

    /**
     * Image pool size for a pipeline pool of {@code workers}; every running job can have all its slots in flight.
     */
    public static int imagePoolSize(int workers) {
        return Math.max(1, workers) * ScheduledPost.MAX_IMAGES;
    }

    /**
     * Clock in the operating timezone; request wall-clock times are interpreted in this zone.
     */
    @Produces
    @Singleton
    Clock clock() {
        return Clock.system(ZoneId.of(timezone));
    }

    void shutdownTimer(@Disposes @Named(TIMER) ScheduledExecutorService executor) {
        shutdown("timer", executor);
    }

    void shutdownPipeline(@Disposes @Named(PIPELINE) ExecutorService executor) {
        shutdown("pipeline", executor);
    }

    void shutdownImages(@Disposes @Named(IMAGES) ExecutorService executor) {
        shutdown("images", executor);
    }

    private static void shutdown(String name, ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warnf("Executor %s did not terminate in 30s, forcing shutdown", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
