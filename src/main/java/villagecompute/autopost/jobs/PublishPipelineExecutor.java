/* Copyright (c) 2025 VillageCompute Inc. All rights reserved. */
package villagecompute.autopost.jobs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.LongFunction;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.api.types.NoteContentType;
import villagecompute.autopost.api.types.ReferenceAssetType;
import villagecompute.autopost.config.ExecutorConfig;
import villagecompute.autopost.data.models.ScheduledPost;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;
import villagecompute.autopost.exceptions.GenerationException;
import villagecompute.autopost.exceptions.IncompleteAssetSetException;
import villagecompute.autopost.exceptions.PlatformRejectedException;
import villagecompute.autopost.exceptions.SigningException;
import villagecompute.autopost.exceptions.VerificationChallengeException;
import villagecompute.autopost.observability.LoggingConfig;
import villagecompute.autopost.services.AssetDownloadService;
import villagecompute.autopost.services.ContentGenerationService;
import villagecompute.autopost.services.ImageSynthesisService;
import villagecompute.autopost.services.NotePublishService;
import villagecompute.autopost.services.NotificationService;
import villagecompute.autopost.services.PostTransition;
import villagecompute.autopost.services.PromptResolutionService;
import villagecompute.autopost.services.ReferenceAssetService;
import villagecompute.autopost.services.ScheduledPostStore;

/**
 * Runs one scheduled post through its five stages and records how it ended.
 *
 * <p>
 * <b>Execution Flow:</b>
 * <ol>
 * <li>Load the post; anything but PENDING is a no-op</li>
 * <li>Claim it with a PENDING to RUNNING compare-and-set; losing the race is a no-op</li>
 * <li>Content generation, prompt resolution, image synthesis, asset retrieval, publish</li>
 * <li>RUNNING to DONE with the result payload, or RUNNING to FAILED with {@code "{stage}: {kind}: {message}"}</li>
 * <li>Notify the operator</li>
 * </ol>
 *
 * <p>
 * Stage failures are values ({@link StageResult}) and always end in FAILED. Exceptions from the store itself are not
 * stage failures; they are logged and propagate, leaving the post RUNNING for an operator to inspect.
 *
 * <p>
 * <b>Telemetry:</b> one span {@code autopost.pipeline.execute} per claimed post, counter
 * {@code autopost.pipeline.runs{outcome,stage}} and timer {@code autopost.pipeline.duration}.
 */
@ApplicationScoped
public class PublishPipelineExecutor {

    private static final Logger LOG = Logger.getLogger(PublishPipelineExecutor.class);

    static final int ERROR_LIMIT = 500;

    static final String EXPIRED_KIND = "expired";

    @Inject
    ScheduledPostStore store;

    @Inject
    ReferenceAssetService referenceAssetService;

    @Inject
    ContentGenerationService contentGenerationService;

    @Inject
    PromptResolutionService promptResolutionService;

    @Inject
    ImageSynthesisService imageSynthesisService;

    @Inject
    AssetDownloadService assetDownloadService;

    @Inject
    NotePublishService notePublishService;

    @Inject
    NotificationService notificationService;

    @Inject
    @Named(ExecutorConfig.PIPELINE)
    ExecutorService pipelineExecutor;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    LongFunction<AssetWorkspace> workspaceFactory = AssetWorkspace::create;

    /**
     * Runs a post on the pipeline pool.
     *
     * @param origin
     *            what triggered the run, for logs
     */
    public CompletableFuture<Optional<ScheduledPost>> executeAsync(long postId, String origin) {
        return CompletableFuture.supplyAsync(() -> {
            LoggingConfig.setRequestOrigin(origin);
            return execute(postId);
        }, pipelineExecutor);
    }

    /**
     * Executes a post synchronously on the calling thread.
     *
     * @return the post as stored after this run, or empty if this call did not run it
     */
    public Optional<ScheduledPost> execute(long postId) {
        try {
            Optional<ScheduledPost> loaded = store.get(postId);
            if (loaded.isEmpty()) {
                LOG.warnf("Post %d not found, skipping", postId);
                return Optional.empty();
            }
            ScheduledPost post = loaded.get();
            if (post.status != PostStatus.PENDING) {
                LOG.infof("Post %d is %s, skipping", postId, post.status);
                return Optional.empty();
            }
            if (!store.transition(postId, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none())) {
                LOG.infof("Post %d was claimed by another run", postId);
                meterRegistry.counter("autopost.pipeline.runs", "outcome", "race_lost", "stage", "none").increment();
                return Optional.empty();
            }
            return Optional.of(run(post));
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Fails a post that missed its window without running any stage. Goes through RUNNING so that no status is ever
     * skipped.
     *
     * @return true if this call moved the post to FAILED
     */
    public boolean expire(long postId, String reason) {
        try {
            LoggingConfig.setJobId(postId);
            if (!store.transition(postId, PostStatus.PENDING, PostStatus.RUNNING, PostTransition.none())) {
                return false;
            }
            String error = truncate(reason);
            store.transition(postId, PostStatus.RUNNING, PostStatus.FAILED,
                    PostTransition.failed(null, EXPIRED_KIND, error));
            meterRegistry.counter("autopost.pipeline.runs", "outcome", EXPIRED_KIND, "stage", "none").increment();
            LOG.warnf("Post %d expired: %s", postId, reason);
            store.get(postId).ifPresent(post -> notificationService.notifyFailed(post, null, error));
            return true;
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private ScheduledPost run(ScheduledPost post) {
        long postId = post.id;
        Span span = tracer.spanBuilder("autopost.pipeline.execute").setAttribute("post.id", postId)
                .setAttribute("post.account_id", post.accountId).setAttribute("post.image_count", post.imageCount)
                .startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "unexpected";
        String stageTag = "none";

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(postId);
            LoggingConfig.setAccountId(post.accountId);
            LOG.infof("Executing post %d (topic=%s, ratio=%s, images=%d)", postId, post.topic,
                    post.aspectRatio.getLabel(), post.imageCount);

            StageResult<Published> result = runStages(post, span);

            if (result.isOk()) {
                Published published = result.value();
                store.transition(postId, PostStatus.RUNNING, PostStatus.DONE,
                        PostTransition.published(published.content(), published.images(), published.noteId()));
                outcome = "done";
                span.addEvent("post.published");
                LOG.infof("Post %d published as note %s", postId, published.noteId());
                notificationService.notifyPublished(post, published.content().title(), published.noteId());
            } else {
                PipelineStage stage = result.failedStage();
                RuntimeException cause = result.cause();
                String kind = classify(cause);
                String error = truncate(stage.getCode() + ": " + kind + ": " + cause.getMessage());
                store.transition(postId, PostStatus.RUNNING, PostStatus.FAILED,
                        PostTransition.failed(stage.getCode(), kind, error));
                outcome = "failed";
                stageTag = stage.getCode();
                span.recordException(cause);
                span.setStatus(StatusCode.ERROR, error);
                span.addEvent("post.failed");
                LOG.errorf(cause, "Post %d failed in %s", postId, stage.getCode());
                notificationService.notifyFailed(post, stage.getCode(), error);
            }
            return store.get(postId).orElse(post);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "pipeline aborted");
            LOG.errorf(e, "Post %d aborted outside a stage, status left as stored", postId);
            throw e;
        } finally {
            meterRegistry.counter("autopost.pipeline.runs", "outcome", outcome, "stage", stageTag).increment();
            sample.stop(Timer.builder("autopost.pipeline.duration").tag("outcome", outcome).register(meterRegistry));
            span.end();
        }
    }

    private StageResult<Published> runStages(ScheduledPost post, Span span) {
        return StageResult.run(PipelineStage.CONTENT_GENERATION, () -> {
            enter(PipelineStage.CONTENT_GENERATION, span);
            ReferenceAssetType references = referenceAssetService.collect(post.referenceGroupIds);
            return new Drafted(references,
                    contentGenerationService.generate(post.topic, post.style, post.imageCount, references));
        }).then(PipelineStage.PROMPT_GENERATION, drafted -> {
            enter(PipelineStage.PROMPT_GENERATION, span);
            return new Prompted(drafted.references(), drafted.content(), promptResolutionService
                    .resolve(post.topic, post.style, drafted.content(), post.imageCount, drafted.references()));
        }).then(PipelineStage.IMAGE_GENERATION, prompted -> {
            enter(PipelineStage.IMAGE_GENERATION, span);
            return new Synthesized(prompted.content(), imageSynthesisService.synthesize(prompted.prompts(),
                    prompted.content().visualStyle(), post.aspectRatio, prompted.references().imageUrls()));
        }).flatThen(synthesized -> retrieveAndPublish(post, synthesized, span));
    }

    private StageResult<Published> retrieveAndPublish(ScheduledPost post, Synthesized synthesized, Span span) {
        enter(PipelineStage.ASSET_RETRIEVAL, span);
        AssetWorkspace workspace;
        try {
            workspace = workspaceFactory.apply(post.id);
        } catch (RuntimeException e) {
            return StageResult.failed(PipelineStage.ASSET_RETRIEVAL, e);
        }

        try (workspace) {
            return StageResult
                    .run(PipelineStage.ASSET_RETRIEVAL,
                            () -> assetDownloadService.retrieve(synthesized.images(), workspace))
                    .then(PipelineStage.PUBLISH, files -> {
                        enter(PipelineStage.PUBLISH, span);
                        String noteId = notePublishService.publish(post.accountId, synthesized.content(), files);
                        return new Published(synthesized.content(), synthesized.images(), noteId);
                    });
        }
    }

    private static void enter(PipelineStage stage, Span span) {
        LoggingConfig.setStage(stage.getCode());
        span.addEvent("stage." + stage.getCode());
        LOG.debugf("Entering stage %s", stage.getCode());
    }

    /**
     * Maps a stage failure to its error kind.
     */
    static String classify(Throwable cause) {
        if (cause instanceof VerificationChallengeException) {
            return "verification-challenge";
        }
        if (cause instanceof PlatformRejectedException) {
            return "platform-rejected";
        }
        if (cause instanceof SigningException) {
            return "signing-failed";
        }
        if (cause instanceof IncompleteAssetSetException) {
            return "incomplete-assets";
        }
        if (cause instanceof GenerationException) {
            return "generation-failed";
        }
        if (cause instanceof UncheckedIOException || cause instanceof IOException) {
            return "io-error";
        }
        return "unexpected";
    }

    static String truncate(String error) {
        return error.length() > ERROR_LIMIT ? error.substring(0, ERROR_LIMIT) : error;
    }

    record Drafted(ReferenceAssetType references, NoteContentType content) {
    }

    record Prompted(ReferenceAssetType references, NoteContentType content, List<String> prompts) {
    }

    record Synthesized(NoteContentType content, List<GeneratedImageType> images) {
    }

    record Published(NoteContentType content, List<GeneratedImageType> images, String noteId) {
    }
}
