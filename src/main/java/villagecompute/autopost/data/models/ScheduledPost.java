package villagecompute.autopost.data.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import villagecompute.autopost.api.types.GeneratedImageType;

/**
 * Panache entity for one scheduled note: what to generate, which account publishes it, when, and how it ended.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK)</li>
 * <li>{@code goal_id} (BIGINT) - Planning goal that produced this post, nullable</li>
 * <li>{@code account_id} (TEXT) - Publishing account</li>
 * <li>{@code topic}, {@code style} (TEXT) - Copy parameters</li>
 * <li>{@code aspect_ratio} (TEXT) - Ratio label, default {@code 3:4}</li>
 * <li>{@code image_count} (INT) - 1 to 4</li>
 * <li>{@code reference_group_ids} (JSONB) - Reference image groups</li>
 * <li>{@code scheduled_at} (TIMESTAMPTZ) - Fire time</li>
 * <li>{@code status} (TEXT) - PENDING, RUNNING, DONE, FAILED</li>
 * <li>{@code result_title}, {@code result_body}, {@code result_hashtags}, {@code result_images}, {@code note_id} -
 * Result payload, set on DONE</li>
 * <li>{@code error}, {@code failed_stage}, {@code error_kind} - Set only on FAILED</li>
 * <li>{@code created_at}, {@code updated_at} (TIMESTAMPTZ)</li>
 * </ul>
 *
 * <p>
 * Status changes go through {@link villagecompute.autopost.services.ScheduledPostStore#transition}, never through
 * direct field writes, so that the compare-and-set on {@code status} is the only way out of PENDING.
 *
 * @see villagecompute.autopost.jobs.PostScheduler
 * @see villagecompute.autopost.jobs.PublishPipelineExecutor
 */
@Entity
@Table(
        name = "scheduled_posts")
public class ScheduledPost extends PanacheEntityBase {

    /** Most images a single note can carry. */
    public static final int MAX_IMAGES = 4;

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "goal_id")
    public Long goalId;

    @Column(
            name = "account_id",
            nullable = false)
    public String accountId;

    @Column(
            nullable = false)
    public String topic;

    @Column
    public String style;

    @Column(
            name = "aspect_ratio",
            nullable = false)
    public AspectRatio aspectRatio = AspectRatio.DEFAULT;

    @Column(
            name = "image_count",
            nullable = false)
    public int imageCount;

    @Column(
            name = "reference_group_ids",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<Long> referenceGroupIds = new ArrayList<>();

    @Column(
            name = "scheduled_at",
            nullable = false)
    public Instant scheduledAt;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PostStatus status;

    @Column(
            name = "result_title")
    public String resultTitle;

    @Column(
            name = "result_body")
    public String resultBody;

    @Column(
            name = "result_hashtags",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> resultHashtags;

    @Column(
            name = "result_images",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<GeneratedImageType> resultImages;

    @Column(
            name = "note_id")
    public String noteId;

    @Column
    public String error;

    @Column(
            name = "failed_stage")
    public String failedStage;

    @Column(
            name = "error_kind")
    public String errorKind;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Post lifecycle. Transitions only move forward: PENDING to RUNNING, RUNNING to DONE or FAILED.
     */
    public enum PostStatus {
        /**
         * Waiting for its timer or a run-now trigger.
         */
        PENDING,

        /**
         * Claimed by the pipeline; exactly one executor holds it.
         */
        RUNNING,

        /**
         * Published; note id recorded.
         */
        DONE,

        /**
         * Aborted; error text names the failing stage.
         */
        FAILED;

        public boolean canTransitionTo(PostStatus next) {
            return switch (this) {
                case PENDING -> next == RUNNING;
                case RUNNING -> next == DONE || next == FAILED;
                case DONE, FAILED -> false;
            };
        }

        public boolean isTerminal() {
            return this == DONE || this == FAILED;
        }
    }

    /**
     * Compare-and-set on status. Returns the number of rows changed (0 or 1).
     */
    public static int compareAndSetStatus(long id, PostStatus expected, PostStatus next, Instant updatedAt) {
        return update("status = ?1, updatedAt = ?2 WHERE id = ?3 AND status = ?4", next, updatedAt, id, expected);
    }
}
