/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.autopost.api.types;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.autopost.data.models.ScheduledPost;

/**
 * API view of a scheduled post.
 *
 * @param error
 *            {@code "{stage}: {kind}: {message}"}, present only when FAILED
 */
public record ScheduledPostType(Long id, @JsonProperty("goal_id") Long goalId,
        @JsonProperty("account_id") String accountId, String topic, String style,
        @JsonProperty("aspect_ratio") String aspectRatio, @JsonProperty("image_count") int imageCount,
        @JsonProperty("reference_group_ids") List<Long> referenceGroupIds,
        @JsonProperty("scheduled_at") Instant scheduledAt, String status, @JsonProperty("result_title") String resultTitle,
        @JsonProperty("result_body") String resultBody, @JsonProperty("result_hashtags") List<String> resultHashtags,
        @JsonProperty("result_images") List<GeneratedImageType> resultImages, @JsonProperty("note_id") String noteId,
        String error, @JsonProperty("failed_stage") String failedStage, @JsonProperty("error_kind") String errorKind,
        @JsonProperty("created_at") Instant createdAt, @JsonProperty("updated_at") Instant updatedAt) {

    public static ScheduledPostType fromEntity(ScheduledPost post) {
        return new ScheduledPostType(post.id, post.goalId, post.accountId, post.topic, post.style,
                post.aspectRatio == null ? null : post.aspectRatio.getLabel(), post.imageCount, post.referenceGroupIds,
                post.scheduledAt, post.status == null ? null : post.status.name(), post.resultTitle, post.resultBody,
                post.resultHashtags, post.resultImages, post.noteId, post.error, post.failedStage, post.errorKind,
                post.createdAt, post.updatedAt);
    }
}
