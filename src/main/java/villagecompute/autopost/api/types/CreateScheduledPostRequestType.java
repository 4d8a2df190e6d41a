package villagecompute.autopost.api.types;

import java.time.LocalDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request to schedule one post, sent by goal planning or the admin API.
 *
 * @param goalId
 *            owning goal, if any
 * @param accountId
 *            publishing account
 * @param topic
 *            subject of the note
 * @param style
 *            tone/style hint for the copy (e.g. "生活方式")
 * @param aspectRatio
 *            ratio label, defaults to 3:4
 * @param imageCount
 *            images per note, 1 to 4
 * @param scheduledAt
 *            local wall-clock time in the operating timezone, minute precision
 * @param referenceGroupIds
 *            reference image groups steering generation
 */
public record CreateScheduledPostRequestType(@JsonProperty("goal_id") Long goalId,
        @NotBlank @JsonProperty("account_id") String accountId, @NotBlank String topic, String style,
        @JsonProperty("aspect_ratio") String aspectRatio,
        @NotNull @Min(1) @Max(4) @JsonProperty("image_count") Integer imageCount,
        @NotNull @JsonProperty("scheduled_at") LocalDateTime scheduledAt,
        @JsonProperty("reference_group_ids") List<Long> referenceGroupIds) {
}
