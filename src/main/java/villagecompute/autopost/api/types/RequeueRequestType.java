package villagecompute.autopost.api.types;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Re-queue request. A missing time means now.
 *
 * @param runAt
 *            local wall-clock time in the operating timezone
 */
public record RequeueRequestType(@JsonProperty("run_at") LocalDateTime runAt) {
}
