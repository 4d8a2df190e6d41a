package villagecompute.autopost.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the logged-in session, used to fill in an account's platform user id and nickname.
 */
public record AccountProfileType(@JsonProperty("user_id") String userId, String nickname,
        @JsonProperty("red_id") String redId) {
}
