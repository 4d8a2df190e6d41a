package villagecompute.autopost.exceptions;

/**
 * The platform answered with a human-verification challenge (HTTP 461 or 471).
 *
 * <p>
 * Always fatal for the current operation. The session stays blocked until someone completes the challenge in a real
 * browser, so this is never retried.
 */
public class VerificationChallengeException extends RuntimeException {

    private final int statusCode;
    private final String challengeType;
    private final String challengeId;

    public VerificationChallengeException(int statusCode, String challengeType, String challengeId) {
        super(String.format("verification challenge (status=%d, type=%s, id=%s)", statusCode, challengeType,
                challengeId));
        this.statusCode = statusCode;
        this.challengeType = challengeType;
        this.challengeId = challengeId;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getChallengeType() {
        return challengeType;
    }

    public String getChallengeId() {
        return challengeId;
    }
}
