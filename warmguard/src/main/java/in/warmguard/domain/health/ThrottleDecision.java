package in.warmguard.domain.health;

/**
 * Result of evaluating an account's score against the throttle thresholds.
 */
public record ThrottleDecision(ThrottleAction action, int healthScore, String message) {

    public static ThrottleDecision none(int healthScore, String message) {
        return new ThrottleDecision(ThrottleAction.NONE, healthScore, message);
    }
}
