package in.warmguard.domain.health;

/**
 * Result of an attempt to lift throttling or score-based suspension.
 */
public record UnthrottleResult(boolean success, int healthScore, String message) {

    public static UnthrottleResult failed(int healthScore, String message) {
        return new UnthrottleResult(false, healthScore, message);
    }
}
