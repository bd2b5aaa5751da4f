package in.warmguard.domain.health;

/**
 * Outcome of a warming phase advancement attempt.
 */
public record PhaseAdvance(boolean advanced, AccountPhase currentPhase, String message) {

    public static PhaseAdvance unchanged(AccountPhase phase, String message) {
        return new PhaseAdvance(false, phase, message);
    }

    public static PhaseAdvance advancedTo(AccountPhase phase, String message) {
        return new PhaseAdvance(true, phase, message);
    }
}
