package in.warmguard.domain.health;

/**
 * Result of explicitly returning a cooled or suspended account to its warming track.
 */
public record RecoveryResult(boolean success, AccountPhase phase, String message) {

    public static RecoveryResult failed(AccountPhase phase, String message) {
        return new RecoveryResult(false, phase, message);
    }
}
