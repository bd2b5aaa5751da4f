package in.warmguard.domain.gate;

/**
 * Gate verdict for one prospective action.
 *
 * {@code retryAfterMs} is an advisory hint and is null when waiting will not help
 * (missing record, suspension) or when the action is allowed.
 */
public record ActionPermission(
    boolean allowed,
    DenialReason reason,
    String message,
    Long retryAfterMs
) {
    public static ActionPermission allow() {
        return new ActionPermission(true, null, null, null);
    }

    public static ActionPermission denied(DenialReason reason, String message) {
        return new ActionPermission(false, reason, message, null);
    }

    public static ActionPermission denied(DenialReason reason, String message, long retryAfterMs) {
        return new ActionPermission(false, reason, message, retryAfterMs);
    }
}
