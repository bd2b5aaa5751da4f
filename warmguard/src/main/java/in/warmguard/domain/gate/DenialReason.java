package in.warmguard.domain.gate;

/**
 * Why the gate refused an action. Checks run in declaration order.
 */
public enum DenialReason {
    NO_RECORD,
    SUSPENDED,
    THROTTLED,
    DAILY_POST_LIMIT,
    DAILY_ACTION_LIMIT,
    HOURLY_LIMIT
}
