package in.warmguard.domain.monitoring;

/**
 * Alert severity levels for account safety monitoring
 */
public enum AlertLevel {
    /**
     * CRITICAL - Human review required
     * Example: health collapsed below the escalation threshold
     */
    CRITICAL,

    /**
     * WARNING - Automatic protection kicked in
     * Example: account suspended or throttled by the score engine
     */
    WARNING,

    /**
     * INFO - General information
     */
    INFO
}
