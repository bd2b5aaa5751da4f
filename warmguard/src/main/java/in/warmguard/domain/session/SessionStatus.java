package in.warmguard.domain.session;

/**
 * Result of a session liveness check.
 */
public enum SessionStatus {
    /** Logged in and usable. */
    ACTIVE,
    /** A session exists but the site no longer treats it as logged in, or the check failed. */
    EXPIRED,
    /** No live or persisted session; the account must log in again. */
    NEEDS_LOGIN;

    public boolean isHealthy() {
        return this == ACTIVE;
    }
}
