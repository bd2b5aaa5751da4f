package in.warmguard.domain.session;

/**
 * Thrown when an account's session state cannot be read or written.
 */
public class SessionPersistenceException extends RuntimeException {

    private final long accountId;

    public SessionPersistenceException(long accountId, String message) {
        super(String.format("[account:%d] %s", accountId, message));
        this.accountId = accountId;
    }

    public SessionPersistenceException(long accountId, String message, Throwable cause) {
        super(String.format("[account:%d] %s", accountId, message), cause);
        this.accountId = accountId;
    }

    public long getAccountId() {
        return accountId;
    }
}
