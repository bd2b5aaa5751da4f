package in.warmguard.domain.session;

/**
 * Thrown when the pool cannot open an automation context for an account.
 */
public class SessionCreationException extends RuntimeException {

    private final long accountId;

    public SessionCreationException(long accountId, String message, Throwable cause) {
        super(String.format("[account:%d] %s", accountId, message), cause);
        this.accountId = accountId;
    }

    public long getAccountId() {
        return accountId;
    }
}
