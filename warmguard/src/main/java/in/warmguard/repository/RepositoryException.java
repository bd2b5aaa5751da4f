package in.warmguard.repository;

/**
 * Thrown when a database write fails, or a read whose result feeds a safety decision
 * (health signals, daily attempt counts). Other reads log and return empty results.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
