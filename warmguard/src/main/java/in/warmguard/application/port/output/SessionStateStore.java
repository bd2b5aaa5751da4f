package in.warmguard.application.port.output;

import java.util.Optional;

/**
 * Durable storage for automation session state (cookies, local storage) per account.
 *
 * Implementations throw {@link in.warmguard.domain.session.SessionPersistenceException}
 * when the backing store fails.
 */
public interface SessionStateStore {

    Optional<String> load(long accountId);

    void save(long accountId, String storageState);

    boolean exists(long accountId);

    void delete(long accountId);
}
