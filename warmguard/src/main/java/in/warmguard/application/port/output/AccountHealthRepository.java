package in.warmguard.application.port.output;

import in.warmguard.domain.health.AccountHealth;

import java.util.List;
import java.util.Optional;

/**
 * Repository for account_health table.
 * One row per managed account; callers serialize writes per account.
 */
public interface AccountHealthRepository {

    Optional<AccountHealth> findByAccountId(long accountId);

    /**
     * All records, lowest health score first.
     */
    List<AccountHealth> findAllOrderByHealthScore();

    List<Long> findAllAccountIds();

    /**
     * Insert a new record and return it with its generated id.
     */
    AccountHealth insert(AccountHealth health);

    /**
     * Overwrite the record for {@code health.accountId()}.
     */
    void update(AccountHealth health);
}
