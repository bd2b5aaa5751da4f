package in.warmguard.application.port.output;

import in.warmguard.domain.health.Escalation;

import java.util.List;

/**
 * Repository for health_escalations table.
 */
public interface EscalationRepository {

    Escalation insert(Escalation escalation);

    /**
     * Escalations for an account, newest first.
     */
    List<Escalation> findByAccountId(long accountId);
}
