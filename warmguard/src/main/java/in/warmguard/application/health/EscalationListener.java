package in.warmguard.application.health;

import in.warmguard.domain.health.Escalation;

/**
 * Receives escalations after they are recorded. Implementations must not throw back into the health engine.
 */
@FunctionalInterface
public interface EscalationListener {

    void onEscalation(Escalation escalation);
}
