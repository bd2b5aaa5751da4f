package in.warmguard.infrastructure.metrics;

import in.warmguard.domain.gate.DenialReason;
import in.warmguard.domain.health.ActionType;
import in.warmguard.domain.health.ThrottleAction;

import java.time.Duration;

/**
 * Safety core metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Gate allow/deny decisions by action type and denial reason
 * - Throttle engine decisions and escalations
 * - Health score distribution and sweep duration
 * - Session pool occupancy, reuse, evictions and creation failures
 * - Tasks handed out by the scheduler
 */
public interface SafetyMetrics {

    /**
     * Record a gate verdict.
     *
     * @param actionType Action that was checked
     * @param denialReason null when the action was allowed
     */
    void recordGateDecision(ActionType actionType, DenialReason denialReason);

    void recordThrottleDecision(ThrottleAction action);

    void recordHealthScore(int healthScore);

    /**
     * Record a completed health sweep.
     *
     * @param duration Wall time of the sweep
     * @param accountsChecked Records evaluated
     * @param errors Records whose evaluation failed
     */
    void recordHealthCycle(Duration duration, int accountsChecked, int errors);

    /**
     * Record a session acquisition.
     *
     * @param reused true when a live session was returned
     */
    void recordSessionAcquired(boolean reused);

    /**
     * Record a session removed from the pool.
     *
     * @param cause EVICTED, IDLE, RELEASED or DELETED
     */
    void recordSessionReleased(String cause);

    void recordSessionCreationFailure();

    void setActiveSessions(int count);

    void recordTasksScheduled(int count);

    /**
     * Metrics sink that discards everything. Used when no registry is wired.
     */
    SafetyMetrics NOOP = new SafetyMetrics() {
        @Override public void recordGateDecision(ActionType actionType, DenialReason denialReason) {}
        @Override public void recordThrottleDecision(ThrottleAction action) {}
        @Override public void recordHealthScore(int healthScore) {}
        @Override public void recordHealthCycle(Duration duration, int accountsChecked, int errors) {}
        @Override public void recordSessionAcquired(boolean reused) {}
        @Override public void recordSessionReleased(String cause) {}
        @Override public void recordSessionCreationFailure() {}
        @Override public void setActiveSessions(int count) {}
        @Override public void recordTasksScheduled(int count) {}
    };
}
