package in.warmguard.application.port.output;

import in.warmguard.domain.health.ActionType;
import in.warmguard.domain.health.FreezeDetection;
import in.warmguard.domain.health.OutcomeCounts;

import java.time.Instant;
import java.util.List;

/**
 * Raw observations the health score is computed from.
 *
 * Reads are windowed by a lower bound; writes are append-only. A read that cannot reach
 * the store throws; it never reports zero signals.
 */
public interface HealthSignalRepository {

    /**
     * Login attempts since {@code since}. Every non-successful status counts as failed.
     */
    OutcomeCounts countLoginAttempts(long accountId, Instant since);

    /**
     * Published vs failed posts since {@code since}. Posts still in flight are not counted.
     */
    OutcomeCounts countPostOutcomes(long accountId, Instant since);

    /**
     * Execution timestamps of engagement interactions since {@code since}, in any order.
     */
    List<Instant> findInteractionTimes(long accountId, Instant since);

    List<FreezeDetection> findFreezeDetections(long accountId, Instant since);

    void recordLoginAttempt(long accountId, boolean success, Instant at);

    void recordPostOutcome(long accountId, boolean published, Instant at);

    void recordInteraction(long accountId, ActionType actionType, Instant at);

    FreezeDetection recordFreezeDetection(FreezeDetection detection);
}
