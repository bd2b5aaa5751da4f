package in.warmguard.application.port.output;

import in.warmguard.domain.engagement.EngagementLogEntry;
import in.warmguard.domain.engagement.TaskType;
import in.warmguard.domain.health.OutcomeCounts;

import java.time.Instant;
import java.util.Map;

/**
 * Repository for the append-only engagement_logs table.
 * Counting reads throw when the store is unreachable.
 */
public interface EngagementLogRepository {

    void append(EngagementLogEntry entry);

    /**
     * Attempts per task type since {@code since}, successful and failed alike.
     * Types with no attempts may be absent from the map.
     */
    Map<TaskType, Integer> countAttemptsByType(long accountId, Instant since);

    OutcomeCounts countOutcomes(long accountId, Instant since);
}
