package in.warmguard.application.port.output;

import in.warmguard.domain.engagement.EngagementTask;
import in.warmguard.domain.engagement.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for engagement_tasks table.
 */
public interface EngagementTaskRepository {

    EngagementTask insert(EngagementTask task);

    Optional<EngagementTask> findById(long taskId);

    /**
     * Pending tasks for a project/account that have not expired at {@code now}, newest first.
     */
    List<EngagementTask> findPending(long projectId, long accountId, Instant now, int limit);

    int countPending(long projectId, long accountId, Instant now);

    /**
     * Write {@code task} only if the stored row is still in {@code expected} status.
     *
     * @return true when the row was updated
     */
    boolean updateIfStatus(EngagementTask task, TaskStatus expected);

    /**
     * Tasks claimed before {@code cutoff} and never finished.
     */
    List<EngagementTask> findClaimedBefore(Instant cutoff);

    /**
     * Delete completed or expired tasks last updated before {@code cutoff}.
     *
     * @return number of rows deleted
     */
    int deleteFinishedBefore(Instant cutoff);
}
