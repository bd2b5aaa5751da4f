package in.warmguard.domain.engagement;

import java.time.Instant;

/**
 * Append-only record of an executed engagement attempt.
 */
public record EngagementLogEntry(
    Long id,
    long accountId,
    Long taskId,
    TaskType taskType,
    Outcome status,
    String targetUser,
    String targetPost,
    String errorMessage,
    Instant createdAt
) {
    public enum Outcome {
        SUCCESS,
        FAILED
    }

    public static EngagementLogEntry forTask(EngagementTask task, boolean success, String errorMessage, Instant now) {
        return new EngagementLogEntry(
            null,
            task.accountId(),
            task.id(),
            task.taskType(),
            success ? Outcome.SUCCESS : Outcome.FAILED,
            task.targetUser(),
            task.targetPost(),
            success ? null : errorMessage,
            now
        );
    }
}
