package in.warmguard.domain.engagement;

import java.time.Instant;

/**
 * One unit of queued engagement work (engagement_tasks table).
 *
 * Created by task producers through {@link #create}; the scheduler only reads,
 * claims, completes and expires tasks.
 */
public record EngagementTask(
    Long id,
    long projectId,
    long accountId,
    TaskType taskType,
    String targetUser,
    String targetPost,
    String commentText,
    Instant lastExecutedAt,
    TaskStatus status,
    Instant claimedAt,
    Instant expiresAt,
    Instant createdAt,
    Instant updatedAt
) {
    /**
     * New pending task. Rejects type/target combinations the executor cannot run.
     */
    public static EngagementTask create(
            long projectId,
            long accountId,
            TaskType taskType,
            String targetUser,
            String targetPost,
            String commentText,
            Instant expiresAt,
            Instant now) {
        if (taskType == null) {
            throw new IllegalArgumentException("taskType is required");
        }
        switch (taskType) {
            case LIKE -> require(targetPost, "like task needs targetPost");
            case COMMENT -> {
                require(targetPost, "comment task needs targetPost");
                require(commentText, "comment task needs commentText");
            }
            case FOLLOW, UNFOLLOW -> require(targetUser, taskType.dbValue() + " task needs targetUser");
        }
        if (taskType != TaskType.COMMENT && commentText != null) {
            throw new IllegalArgumentException("commentText is only valid for comment tasks");
        }
        return new EngagementTask(null, projectId, accountId, taskType, targetUser, targetPost,
            commentText, null, TaskStatus.PENDING, null, expiresAt, now, now);
    }

    private static void require(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public EngagementTask claimed(Instant now) {
        return transition(TaskStatus.CLAIMED, lastExecutedAt, now, now);
    }

    public EngagementTask completed(Instant now) {
        return transition(TaskStatus.COMPLETED, now, claimedAt, now);
    }

    public EngagementTask expired(Instant now) {
        return transition(TaskStatus.EXPIRED, lastExecutedAt, claimedAt, now);
    }

    public EngagementTask withId(long id) {
        return new EngagementTask(id, projectId, accountId, taskType, targetUser, targetPost, commentText,
            lastExecutedAt, status, claimedAt, expiresAt, createdAt, updatedAt);
    }

    private EngagementTask transition(TaskStatus next, Instant executedAt, Instant claimed, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        return new EngagementTask(id, projectId, accountId, taskType, targetUser, targetPost, commentText,
            executedAt, next, claimed, expiresAt, createdAt, now);
    }
}
