package in.warmguard.domain.engagement;

import java.time.Instant;

/**
 * Task as submitted by a producer, before validation and id assignment.
 *
 * @param expiresAt optional deadline after which the task is no longer handed out
 */
public record TaskRequest(
    long projectId,
    long accountId,
    TaskType taskType,
    String targetUser,
    String targetPost,
    String commentText,
    Instant expiresAt
) {
    public static TaskRequest like(long projectId, long accountId, String targetPost) {
        return new TaskRequest(projectId, accountId, TaskType.LIKE, null, targetPost, null, null);
    }

    public static TaskRequest follow(long projectId, long accountId, String targetUser) {
        return new TaskRequest(projectId, accountId, TaskType.FOLLOW, targetUser, null, null, null);
    }

    public static TaskRequest unfollow(long projectId, long accountId, String targetUser) {
        return new TaskRequest(projectId, accountId, TaskType.UNFOLLOW, targetUser, null, null, null);
    }

    public static TaskRequest comment(long projectId, long accountId, String targetPost, String commentText) {
        return new TaskRequest(projectId, accountId, TaskType.COMMENT, null, targetPost, commentText, null);
    }

    public TaskRequest expiringAt(Instant deadline) {
        return new TaskRequest(projectId, accountId, taskType, targetUser, targetPost, commentText, deadline);
    }

    public EngagementTask toTask(Instant now) {
        return EngagementTask.create(projectId, accountId, taskType, targetUser, targetPost, commentText, expiresAt, now);
    }
}
