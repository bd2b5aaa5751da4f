package in.warmguard.domain.engagement;

/**
 * Eligible task paired with its priority score.
 */
public record QueuedTask(EngagementTask task, int priorityScore) {
}
