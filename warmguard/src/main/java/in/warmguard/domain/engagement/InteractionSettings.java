package in.warmguard.domain.engagement;

import java.time.Duration;

/**
 * Per-project engagement switches and minimum re-trigger intervals.
 *
 * Intervals are in minutes; a null interval means the project never configured it.
 * Unfollow has no switch of its own and runs whenever engagement is enabled.
 */
public record InteractionSettings(
    long projectId,
    boolean enabled,
    boolean likeEnabled,
    boolean commentEnabled,
    boolean followEnabled,
    Integer likeIntervalMinutes,
    Integer commentIntervalMinutes,
    Integer followIntervalMinutes,
    Integer unfollowIntervalMinutes
) {
    public static final int DEFAULT_INTERVAL_MINUTES = 5;

    public boolean isTypeEnabled(TaskType type) {
        return switch (type) {
            case LIKE -> likeEnabled;
            case COMMENT -> commentEnabled;
            case FOLLOW -> followEnabled;
            case UNFOLLOW -> true;
        };
    }

    public Duration minInterval(TaskType type) {
        Integer minutes = switch (type) {
            case LIKE -> likeIntervalMinutes;
            case COMMENT -> commentIntervalMinutes;
            case FOLLOW -> followIntervalMinutes;
            case UNFOLLOW -> unfollowIntervalMinutes;
        };
        return Duration.ofMinutes(minutes == null ? DEFAULT_INTERVAL_MINUTES : minutes);
    }
}
