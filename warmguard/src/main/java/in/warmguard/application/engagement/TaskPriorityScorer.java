package in.warmguard.application.engagement;

import in.warmguard.domain.engagement.EngagementTask;

import java.time.Duration;
import java.time.Instant;

/**
 * Priority of an eligible task, 0-100. Higher runs sooner.
 *
 * Base 50; fresh tasks gain up to 20; follows outrank likes, likes outrank comments.
 */
public final class TaskPriorityScorer {

    static final int BASE = 50;
    static final int MAX = 100;

    public static int score(EngagementTask task, Instant now) {
        int priority = BASE;

        Duration age = Duration.between(task.createdAt(), now);
        if (age.compareTo(Duration.ofHours(24)) < 0) {
            priority += 20;
        } else if (age.compareTo(Duration.ofHours(72)) < 0) {
            priority += 10;
        }

        priority += switch (task.taskType()) {
            case FOLLOW -> 15;
            case LIKE -> 10;
            case COMMENT -> 5;
            case UNFOLLOW -> 0;
        };

        return Math.min(MAX, priority);
    }

    private TaskPriorityScorer() {}
}
