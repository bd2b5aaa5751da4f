package in.warmguard.config;

import in.warmguard.domain.health.ActionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-type daily engagement quotas the scheduler enforces against today's log.
 *
 * Types without an entry have no engagement quota (posting is capped by the gate instead).
 * The retweet quota is reserved: no {@code TaskType} maps to it yet, so the scheduler never consults it.
 */
public final class DailyTaskLimits {

    private final Map<ActionType, Integer> limits;

    public DailyTaskLimits(Map<ActionType, Integer> limits) {
        EnumMap<ActionType, Integer> copy = new EnumMap<>(ActionType.class);
        limits.forEach((type, limit) -> {
            if (limit == null || limit < 0) {
                throw new IllegalArgumentException("Daily limit for " + type + " must be >= 0, got " + limit);
            }
            copy.put(type, limit);
        });
        this.limits = Collections.unmodifiableMap(copy);
    }

    /**
     * Daily quota for {@code type}, 0 when the type has none configured.
     */
    public int limit(ActionType type) {
        return limits.getOrDefault(type, 0);
    }

    public DailyTaskLimits withOverrides(Map<ActionType, Integer> overrides) {
        EnumMap<ActionType, Integer> merged = new EnumMap<>(ActionType.class);
        merged.putAll(limits);
        merged.putAll(overrides);
        return new DailyTaskLimits(merged);
    }

    public static DailyTaskLimits defaults() {
        EnumMap<ActionType, Integer> limits = new EnumMap<>(ActionType.class);
        limits.put(ActionType.LIKE, 50);
        limits.put(ActionType.FOLLOW, 20);
        limits.put(ActionType.COMMENT, 10);
        limits.put(ActionType.UNFOLLOW, 30);
        limits.put(ActionType.RETWEET, 15);
        return new DailyTaskLimits(limits);
    }
}
