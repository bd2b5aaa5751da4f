package in.warmguard.config;

import in.warmguard.domain.health.AccountPhase;
import in.warmguard.domain.health.ActionType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maximum actions per hour for every phase and action type.
 *
 * Construction rejects a table with any missing or negative entry, so lookups never fall through.
 */
public final class HourlyLimitTable {

    private final Map<AccountPhase, Map<ActionType, Integer>> limits;

    public HourlyLimitTable(Map<AccountPhase, Map<ActionType, Integer>> limits) {
        EnumMap<AccountPhase, Map<ActionType, Integer>> copy = new EnumMap<>(AccountPhase.class);
        for (AccountPhase phase : AccountPhase.values()) {
            Map<ActionType, Integer> row = limits.get(phase);
            if (row == null) {
                throw new IllegalArgumentException("Hourly limits missing phase " + phase);
            }
            EnumMap<ActionType, Integer> rowCopy = new EnumMap<>(ActionType.class);
            for (ActionType type : ActionType.values()) {
                Integer limit = row.get(type);
                if (limit == null) {
                    throw new IllegalArgumentException("Hourly limits missing " + phase + "/" + type);
                }
                if (limit < 0) {
                    throw new IllegalArgumentException("Hourly limit " + phase + "/" + type + " is negative: " + limit);
                }
                rowCopy.put(type, limit);
            }
            copy.put(phase, Collections.unmodifiableMap(rowCopy));
        }
        this.limits = Collections.unmodifiableMap(copy);
    }

    public int limit(AccountPhase phase, ActionType type) {
        return limits.get(phase).get(type);
    }

    /**
     * Copy of this table with the given entries replaced.
     */
    public HourlyLimitTable withOverrides(Map<AccountPhase, Map<ActionType, Integer>> overrides) {
        EnumMap<AccountPhase, Map<ActionType, Integer>> merged = new EnumMap<>(AccountPhase.class);
        for (AccountPhase phase : AccountPhase.values()) {
            EnumMap<ActionType, Integer> row = new EnumMap<>(limits.get(phase));
            Map<ActionType, Integer> override = overrides.get(phase);
            if (override != null) {
                row.putAll(override);
            }
            merged.put(phase, row);
        }
        return new HourlyLimitTable(merged);
    }

    public static HourlyLimitTable defaults() {
        EnumMap<AccountPhase, Map<ActionType, Integer>> table = new EnumMap<>(AccountPhase.class);
        table.put(AccountPhase.WARMING, row(1, 3, 2, 2, 1, 2));
        table.put(AccountPhase.GROWING, row(2, 10, 5, 5, 3, 5));
        table.put(AccountPhase.MATURE, row(5, 20, 10, 10, 5, 10));
        table.put(AccountPhase.COOLING, row(1, 2, 1, 1, 1, 1));
        table.put(AccountPhase.SUSPENDED, row(0, 0, 0, 0, 0, 0));
        return new HourlyLimitTable(table);
    }

    private static Map<ActionType, Integer> row(int post, int like, int comment, int follow, int retweet, int unfollow) {
        EnumMap<ActionType, Integer> row = new EnumMap<>(ActionType.class);
        row.put(ActionType.POST, post);
        row.put(ActionType.LIKE, like);
        row.put(ActionType.COMMENT, comment);
        row.put(ActionType.FOLLOW, follow);
        row.put(ActionType.RETWEET, retweet);
        row.put(ActionType.UNFOLLOW, unfollow);
        return row;
    }
}
