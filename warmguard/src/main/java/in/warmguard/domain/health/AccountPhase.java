package in.warmguard.domain.health;

import java.util.Locale;

/**
 * Lifecycle stage of a managed account.
 *
 * Each phase carries the baseline daily caps an unthrottled account receives.
 * Normal progression is WARMING → GROWING → MATURE; COOLING and SUSPENDED are
 * sideways moves left only through explicit recovery.
 */
public enum AccountPhase {
    WARMING(1, 10),
    GROWING(3, 30),
    MATURE(10, 100),
    COOLING(1, 5),
    SUSPENDED(0, 0);

    private final int baseDailyPosts;
    private final int baseDailyActions;

    AccountPhase(int baseDailyPosts, int baseDailyActions) {
        this.baseDailyPosts = baseDailyPosts;
        this.baseDailyActions = baseDailyActions;
    }

    public int baseDailyPosts() {
        return baseDailyPosts;
    }

    public int baseDailyActions() {
        return baseDailyActions;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AccountPhase fromDbValue(String value) {
        return AccountPhase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
