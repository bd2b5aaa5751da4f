package in.warmguard.domain.health;

import java.util.Locale;

/**
 * Kinds of automated action the gate authorizes.
 */
public enum ActionType {
    POST,
    LIKE,
    COMMENT,
    FOLLOW,
    RETWEET,
    UNFOLLOW;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromWireName(String value) {
        return ActionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
