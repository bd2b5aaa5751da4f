package in.warmguard.domain.engagement;

import in.warmguard.domain.health.ActionType;

import java.util.Locale;

/**
 * Kinds of queued engagement work. Each maps onto the gate's action type.
 */
public enum TaskType {
    LIKE(ActionType.LIKE),
    FOLLOW(ActionType.FOLLOW),
    COMMENT(ActionType.COMMENT),
    UNFOLLOW(ActionType.UNFOLLOW);

    private final ActionType actionType;

    TaskType(ActionType actionType) {
        this.actionType = actionType;
    }

    public ActionType actionType() {
        return actionType;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskType fromDbValue(String value) {
        return TaskType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
