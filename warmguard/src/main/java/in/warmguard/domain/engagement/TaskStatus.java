package in.warmguard.domain.engagement;

import java.util.Locale;

/**
 * Queue state of an engagement task.
 *
 * PENDING → CLAIMED → COMPLETED, with EXPIRED reachable from PENDING or CLAIMED.
 * COMPLETED and EXPIRED are terminal.
 */
public enum TaskStatus {
    PENDING,
    CLAIMED,
    COMPLETED,
    EXPIRED;

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == CLAIMED || next == COMPLETED || next == EXPIRED;
            case CLAIMED -> next == COMPLETED || next == EXPIRED;
            case COMPLETED, EXPIRED -> false;
        };
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromDbValue(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
