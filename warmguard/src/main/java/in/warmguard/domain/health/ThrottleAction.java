package in.warmguard.domain.health;

/**
 * Action taken by the throttle decision engine.
 */
public enum ThrottleAction {
    NONE,
    THROTTLE,
    SUSPEND,
    ESCALATE
}
