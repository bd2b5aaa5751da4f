package in.warmguard.config;

import in.warmguard.util.Env;

/**
 * Score boundaries the throttle engine acts on.
 *
 * Below {@code escalateBelow}: suspend and escalate. Below {@code suspendBelow}: suspend.
 * Below {@code throttleBelow}: throttle. At or above {@code unthrottleAt}: restrictions may lift.
 */
public record HealthThresholds(int escalateBelow, int suspendBelow, int throttleBelow, int unthrottleAt) {

    public HealthThresholds {
        if (!(0 <= escalateBelow && escalateBelow <= suspendBelow
                && suspendBelow <= throttleBelow && throttleBelow <= unthrottleAt && unthrottleAt <= 100)) {
            throw new IllegalArgumentException(String.format(
                "Thresholds must be ordered 0 <= escalate(%d) <= suspend(%d) <= throttle(%d) <= unthrottle(%d) <= 100",
                escalateBelow, suspendBelow, throttleBelow, unthrottleAt));
        }
    }

    public static HealthThresholds defaults() {
        return new HealthThresholds(20, 40, 60, 70);
    }

    public static HealthThresholds fromEnv() {
        HealthThresholds d = defaults();
        return new HealthThresholds(
            Env.getInt("HEALTH_ESCALATE_BELOW", d.escalateBelow()),
            Env.getInt("HEALTH_SUSPEND_BELOW", d.suspendBelow()),
            Env.getInt("HEALTH_THROTTLE_BELOW", d.throttleBelow()),
            Env.getInt("HEALTH_UNTHROTTLE_AT", d.unthrottleAt())
        );
    }
}
