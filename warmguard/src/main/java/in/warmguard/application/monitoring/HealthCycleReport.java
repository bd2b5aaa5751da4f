package in.warmguard.application.monitoring;

import java.time.Duration;

/**
 * Summary of one health sweep. {@code skipped} is set when another sweep was already running.
 */
public record HealthCycleReport(
    boolean skipped,
    int accountsChecked,
    int advanced,
    int throttled,
    int suspended,
    int escalated,
    int unthrottled,
    int errors,
    Duration duration
) {
    public static HealthCycleReport skippedCycle() {
        return new HealthCycleReport(true, 0, 0, 0, 0, 0, 0, 0, Duration.ZERO);
    }
}
