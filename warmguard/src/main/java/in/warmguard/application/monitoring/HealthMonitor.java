package in.warmguard.application.monitoring;

import in.warmguard.application.health.AccountHealthService;
import in.warmguard.domain.health.AccountHealth;
import in.warmguard.domain.health.ThrottleAction;
import in.warmguard.domain.health.ThrottleDecision;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic health sweep over every account with a health record.
 *
 * Per account: advance the warming phase, re-score and throttle, and lift restrictions
 * from accounts that were restricted before the sweep and have recovered. One account
 * failing never stops the sweep. Overlapping sweeps are skipped.
 */
public final class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final AccountHealthService healthService;
    private final AlertService alertService;
    private final SafetyMetrics metrics;
    private final Clock clock;
    private final int unthrottleAt;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(
            AccountHealthService healthService,
            AlertService alertService,
            SafetyMetrics metrics,
            Clock clock,
            int unthrottleAt) {
        this.healthService = healthService;
        this.alertService = alertService;
        this.metrics = metrics;
        this.clock = clock;
        this.unthrottleAt = unthrottleAt;
    }

    public boolean isRunning() {
        return running.get();
    }

    public HealthCycleReport runHealthCheckCycle() {
        if (!running.compareAndSet(false, true)) {
            log.info("[HEALTH-MONITOR] Health check cycle already running, skipping");
            return HealthCycleReport.skippedCycle();
        }

        Instant started = clock.instant();
        int checked = 0;
        int advanced = 0;
        int throttled = 0;
        int suspended = 0;
        int escalated = 0;
        int unthrottled = 0;
        int errors = 0;

        try {
            List<AccountHealth> records = healthService.getHealthOverview();
            log.info("[HEALTH-MONITOR] Running health check for {} accounts", records.size());

            for (AccountHealth record : records) {
                long accountId = record.accountId();
                try {
                    checked++;
                    if (healthService.advanceWarmingPhase(accountId).advanced()) {
                        advanced++;
                    }

                    ThrottleDecision decision = healthService.checkAndThrottle(accountId);
                    switch (decision.action()) {
                        case THROTTLE -> throttled++;
                        case SUSPEND -> suspended++;
                        case ESCALATE -> escalated++;
                        case NONE -> { }
                    }

                    boolean wasRestricted = record.isThrottled() || record.isSuspended();
                    if (wasRestricted
                            && decision.action() == ThrottleAction.NONE
                            && decision.healthScore() >= unthrottleAt
                            && healthService.unthrottle(accountId).success()) {
                        unthrottled++;
                    }
                } catch (RuntimeException e) {
                    errors++;
                    log.error("[HEALTH-MONITOR] Error checking account {}: {}", accountId, e.getMessage(), e);
                }
            }
        } catch (RuntimeException e) {
            errors++;
            log.error("[HEALTH-MONITOR] Error in health check cycle: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }

        Duration duration = Duration.between(started, clock.instant());
        metrics.recordHealthCycle(duration, checked, errors);

        if (suspended + escalated > 0) {
            alertService.sendWarningAlert(AlertService.ACCOUNTS_SUSPENDED, String.format(
                "%d account(s) suspended this cycle (%d escalated)", suspended + escalated, escalated));
        }

        log.info("[HEALTH-MONITOR] Cycle completed: checked={}, advanced={}, throttled={}, suspended={}, "
                + "escalated={}, unthrottled={}, errors={}",
            checked, advanced, throttled, suspended, escalated, unthrottled, errors);
        return new HealthCycleReport(false, checked, advanced, throttled, suspended, escalated,
            unthrottled, errors, duration);
    }
}
