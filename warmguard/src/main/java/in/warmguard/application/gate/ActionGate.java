package in.warmguard.application.gate;

import in.warmguard.application.health.AccountLocks;
import in.warmguard.application.port.output.AccountHealthRepository;
import in.warmguard.application.port.output.HealthSignalRepository;
import in.warmguard.config.HourlyLimitTable;
import in.warmguard.domain.gate.ActionPermission;
import in.warmguard.domain.gate.DenialReason;
import in.warmguard.domain.health.AccountHealth;
import in.warmguard.domain.health.AccountPhase;
import in.warmguard.domain.health.ActionType;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import in.warmguard.util.TimeBoundaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Authority consulted before every automated action.
 *
 * Checks run in a fixed order: record exists, not suspended, not under a timed
 * throttle, daily caps, hourly cap for the phase and action type. The first failing
 * check decides the denial reason.
 *
 * Executors either call {@link #canPerformAction} and later {@link #recordAction},
 * or use {@link #tryReserve} followed by {@link #recordOutcome}, which checks and
 * counts atomically under the account lock.
 */
public final class ActionGate {
    private static final Logger log = LoggerFactory.getLogger(ActionGate.class);

    private final AccountHealthRepository healthRepo;
    private final HealthSignalRepository signalRepo;
    private final AccountLocks locks;
    private final HourlyLimitTable hourlyLimits;
    private final SafetyMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;

    public ActionGate(
            AccountHealthRepository healthRepo,
            HealthSignalRepository signalRepo,
            AccountLocks locks,
            HourlyLimitTable hourlyLimits,
            SafetyMetrics metrics,
            Clock clock,
            ZoneId zone) {
        this.healthRepo = healthRepo;
        this.signalRepo = signalRepo;
        this.locks = locks;
        this.hourlyLimits = hourlyLimits;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = zone;
    }

    /**
     * Decide whether {@code actionType} may run now. Never mutates state.
     */
    public ActionPermission canPerformAction(long accountId, ActionType actionType) {
        ActionPermission permission = evaluate(healthRepo.findByAccountId(accountId), actionType, clock.instant());
        metrics.recordGateDecision(actionType, permission.reason());
        return permission;
    }

    /**
     * Check and, when allowed, count the action in one step under the account lock.
     * The caller reports how the action went through {@link #recordOutcome}.
     */
    public ActionPermission tryReserve(long accountId, ActionType actionType) {
        ActionPermission permission = locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            Instant now = clock.instant();
            ActionPermission verdict = evaluate(found, actionType, now);
            if (verdict.allowed()) {
                healthRepo.update(found.get().withActionCounted(actionType, now));
            }
            return verdict;
        });
        metrics.recordGateDecision(actionType, permission.reason());
        if (!permission.allowed()) {
            log.debug("[GATE] Reservation denied for account {} ({}): {}",
                accountId, actionType.wireName(), permission.message());
        }
        return permission;
    }

    /**
     * Report the outcome of an action reserved through {@link #tryReserve}: streaks and health signals only.
     */
    public void recordOutcome(long accountId, ActionType actionType, boolean success) {
        locks.run(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                log.warn("[GATE] Cannot record outcome: no health record for account {}", accountId);
                return;
            }
            Instant now = clock.instant();
            healthRepo.update(found.get().withOutcome(success, now));
            recordSignal(accountId, actionType, success, now);
        });
    }

    /**
     * Count a finished action: daily and hourly counters, last-action timestamps and streaks.
     * A missing record is logged and ignored.
     */
    public void recordAction(long accountId, ActionType actionType, boolean success) {
        locks.run(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                log.warn("[GATE] Cannot record action: no health record for account {}", accountId);
                return;
            }
            Instant now = clock.instant();
            AccountHealth updated = found.get()
                .withActionCounted(actionType, now)
                .withOutcome(success, now);
            healthRepo.update(updated);
            recordSignal(accountId, actionType, success, now);

            log.debug("[GATE] Recorded {} ({}) for account {} [posts: {}/{}, actions: {}/{}]",
                actionType.wireName(), success ? "success" : "failure", accountId,
                updated.postsToday(), updated.maxDailyPosts(), updated.actionsToday(), updated.maxDailyActions());
        });
    }

    private void recordSignal(long accountId, ActionType actionType, boolean success, Instant now) {
        if (actionType == ActionType.POST) {
            signalRepo.recordPostOutcome(accountId, success, now);
        } else if (success) {
            signalRepo.recordInteraction(accountId, actionType, now);
        }
    }

    /**
     * Zero all four counters for every account. Run at local midnight.
     *
     * @return number of records reset
     */
    public int resetDailyCounters() {
        int count = resetAll(h -> h.withDailyCountersReset(clock.instant()));
        log.info("[GATE] Reset daily counters for {} accounts", count);
        return count;
    }

    /**
     * Zero the hourly counters for every account. Run at each local hour boundary.
     *
     * @return number of records reset
     */
    public int resetHourlyCounters() {
        int count = resetAll(h -> h.withHourlyCountersReset(clock.instant()));
        log.debug("[GATE] Reset hourly counters for {} accounts", count);
        return count;
    }

    private int resetAll(UnaryOperator<AccountHealth> reset) {
        List<Long> accountIds = healthRepo.findAllAccountIds();
        int count = 0;
        for (Long accountId : accountIds) {
            boolean updated = locks.withLock(accountId, () -> {
                Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
                found.ifPresent(h -> healthRepo.update(reset.apply(h)));
                return found.isPresent();
            });
            if (updated) {
                count++;
            }
        }
        return count;
    }

    private ActionPermission evaluate(Optional<AccountHealth> found, ActionType actionType, Instant now) {
        if (found.isEmpty()) {
            return ActionPermission.denied(DenialReason.NO_RECORD, "No health record found for this account");
        }
        AccountHealth health = found.get();
        AccountPhase phase = health.accountPhase();

        if (health.isSuspended()) {
            return ActionPermission.denied(DenialReason.SUSPENDED, "Account is suspended");
        }
        if (phase == AccountPhase.SUSPENDED) {
            return ActionPermission.denied(DenialReason.SUSPENDED, "Account is in suspended phase");
        }

        if (health.isThrottleActive(now)) {
            return ActionPermission.denied(DenialReason.THROTTLED,
                "Account is throttled until " + health.throttleUntil(),
                Duration.between(now, health.throttleUntil()).toMillis());
        }

        if (actionType == ActionType.POST && health.postsToday() >= health.maxDailyPosts()) {
            return ActionPermission.denied(DenialReason.DAILY_POST_LIMIT,
                String.format("Daily post limit reached (%d/%d)", health.postsToday(), health.maxDailyPosts()),
                TimeBoundaries.millisUntilNextMidnight(now, zone));
        }
        if (health.actionsToday() >= health.maxDailyActions()) {
            return ActionPermission.denied(DenialReason.DAILY_ACTION_LIMIT,
                String.format("Daily action limit reached (%d/%d)", health.actionsToday(), health.maxDailyActions()),
                TimeBoundaries.millisUntilNextMidnight(now, zone));
        }

        int hourlyLimit = hourlyLimits.limit(phase, actionType);
        int usedThisHour = actionType == ActionType.POST ? health.postsThisHour() : health.actionsThisHour();
        if (usedThisHour >= hourlyLimit) {
            return ActionPermission.denied(DenialReason.HOURLY_LIMIT,
                String.format("Hourly %s limit reached (%d/%d)", actionType.wireName(), usedThisHour, hourlyLimit),
                TimeBoundaries.millisUntilNextHour(now, zone));
        }

        return ActionPermission.allow();
    }
}
