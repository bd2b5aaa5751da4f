package in.warmguard.application.health;

import in.warmguard.application.port.output.AccountHealthRepository;
import in.warmguard.application.port.output.EscalationRepository;
import in.warmguard.application.port.output.HealthSignalRepository;
import in.warmguard.config.HealthThresholds;
import in.warmguard.config.HealthWeights;
import in.warmguard.domain.health.AccountHealth;
import in.warmguard.domain.health.AccountPhase;
import in.warmguard.domain.health.Escalation;
import in.warmguard.domain.health.FreezeDetection;
import in.warmguard.domain.health.HealthScoreBreakdown;
import in.warmguard.domain.health.PhaseAdvance;
import in.warmguard.domain.health.RecoveryResult;
import in.warmguard.domain.health.ThrottleAction;
import in.warmguard.domain.health.ThrottleDecision;
import in.warmguard.domain.health.UnthrottleResult;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Account health ledger, warming protocol and score-driven throttling.
 *
 * Owns the lifecycle of {@link AccountHealth}: creation, phase advancement,
 * score recomputation (the only writer of {@code healthScore}), throttling,
 * suspension, escalation and recovery. Every mutation runs under the account's
 * lock from {@link AccountLocks}.
 *
 * Missing records are reported through result values, never exceptions.
 */
public final class AccountHealthService {
    private static final Logger log = LoggerFactory.getLogger(AccountHealthService.class);

    static final Duration SCORE_WINDOW = Duration.ofDays(30);
    static final Duration NATURALNESS_WINDOW = Duration.ofDays(7);
    static final Duration GROWING_AFTER = Duration.ofDays(7);
    static final Duration MATURE_AFTER = Duration.ofDays(14);

    private final AccountHealthRepository healthRepo;
    private final HealthSignalRepository signalRepo;
    private final EscalationRepository escalationRepo;
    private final EscalationListener escalationListener;
    private final AccountLocks locks;
    private final HealthThresholds thresholds;
    private final HealthWeights weights;
    private final SafetyMetrics metrics;
    private final Clock clock;

    public AccountHealthService(
            AccountHealthRepository healthRepo,
            HealthSignalRepository signalRepo,
            EscalationRepository escalationRepo,
            EscalationListener escalationListener,
            AccountLocks locks,
            HealthThresholds thresholds,
            HealthWeights weights,
            SafetyMetrics metrics,
            Clock clock) {
        this.healthRepo = healthRepo;
        this.signalRepo = signalRepo;
        this.escalationRepo = escalationRepo;
        this.escalationListener = escalationListener;
        this.locks = locks;
        this.thresholds = thresholds;
        this.weights = weights;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========================================================================
    // Ledger
    // ========================================================================

    /**
     * Create the health record for a newly managed account.
     * Idempotent: returns the existing record id when one is already present.
     */
    public long initAccountHealth(long accountId) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> existing = healthRepo.findByAccountId(accountId);
            if (existing.isPresent()) {
                log.debug("[HEALTH] Record already exists for account {} (id={})", accountId, existing.get().id());
                return existing.get().id();
            }
            AccountHealth created = healthRepo.insert(AccountHealth.initial(accountId, clock.instant()));
            log.info("[HEALTH] Created health record for account {} (id={}, phase=WARMING)", accountId, created.id());
            return created.id();
        });
    }

    public Optional<AccountHealth> getAccountHealth(long accountId) {
        return healthRepo.findByAccountId(accountId);
    }

    /**
     * All health records, least healthy first.
     */
    public List<AccountHealth> getHealthOverview() {
        return healthRepo.findAllOrderByHealthScore();
    }

    /**
     * True when the account is not suspended and its last computed score is at or above the suspend threshold.
     */
    public boolean isAccountHealthy(long accountId) {
        return healthRepo.findByAccountId(accountId)
            .map(h -> !h.isSuspended() && h.healthScore() >= thresholds.suspendBelow())
            .orElse(false);
    }

    public void recordLoginAttempt(long accountId, boolean success) {
        signalRepo.recordLoginAttempt(accountId, success, clock.instant());
    }

    /**
     * Store a freeze detection and bump the account's freeze history.
     * The detection feeds the next score computation.
     */
    public FreezeDetection recordFreezeDetection(FreezeDetection detection) {
        return locks.withLock(detection.accountId(), () -> {
            FreezeDetection stored = signalRepo.recordFreezeDetection(detection);
            healthRepo.findByAccountId(detection.accountId()).ifPresent(h ->
                healthRepo.update(h.withFreeze(detection.detectedAt(), clock.instant())));
            log.warn("[HEALTH] Freeze detected for account {}: type={}, confidence={}",
                detection.accountId(), detection.freezeType(), detection.confidence());
            return stored;
        });
    }

    // ========================================================================
    // Warming protocol
    // ========================================================================

    /**
     * Advance along WARMING → GROWING → MATURE based on time since warming started.
     * Never demotes; suspended, cooling and mature accounts are left alone.
     */
    public PhaseAdvance advanceWarmingPhase(long accountId) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                return PhaseAdvance.unchanged(AccountPhase.WARMING, "No health record found");
            }
            AccountHealth health = found.get();
            AccountPhase phase = health.accountPhase();

            if (health.isSuspended()) {
                return PhaseAdvance.unchanged(phase, "Account is suspended");
            }
            if (health.warmingStartedAt() == null) {
                return PhaseAdvance.unchanged(phase, "No warming start date");
            }
            if (phase == AccountPhase.MATURE) {
                return PhaseAdvance.unchanged(phase, "Already at mature phase");
            }

            Instant now = clock.instant();
            Duration elapsed = Duration.between(health.warmingStartedAt(), now);

            if (elapsed.compareTo(MATURE_AFTER) >= 0
                    && (phase == AccountPhase.WARMING || phase == AccountPhase.GROWING)) {
                healthRepo.update(health.withPhase(AccountPhase.MATURE, now, now));
                log.info("[HEALTH] Account {} advanced {} -> MATURE ({} days)", accountId, phase, elapsed.toDays());
                return PhaseAdvance.advancedTo(AccountPhase.MATURE, String.format(
                    "Advanced to mature phase (%d posts/day, %d actions)",
                    AccountPhase.MATURE.baseDailyPosts(), AccountPhase.MATURE.baseDailyActions()));
            }

            if (elapsed.compareTo(GROWING_AFTER) >= 0 && phase == AccountPhase.WARMING) {
                healthRepo.update(health.withPhase(AccountPhase.GROWING, health.warmingCompletedAt(), now));
                log.info("[HEALTH] Account {} advanced WARMING -> GROWING ({} days)", accountId, elapsed.toDays());
                return PhaseAdvance.advancedTo(AccountPhase.GROWING, String.format(
                    "Advanced to growing phase (%d posts/day, %d actions)",
                    AccountPhase.GROWING.baseDailyPosts(), AccountPhase.GROWING.baseDailyActions()));
            }

            return PhaseAdvance.unchanged(phase,
                String.format("Still in %s phase (%d days)", phase.dbValue(), elapsed.toDays()));
        });
    }

    /**
     * Move an account sideways into COOLING for {@code duration}: cooling caps, throttled until the deadline.
     *
     * @return false when the account has no record or is suspended
     */
    public boolean beginCooling(long accountId, String reason, Duration duration) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                log.warn("[HEALTH] Cannot cool account {}: no health record", accountId);
                return false;
            }
            AccountHealth health = found.get();
            if (health.isSuspended()) {
                log.warn("[HEALTH] Cannot cool account {}: account is suspended", accountId);
                return false;
            }
            Instant now = clock.instant();
            Instant until = now.plus(duration);
            healthRepo.update(health.cooling(reason, until, now));
            log.info("[HEALTH] Account {} cooling until {} ({})", accountId, until, reason);
            return true;
        });
    }

    /**
     * Return a COOLING or SUSPENDED-phase account to the warming-track phase its age has earned.
     * Score-based suspensions are lifted by {@link #unthrottle} instead.
     */
    public RecoveryResult recoverPhase(long accountId) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                return RecoveryResult.failed(AccountPhase.WARMING, "No health record found");
            }
            AccountHealth health = found.get();
            AccountPhase phase = health.accountPhase();
            if (phase != AccountPhase.COOLING && phase != AccountPhase.SUSPENDED) {
                return RecoveryResult.failed(phase, "Account is not cooling or suspended");
            }
            if (health.isSuspended()) {
                return RecoveryResult.failed(phase, "Account is suspended by health score; unthrottle first");
            }

            Instant now = clock.instant();
            AccountPhase earned = earnedPhase(health, now);
            AccountHealth restored = health.restored(earned, now);
            if (earned == AccountPhase.MATURE && restored.warmingCompletedAt() == null) {
                restored = restored.toBuilder().warmingCompletedAt(now).build();
            }
            healthRepo.update(restored);
            log.info("[HEALTH] Account {} recovered {} -> {}", accountId, phase, earned);
            return new RecoveryResult(true, earned, String.format("Recovered to %s phase (%d posts/day, %d actions)",
                earned.dbValue(), earned.baseDailyPosts(), earned.baseDailyActions()));
        });
    }

    private static AccountPhase earnedPhase(AccountHealth health, Instant now) {
        if (health.warmingCompletedAt() != null) {
            return AccountPhase.MATURE;
        }
        if (health.warmingStartedAt() == null) {
            return AccountPhase.WARMING;
        }
        Duration elapsed = Duration.between(health.warmingStartedAt(), now);
        if (elapsed.compareTo(MATURE_AFTER) >= 0) {
            return AccountPhase.MATURE;
        }
        if (elapsed.compareTo(GROWING_AFTER) >= 0) {
            return AccountPhase.GROWING;
        }
        return AccountPhase.WARMING;
    }

    // ========================================================================
    // Scoring and throttling
    // ========================================================================

    /**
     * Recompute and persist all sub-scores and the composite score.
     * Without a record nothing is written and {@link HealthScoreBreakdown#unavailable()} is returned.
     */
    public HealthScoreBreakdown calculateHealthScore(long accountId) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                return HealthScoreBreakdown.unavailable();
            }

            Instant now = clock.instant();
            Instant scoreSince = now.minus(SCORE_WINDOW);
            HealthScoreBreakdown breakdown = HealthScoreCalculator.compose(
                weights,
                HealthScoreCalculator.loginSuccessRate(signalRepo.countLoginAttempts(accountId, scoreSince)),
                HealthScoreCalculator.postSuccessRate(signalRepo.countPostOutcomes(accountId, scoreSince)),
                HealthScoreCalculator.engagementNaturalness(
                    signalRepo.findInteractionTimes(accountId, now.minus(NATURALNESS_WINDOW))),
                HealthScoreCalculator.freezeRisk(signalRepo.findFreezeDetections(accountId, scoreSince), now)
            );

            healthRepo.update(found.get().withScores(breakdown, now));
            metrics.recordHealthScore(breakdown.healthScore());

            log.debug("[HEALTH] Score for account {}: {} (login={}, post={}, naturalness={}, freezeRisk={})",
                accountId, breakdown.healthScore(), breakdown.loginSuccessRate(), breakdown.postSuccessRate(),
                breakdown.engagementNaturalnessScore(), breakdown.freezeRiskScore());
            return breakdown;
        });
    }

    /**
     * Recompute the score and apply the matching restriction.
     *
     * Below the escalation threshold the account is suspended and an escalation recorded;
     * below the suspend threshold it is suspended; below the throttle threshold its caps
     * drop to half the phase baseline. Healthy scores change nothing here.
     */
    public ThrottleDecision checkAndThrottle(long accountId) {
        ThrottleDecision decision = locks.withLock(accountId, () -> evaluate(accountId));
        metrics.recordThrottleDecision(decision.action());
        return decision;
    }

    private ThrottleDecision evaluate(long accountId) {
        HealthScoreBreakdown breakdown = calculateHealthScore(accountId);
        Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
        if (found.isEmpty()) {
            return ThrottleDecision.none(0, "No health record found");
        }
        AccountHealth health = found.get();
        int score = breakdown.healthScore();
        Instant now = clock.instant();

        if (score < thresholds.escalateBelow()) {
            healthRepo.update(health.suspended(
                "Health score critically low: " + score,
                "Auto-suspended: health score " + score + " < " + thresholds.escalateBelow(),
                now));
            escalate(Escalation.of(accountId, breakdown, "Critical health score: " + score, now));
            log.error("[HEALTH] ESCALATION: account {} fully suspended (score={})", accountId, score);
            return new ThrottleDecision(ThrottleAction.ESCALATE, score,
                "Full suspend + escalation alert created (score: " + score + ")");
        }

        if (score < thresholds.suspendBelow()) {
            healthRepo.update(health.suspended(
                "Health score low: " + score,
                "Auto-suspended: health score " + score + " < " + thresholds.suspendBelow(),
                now));
            log.warn("[HEALTH] Account {} suspended (score={})", accountId, score);
            return new ThrottleDecision(ThrottleAction.SUSPEND, score,
                "Automation suspended (score: " + score + ")");
        }

        if (score < thresholds.throttleBelow()) {
            AccountPhase phase = health.accountPhase();
            int posts = Math.max(1, phase.baseDailyPosts() / 2);
            int actions = Math.max(5, phase.baseDailyActions() / 2);
            healthRepo.update(health.throttled(posts, actions,
                "Auto-throttled: health score " + score + " < " + thresholds.throttleBelow(), now));
            log.warn("[HEALTH] Account {} throttled 50% (score={}, posts={}, actions={})",
                accountId, score, posts, actions);
            return new ThrottleDecision(ThrottleAction.THROTTLE, score, String.format(
                "Throttled 50%% (score: %d, posts: %d/day, actions: %d/day)", score, posts, actions));
        }

        return ThrottleDecision.none(score, "Health score OK (" + score + ")");
    }

    private void escalate(Escalation escalation) {
        Escalation stored = escalationRepo.insert(escalation);
        try {
            escalationListener.onEscalation(stored);
        } catch (RuntimeException e) {
            log.error("[HEALTH] Escalation listener failed for account {}: {}",
                escalation.accountId(), e.getMessage(), e);
        }
    }

    /**
     * Lift throttling or score-based suspension once a fresh score reaches the unthrottle threshold.
     * Restores the current phase's base caps and clears every throttle field.
     */
    public UnthrottleResult unthrottle(long accountId) {
        return locks.withLock(accountId, () -> {
            Optional<AccountHealth> found = healthRepo.findByAccountId(accountId);
            if (found.isEmpty()) {
                return UnthrottleResult.failed(0, "No health record found");
            }
            AccountHealth health = found.get();
            if (!health.isThrottled() && !health.isSuspended()) {
                return UnthrottleResult.failed(health.healthScore(), "Account is not throttled or suspended");
            }

            int score = calculateHealthScore(accountId).healthScore();
            if (score < thresholds.unthrottleAt()) {
                return UnthrottleResult.failed(score, String.format(
                    "Health score %d is below %d threshold for unthrottling", score, thresholds.unthrottleAt()));
            }

            // Re-read: the score computation just rewrote the record.
            AccountHealth current = healthRepo.findByAccountId(accountId).orElse(health);
            AccountPhase phase = current.accountPhase();
            healthRepo.update(current.restored(phase, clock.instant()));
            log.info("[HEALTH] Account {} unthrottled (score={})", accountId, score);
            return new UnthrottleResult(true, score, String.format(
                "Unthrottled successfully (score: %d, posts: %d/day, actions: %d/day)",
                score, phase.baseDailyPosts(), phase.baseDailyActions()));
        });
    }
}
