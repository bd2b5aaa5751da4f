package in.warmguard.domain.health;

import java.time.Instant;

/**
 * Health ledger entry for one managed account (account_health table).
 *
 * Immutable: the health and gate services derive updated copies through the
 * transition methods below and persist them through the repository. The
 * composite {@code healthScore} is only ever written by score recomputation.
 */
public record AccountHealth(
    Long id,
    long accountId,

    // Scores (0-100)
    int healthScore,
    int loginSuccessRate,
    int postSuccessRate,
    int engagementNaturalnessScore,
    int freezeRiskScore,

    // Warming protocol
    AccountPhase accountPhase,
    Instant warmingStartedAt,
    Instant warmingCompletedAt,
    int maxDailyPosts,
    int maxDailyActions,

    // Rate tracking
    int postsToday,
    int actionsToday,
    int postsThisHour,
    int actionsThisHour,
    Instant lastActionAt,
    Instant lastPostAt,

    // Throttling
    boolean isThrottled,
    String throttleReason,
    Instant throttleUntil,
    boolean isSuspended,
    String suspendedReason,

    // History
    int totalFreezeCount,
    Instant lastFreezeAt,
    int consecutiveSuccesses,
    int consecutiveFailures,

    Instant createdAt,
    Instant updatedAt
) {
    public AccountHealth {
        if (healthScore < 0 || healthScore > 100) {
            throw new IllegalArgumentException("healthScore out of range: " + healthScore);
        }
        if (accountPhase == null) {
            throw new IllegalArgumentException("accountPhase is required");
        }
    }

    /**
     * Fresh record for a newly managed account: full score, warming phase, warming caps.
     */
    public static AccountHealth initial(long accountId, Instant now) {
        return new Builder()
            .accountId(accountId)
            .healthScore(100)
            .loginSuccessRate(100)
            .postSuccessRate(100)
            .engagementNaturalnessScore(100)
            .freezeRiskScore(0)
            .accountPhase(AccountPhase.WARMING)
            .warmingStartedAt(now)
            .maxDailyPosts(AccountPhase.WARMING.baseDailyPosts())
            .maxDailyActions(AccountPhase.WARMING.baseDailyActions())
            .createdAt(now)
            .updatedAt(now)
            .build();
    }

    public boolean isThrottleActive(Instant now) {
        return isThrottled && throttleUntil != null && throttleUntil.isAfter(now);
    }

    public AccountHealth withScores(HealthScoreBreakdown breakdown, Instant now) {
        return toBuilder()
            .healthScore(breakdown.healthScore())
            .loginSuccessRate(breakdown.loginSuccessRate())
            .postSuccessRate(breakdown.postSuccessRate())
            .engagementNaturalnessScore(breakdown.engagementNaturalnessScore())
            .freezeRiskScore(breakdown.freezeRiskScore())
            .updatedAt(now)
            .build();
    }

    /**
     * Move along the warming track with the phase's base caps.
     */
    public AccountHealth withPhase(AccountPhase phase, Instant warmingCompletedAt, Instant now) {
        return toBuilder()
            .accountPhase(phase)
            .maxDailyPosts(phase.baseDailyPosts())
            .maxDailyActions(phase.baseDailyActions())
            .warmingCompletedAt(warmingCompletedAt)
            .updatedAt(now)
            .build();
    }

    public AccountHealth suspended(String suspendedReason, String throttleReason, Instant now) {
        return toBuilder()
            .isSuspended(true)
            .suspendedReason(suspendedReason)
            .isThrottled(true)
            .throttleReason(throttleReason)
            .maxDailyPosts(0)
            .maxDailyActions(0)
            .updatedAt(now)
            .build();
    }

    public AccountHealth throttled(int maxDailyPosts, int maxDailyActions, String reason, Instant now) {
        return toBuilder()
            .isThrottled(true)
            .throttleReason(reason)
            .maxDailyPosts(maxDailyPosts)
            .maxDailyActions(maxDailyActions)
            .isSuspended(false)
            .suspendedReason(null)
            .updatedAt(now)
            .build();
    }

    public AccountHealth cooling(String reason, Instant throttleUntil, Instant now) {
        return toBuilder()
            .accountPhase(AccountPhase.COOLING)
            .maxDailyPosts(AccountPhase.COOLING.baseDailyPosts())
            .maxDailyActions(AccountPhase.COOLING.baseDailyActions())
            .isThrottled(true)
            .throttleReason(reason)
            .throttleUntil(throttleUntil)
            .updatedAt(now)
            .build();
    }

    /**
     * Clear throttle and suspension, restoring base caps of {@code phase}.
     */
    public AccountHealth restored(AccountPhase phase, Instant now) {
        return toBuilder()
            .accountPhase(phase)
            .isThrottled(false)
            .throttleReason(null)
            .throttleUntil(null)
            .isSuspended(false)
            .suspendedReason(null)
            .maxDailyPosts(phase.baseDailyPosts())
            .maxDailyActions(phase.baseDailyActions())
            .updatedAt(now)
            .build();
    }

    /**
     * Count an attempted action against the quota counters (no streak change).
     */
    public AccountHealth withActionCounted(ActionType actionType, Instant now) {
        Builder b = toBuilder()
            .actionsToday(actionsToday + 1)
            .actionsThisHour(actionsThisHour + 1)
            .lastActionAt(now)
            .updatedAt(now);
        if (actionType == ActionType.POST) {
            b.postsToday(postsToday + 1)
                .postsThisHour(postsThisHour + 1)
                .lastPostAt(now);
        }
        return b.build();
    }

    public AccountHealth withOutcome(boolean success, Instant now) {
        return toBuilder()
            .consecutiveSuccesses(success ? consecutiveSuccesses + 1 : 0)
            .consecutiveFailures(success ? 0 : consecutiveFailures + 1)
            .updatedAt(now)
            .build();
    }

    public AccountHealth withFreeze(Instant detectedAt, Instant now) {
        return toBuilder()
            .totalFreezeCount(totalFreezeCount + 1)
            .lastFreezeAt(detectedAt)
            .updatedAt(now)
            .build();
    }

    public AccountHealth withDailyCountersReset(Instant now) {
        return toBuilder()
            .postsToday(0)
            .actionsToday(0)
            .postsThisHour(0)
            .actionsThisHour(0)
            .updatedAt(now)
            .build();
    }

    public AccountHealth withHourlyCountersReset(Instant now) {
        return toBuilder()
            .postsThisHour(0)
            .actionsThisHour(0)
            .updatedAt(now)
            .build();
    }

    public AccountHealth withId(Long id) {
        return toBuilder().id(id).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .accountId(accountId)
            .healthScore(healthScore)
            .loginSuccessRate(loginSuccessRate)
            .postSuccessRate(postSuccessRate)
            .engagementNaturalnessScore(engagementNaturalnessScore)
            .freezeRiskScore(freezeRiskScore)
            .accountPhase(accountPhase)
            .warmingStartedAt(warmingStartedAt)
            .warmingCompletedAt(warmingCompletedAt)
            .maxDailyPosts(maxDailyPosts)
            .maxDailyActions(maxDailyActions)
            .postsToday(postsToday)
            .actionsToday(actionsToday)
            .postsThisHour(postsThisHour)
            .actionsThisHour(actionsThisHour)
            .lastActionAt(lastActionAt)
            .lastPostAt(lastPostAt)
            .isThrottled(isThrottled)
            .throttleReason(throttleReason)
            .throttleUntil(throttleUntil)
            .isSuspended(isSuspended)
            .suspendedReason(suspendedReason)
            .totalFreezeCount(totalFreezeCount)
            .lastFreezeAt(lastFreezeAt)
            .consecutiveSuccesses(consecutiveSuccesses)
            .consecutiveFailures(consecutiveFailures)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private long accountId;
        private int healthScore = 100;
        private int loginSuccessRate = 100;
        private int postSuccessRate = 100;
        private int engagementNaturalnessScore = 100;
        private int freezeRiskScore;
        private AccountPhase accountPhase = AccountPhase.WARMING;
        private Instant warmingStartedAt;
        private Instant warmingCompletedAt;
        private int maxDailyPosts = AccountPhase.WARMING.baseDailyPosts();
        private int maxDailyActions = AccountPhase.WARMING.baseDailyActions();
        private int postsToday;
        private int actionsToday;
        private int postsThisHour;
        private int actionsThisHour;
        private Instant lastActionAt;
        private Instant lastPostAt;
        private boolean isThrottled;
        private String throttleReason;
        private Instant throttleUntil;
        private boolean isSuspended;
        private String suspendedReason;
        private int totalFreezeCount;
        private Instant lastFreezeAt;
        private int consecutiveSuccesses;
        private int consecutiveFailures;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(Long id) { this.id = id; return this; }
        public Builder accountId(long accountId) { this.accountId = accountId; return this; }
        public Builder healthScore(int healthScore) { this.healthScore = healthScore; return this; }
        public Builder loginSuccessRate(int v) { this.loginSuccessRate = v; return this; }
        public Builder postSuccessRate(int v) { this.postSuccessRate = v; return this; }
        public Builder engagementNaturalnessScore(int v) { this.engagementNaturalnessScore = v; return this; }
        public Builder freezeRiskScore(int v) { this.freezeRiskScore = v; return this; }
        public Builder accountPhase(AccountPhase accountPhase) { this.accountPhase = accountPhase; return this; }
        public Builder warmingStartedAt(Instant v) { this.warmingStartedAt = v; return this; }
        public Builder warmingCompletedAt(Instant v) { this.warmingCompletedAt = v; return this; }
        public Builder maxDailyPosts(int v) { this.maxDailyPosts = v; return this; }
        public Builder maxDailyActions(int v) { this.maxDailyActions = v; return this; }
        public Builder postsToday(int v) { this.postsToday = v; return this; }
        public Builder actionsToday(int v) { this.actionsToday = v; return this; }
        public Builder postsThisHour(int v) { this.postsThisHour = v; return this; }
        public Builder actionsThisHour(int v) { this.actionsThisHour = v; return this; }
        public Builder lastActionAt(Instant v) { this.lastActionAt = v; return this; }
        public Builder lastPostAt(Instant v) { this.lastPostAt = v; return this; }
        public Builder isThrottled(boolean v) { this.isThrottled = v; return this; }
        public Builder throttleReason(String v) { this.throttleReason = v; return this; }
        public Builder throttleUntil(Instant v) { this.throttleUntil = v; return this; }
        public Builder isSuspended(boolean v) { this.isSuspended = v; return this; }
        public Builder suspendedReason(String v) { this.suspendedReason = v; return this; }
        public Builder totalFreezeCount(int v) { this.totalFreezeCount = v; return this; }
        public Builder lastFreezeAt(Instant v) { this.lastFreezeAt = v; return this; }
        public Builder consecutiveSuccesses(int v) { this.consecutiveSuccesses = v; return this; }
        public Builder consecutiveFailures(int v) { this.consecutiveFailures = v; return this; }
        public Builder createdAt(Instant v) { this.createdAt = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }

        public AccountHealth build() {
            return new AccountHealth(
                id, accountId,
                healthScore, loginSuccessRate, postSuccessRate, engagementNaturalnessScore, freezeRiskScore,
                accountPhase, warmingStartedAt, warmingCompletedAt, maxDailyPosts, maxDailyActions,
                postsToday, actionsToday, postsThisHour, actionsThisHour, lastActionAt, lastPostAt,
                isThrottled, throttleReason, throttleUntil, isSuspended, suspendedReason,
                totalFreezeCount, lastFreezeAt, consecutiveSuccesses, consecutiveFailures,
                createdAt, updatedAt
            );
        }
    }
}
