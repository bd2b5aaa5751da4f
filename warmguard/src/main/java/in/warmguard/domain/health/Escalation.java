package in.warmguard.domain.health;

import java.time.Instant;

/**
 * Request for human review of an account whose health collapsed.
 *
 * Distinct from an automatic suspension: operators use it to find accounts that
 * will not recover on their own.
 */
public record Escalation(
    Long id,
    long accountId,
    int healthScore,
    String reason,
    HealthScoreBreakdown breakdown,
    Instant createdAt
) {
    public static Escalation of(long accountId, HealthScoreBreakdown breakdown, String reason, Instant createdAt) {
        return new Escalation(null, accountId, breakdown.healthScore(), reason, breakdown, createdAt);
    }
}
