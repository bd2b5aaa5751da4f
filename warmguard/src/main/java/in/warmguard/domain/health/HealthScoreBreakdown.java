package in.warmguard.domain.health;

/**
 * Composite health score with the four sub-scores it was built from.
 */
public record HealthScoreBreakdown(
    int healthScore,
    int loginSuccessRate,
    int postSuccessRate,
    int engagementNaturalnessScore,
    int freezeRiskScore
) {
    /**
     * Breakdown reported for an account without a health record.
     */
    public static HealthScoreBreakdown unavailable() {
        return new HealthScoreBreakdown(0, 0, 0, 0, 100);
    }
}
