package in.warmguard.application.health;

import in.warmguard.config.HealthWeights;
import in.warmguard.domain.health.FreezeDetection;
import in.warmguard.domain.health.HealthScoreBreakdown;
import in.warmguard.domain.health.OutcomeCounts;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure scoring functions behind the composite health score.
 *
 * Every sub-score is an integer in 0-100. A missing signal scores as healthy
 * (100, or 0 risk); the composite is rounded half-up and clamped.
 */
public final class HealthScoreCalculator {

    /** Consecutive interactions closer than this look scripted. */
    static final Duration RAPID_GAP = Duration.ofSeconds(5);

    /** Confidence assumed for detections stored without one. */
    static final int DEFAULT_FREEZE_CONFIDENCE = 50;

    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    public static int loginSuccessRate(OutcomeCounts logins) {
        return successRate(logins);
    }

    public static int postSuccessRate(OutcomeCounts posts) {
        return successRate(posts);
    }

    /**
     * 100 minus 80 times the share of gaps between consecutive interactions shorter than five seconds.
     */
    public static int engagementNaturalness(List<Instant> interactionTimes) {
        if (interactionTimes.size() < 2) {
            return 100;
        }
        List<Instant> sorted = new ArrayList<>(interactionTimes);
        Collections.sort(sorted);

        int rapid = 0;
        for (int i = 1; i < sorted.size(); i++) {
            if (Duration.between(sorted.get(i - 1), sorted.get(i)).compareTo(RAPID_GAP) < 0) {
                rapid++;
            }
        }
        double rapidRatio = (double) rapid / (sorted.size() - 1);
        return clamp(Math.round(100 - rapidRatio * 80));
    }

    /**
     * Recency-weighted sum of detections: one from today weighs 20, decaying by 0.6 per day to a floor of 1,
     * scaled by confidence.
     */
    public static int freezeRisk(List<FreezeDetection> detections, Instant now) {
        if (detections.isEmpty()) {
            return 0;
        }
        double risk = 0;
        for (FreezeDetection detection : detections) {
            double daysAgo = (now.toEpochMilli() - detection.detectedAt().toEpochMilli()) / MILLIS_PER_DAY;
            double recencyWeight = Math.max(1, 20 - daysAgo * 0.6);
            int confidence = detection.confidence() == 0 ? DEFAULT_FREEZE_CONFIDENCE : detection.confidence();
            risk += recencyWeight * confidence / 100.0;
        }
        return clamp(Math.round(risk));
    }

    public static HealthScoreBreakdown compose(
            HealthWeights weights,
            int loginSuccessRate,
            int postSuccessRate,
            int naturalness,
            int freezeRisk) {
        double weighted = loginSuccessRate * weights.login()
            + postSuccessRate * weights.post()
            + naturalness * weights.naturalness()
            + (100 - freezeRisk) * weights.freezeSafety();
        return new HealthScoreBreakdown(clamp(Math.round(weighted)), loginSuccessRate, postSuccessRate,
            naturalness, freezeRisk);
    }

    private static int successRate(OutcomeCounts counts) {
        if (counts.total() == 0) {
            return 100;
        }
        return clamp(Math.round(100.0 * counts.succeeded() / counts.total()));
    }

    private static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }

    private HealthScoreCalculator() {}
}
