package in.warmguard.config;

/**
 * Weights of the four sub-scores in the composite health score. Must sum to 1.
 */
public record HealthWeights(double login, double post, double naturalness, double freezeSafety) {

    public HealthWeights {
        double sum = login + post + naturalness + freezeSafety;
        if (login < 0 || post < 0 || naturalness < 0 || freezeSafety < 0 || Math.abs(sum - 1.0) > 1e-9) {
            throw new IllegalArgumentException("Health weights must be non-negative and sum to 1, got " + sum);
        }
    }

    public static HealthWeights defaults() {
        return new HealthWeights(0.20, 0.30, 0.20, 0.30);
    }
}
