package in.warmguard.domain.health;

/**
 * Succeeded/failed tallies of attempts within a scoring window.
 */
public record OutcomeCounts(int succeeded, int failed) {

    public static OutcomeCounts none() {
        return new OutcomeCounts(0, 0);
    }

    public int total() {
        return succeeded + failed;
    }
}
