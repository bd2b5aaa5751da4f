package in.warmguard.domain.engagement;

/**
 * Queue snapshot for one project/account pair. Daily figures count from local midnight.
 */
public record QueueStats(int pending, int completedToday, int failedToday, int successRatePercent) {

    public static QueueStats of(int pending, int completedToday, int failedToday) {
        int attempts = completedToday + failedToday;
        int rate = attempts == 0 ? 0 : (int) Math.round(100.0 * completedToday / attempts);
        return new QueueStats(pending, completedToday, failedToday, rate);
    }
}
