package in.warmguard.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Calendar boundary arithmetic for quota windows.
 *
 * Daily and hourly counters roll over on local boundaries of the configured zone.
 */
public final class TimeBoundaries {

    /**
     * Start of the local calendar day containing {@code now}.
     */
    public static Instant startOfDay(Instant now, ZoneId zone) {
        return now.atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }

    /**
     * Next local midnight strictly after {@code now}.
     */
    public static Instant nextMidnight(Instant now, ZoneId zone) {
        return now.atZone(zone).toLocalDate().plusDays(1).atStartOfDay(zone).toInstant();
    }

    /**
     * Next local hour boundary strictly after {@code now}.
     */
    public static Instant nextHour(Instant now, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone).truncatedTo(ChronoUnit.HOURS);
        return local.plusHours(1).toInstant();
    }

    public static long millisUntilNextMidnight(Instant now, ZoneId zone) {
        return Duration.between(now, nextMidnight(now, zone)).toMillis();
    }

    public static long millisUntilNextHour(Instant now, ZoneId zone) {
        return Duration.between(now, nextHour(now, zone)).toMillis();
    }

    private TimeBoundaries() {}
}
