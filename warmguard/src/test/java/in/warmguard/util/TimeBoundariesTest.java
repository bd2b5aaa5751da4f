package in.warmguard.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class TimeBoundariesTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");
    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void testStartOfDayUsesLocalDate() {
        // 00:15 IST on March 2nd
        Instant now = Instant.parse("2024-03-01T18:45:00Z");

        assertEquals(Instant.parse("2024-03-01T18:30:00Z"), TimeBoundaries.startOfDay(now, KOLKATA));
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), TimeBoundaries.startOfDay(now, ZoneId.of("UTC")));
    }

    @Test
    void testNextHourOnHalfHourOffsetZone() {
        Instant now = Instant.parse("2024-03-01T10:15:00Z"); // 15:45 IST

        assertEquals(Instant.parse("2024-03-01T10:30:00Z"), TimeBoundaries.nextHour(now, KOLKATA));
    }

    @Test
    void testNextHourIsStrictlyAfter() {
        Instant onBoundary = Instant.parse("2024-03-01T10:00:00Z");

        assertEquals(Instant.parse("2024-03-01T11:00:00Z"), TimeBoundaries.nextHour(onBoundary, ZoneId.of("UTC")));
    }

    @Test
    void testSpringForwardDay() {
        Instant noon = Instant.parse("2024-03-10T16:00:00Z"); // 12:00 EDT

        assertEquals(Instant.parse("2024-03-10T05:00:00Z"), TimeBoundaries.startOfDay(noon, NEW_YORK));
        assertEquals(Instant.parse("2024-03-11T04:00:00Z"), TimeBoundaries.nextMidnight(noon, NEW_YORK));

        Instant beforeGap = Instant.parse("2024-03-10T06:30:00Z"); // 01:30 EST
        assertEquals(Instant.parse("2024-03-10T07:00:00Z"), TimeBoundaries.nextHour(beforeGap, NEW_YORK),
            "02:00 does not exist, the next boundary is 03:00 EDT");
    }
}
