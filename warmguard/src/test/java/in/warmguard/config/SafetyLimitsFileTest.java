package in.warmguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.domain.health.AccountPhase;
import in.warmguard.domain.health.ActionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SafetyLimitsFileTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void testLoadAndApplyOverrides() throws Exception {
        Path file = dir.resolve("limits.json");
        Files.writeString(file, """
            {
              "hourlyLimits": { "Mature": { "like": 25, "FOLLOW": 8 } },
              "dailyTaskLimits": { "follow": 15 },
              "comment": "ignored"
            }
            """);

        SafetyLimitsFile limits = SafetyLimitsFile.load(file, mapper);
        HourlyLimitTable hourly = limits.applyTo(HourlyLimitTable.defaults());
        DailyTaskLimits daily = limits.applyTo(DailyTaskLimits.defaults());

        assertEquals(25, hourly.limit(AccountPhase.MATURE, ActionType.LIKE));
        assertEquals(8, hourly.limit(AccountPhase.MATURE, ActionType.FOLLOW));
        assertEquals(5, hourly.limit(AccountPhase.MATURE, ActionType.POST));
        assertEquals(15, daily.limit(ActionType.FOLLOW));
        assertEquals(50, daily.limit(ActionType.LIKE));
    }

    @Test
    void testEmptyDocumentKeepsDefaults() throws Exception {
        Path file = dir.resolve("empty.json");
        Files.writeString(file, "{}");

        SafetyLimitsFile limits = SafetyLimitsFile.load(file, mapper);

        HourlyLimitTable defaults = HourlyLimitTable.defaults();
        assertSame(defaults, limits.applyTo(defaults));
    }

    @Test
    void testUnknownPhaseRejected() throws Exception {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"hourlyLimits\": {\"veteran\": {\"like\": 5}}}");

        SafetyLimitsFile limits = SafetyLimitsFile.load(file, mapper);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> limits.applyTo(HourlyLimitTable.defaults()));
        assertTrue(e.getMessage().contains("veteran"));
    }

    @Test
    void testUnreadableFileFailsStartup() {
        assertThrows(IllegalStateException.class,
            () -> SafetyLimitsFile.load(dir.resolve("missing.json"), mapper));
    }

    @Test
    void testMalformedJsonFailsStartup() throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(IllegalStateException.class, () -> SafetyLimitsFile.load(file, mapper));
    }
}
