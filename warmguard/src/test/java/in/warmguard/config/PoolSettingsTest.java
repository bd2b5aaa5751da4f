package in.warmguard.config;

import in.warmguard.config.SafetyConfig.PoolSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PoolSettingsTest {

    @AfterEach
    void tearDown() {
        System.clearProperty("POOL_RECLAIM_INTERVAL_SECONDS");
        System.clearProperty("POOL_IDLE_TIMEOUT_SECONDS");
    }

    @Test
    void testZeroIntervalsFallBackToDefaults() {
        System.setProperty("POOL_RECLAIM_INTERVAL_SECONDS", "0");
        System.setProperty("POOL_IDLE_TIMEOUT_SECONDS", "0");

        PoolSettings pool = PoolSettings.fromEnv();

        assertEquals(PoolSettings.defaults().reclaimInterval(), pool.reclaimInterval());
        assertEquals(PoolSettings.defaults().idleTimeout(), pool.idleTimeout());
        assertTrue(pool.reclaimInterval().toMillis() > 0, "Reclaim interval drives a fixed-rate timer");
    }
}
