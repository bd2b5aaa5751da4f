package in.warmguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.util.Env;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration of the safety core, resolved once at startup.
 */
public record SafetyConfig(
    ZoneId zone,
    HealthThresholds thresholds,
    HealthWeights weights,
    HourlyLimitTable hourlyLimits,
    DailyTaskLimits dailyTaskLimits,
    PoolSettings pool,
    Duration healthCheckInterval,
    Duration staleClaimAge,
    Duration staleClaimSweepInterval,
    int metricsPort
) {
    /**
     * Session pool sizing and timing.
     */
    public record PoolSettings(
        int maxConcurrent,
        Duration idleTimeout,
        Duration reclaimInterval,
        Duration shutdownTimeout,
        Path sessionDir
    ) {
        public PoolSettings {
            if (maxConcurrent < 1) {
                throw new IllegalArgumentException("maxConcurrent must be >= 1, got " + maxConcurrent);
            }
        }

        public static PoolSettings defaults() {
            return new PoolSettings(3, Duration.ofMinutes(10), Duration.ofSeconds(60),
                Duration.ofSeconds(10), Path.of("data", "automation-sessions"));
        }

        public static PoolSettings fromEnv() {
            PoolSettings d = defaults();
            return new PoolSettings(
                Env.getInt("POOL_MAX_CONCURRENT", d.maxConcurrent()),
                Env.getSeconds("POOL_IDLE_TIMEOUT_SECONDS", d.idleTimeout()),
                Env.getSeconds("POOL_RECLAIM_INTERVAL_SECONDS", d.reclaimInterval()),
                Env.getSeconds("POOL_SHUTDOWN_TIMEOUT_SECONDS", d.shutdownTimeout()),
                Path.of(Env.get("SESSION_DIR", d.sessionDir().toString()))
            );
        }
    }

    public static SafetyConfig defaults() {
        return new SafetyConfig(
            ZoneId.systemDefault(),
            HealthThresholds.defaults(),
            HealthWeights.defaults(),
            HourlyLimitTable.defaults(),
            DailyTaskLimits.defaults(),
            PoolSettings.defaults(),
            Duration.ofMinutes(15),
            Duration.ofMinutes(30),
            Duration.ofMinutes(10),
            9095
        );
    }

    public static SafetyConfig fromEnv(ObjectMapper mapper) {
        SafetyConfig d = defaults();

        String zoneName = Env.get("SAFETY_TIMEZONE", null);
        ZoneId zone = zoneName == null ? d.zone() : ZoneId.of(zoneName);

        HourlyLimitTable hourly = d.hourlyLimits();
        DailyTaskLimits daily = d.dailyTaskLimits();
        String limitsFile = Env.get("SAFETY_LIMITS_FILE", null);
        if (limitsFile != null) {
            SafetyLimitsFile overrides = SafetyLimitsFile.load(Path.of(limitsFile), mapper);
            hourly = overrides.applyTo(hourly);
            daily = overrides.applyTo(daily);
        }

        return new SafetyConfig(
            zone,
            HealthThresholds.fromEnv(),
            d.weights(),
            hourly,
            daily,
            PoolSettings.fromEnv(),
            Env.getMinutes("HEALTH_CHECK_INTERVAL_MINUTES", d.healthCheckInterval()),
            Env.getMinutes("STALE_CLAIM_MINUTES", d.staleClaimAge()),
            d.staleClaimSweepInterval(),
            Env.getInt("METRICS_PORT", d.metricsPort())
        );
    }
}
