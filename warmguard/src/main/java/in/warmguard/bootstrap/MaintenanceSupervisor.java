package in.warmguard.bootstrap;

import in.warmguard.application.engagement.EngagementScheduler;
import in.warmguard.application.gate.ActionGate;
import in.warmguard.application.monitoring.HealthMonitor;
import in.warmguard.config.SafetyConfig;
import in.warmguard.infrastructure.session.SessionPool;
import in.warmguard.util.TimeBoundaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

/**
 * Owner of every background timer in the safety core.
 *
 * Jobs:
 * - health sweep every {@code healthCheckInterval}
 * - idle session sweep every {@code reclaimInterval} (only with a session pool)
 * - hourly counter reset on each local hour boundary
 * - daily counter reset and finished-task cleanup at each local midnight
 * - stale claim expiry every {@code staleClaimSweepInterval}
 *
 * Boundary jobs re-arm themselves after each run so DST shifts land on the real boundary.
 */
public final class MaintenanceSupervisor {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceSupervisor.class);

    private final HealthMonitor healthMonitor;
    private final ActionGate actionGate;
    private final EngagementScheduler engagementScheduler;
    private final SessionPool sessionPool;  // null when no automation engine is installed
    private final SafetyConfig config;
    private final Clock clock;
    private final ZoneId zone;
    private final ScheduledExecutorService scheduler;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private volatile boolean started;
    private volatile boolean stopped;
    private Thread shutdownHook;

    public MaintenanceSupervisor(
            HealthMonitor healthMonitor,
            ActionGate actionGate,
            EngagementScheduler engagementScheduler,
            SessionPool sessionPool,
            SafetyConfig config,
            Clock clock) {
        this.healthMonitor = healthMonitor;
        this.actionGate = actionGate;
        this.engagementScheduler = engagementScheduler;
        this.sessionPool = sessionPool;
        this.config = config;
        this.clock = clock;
        this.zone = config.zone();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "safety-maintenance");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule every job and register a JVM shutdown hook. Calling twice is a no-op.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        log.info("[SUPERVISOR] Starting maintenance supervisor...");

        long healthMs = config.healthCheckInterval().toMillis();
        jobs.put("health sweep", scheduler.scheduleAtFixedRate(this::runHealthSweep, 0, healthMs, TimeUnit.MILLISECONDS));

        if (sessionPool != null) {
            long reclaimMs = config.pool().reclaimInterval().toMillis();
            jobs.put("idle sweep", scheduler.scheduleAtFixedRate(this::runIdleSweep, reclaimMs, reclaimMs, TimeUnit.MILLISECONDS));
        } else {
            log.info("[SUPERVISOR] No session pool, idle session sweep disabled");
        }

        long claimMs = config.staleClaimSweepInterval().toMillis();
        jobs.put("stale claims", scheduler.scheduleAtFixedRate(this::runStaleClaimSweep, claimMs, claimMs, TimeUnit.MILLISECONDS));

        scheduleAtBoundary(TimeBoundaries::nextHour, this::runHourlyReset, "hourly reset");
        scheduleAtBoundary(TimeBoundaries::nextMidnight, this::runDailyReset, "daily reset");

        shutdownHook = new Thread(this::stop, "safety-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        log.info("[SUPERVISOR] ✓ Started (health every {}, stale claims every {}, zone {})",
            config.healthCheckInterval(), config.staleClaimSweepInterval(), zone);
    }

    /**
     * Cancel every job, then release all pooled sessions within the configured timeout.
     * A caller arriving while another stop is in progress returns only once that stop has finished.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        log.info("[SUPERVISOR] Stopping maintenance supervisor...");

        jobs.values().forEach(job -> job.cancel(false));
        jobs.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (sessionPool != null) {
            sessionPool.shutdownAll(config.pool().shutdownTimeout());
        }
        removeShutdownHook();
        log.info("[SUPERVISOR] ✓ Stopped");
    }

    public boolean isStarted() {
        return started && !stopped;
    }

    private void removeShutdownHook() {
        Thread hook = shutdownHook;
        if (hook == null || Thread.currentThread() == hook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down
            log.debug("[SUPERVISOR] Shutdown in progress, hook left registered");
        }
    }

    private void scheduleAtBoundary(BiFunction<Instant, ZoneId, Instant> nextBoundary, Runnable job, String name) {
        if (stopped) {
            return;
        }
        Instant now = clock.instant();
        long delayMs = Math.max(0, Duration.between(now, nextBoundary.apply(now, zone)).toMillis());
        ScheduledFuture<?> future;
        try {
            future = scheduler.schedule(() -> {
                try {
                    job.run();
                } finally {
                    scheduleAtBoundary(nextBoundary, job, name);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[SUPERVISOR] Scheduler shut down, {} not re-armed", name);
            return;
        }
        jobs.put(name, future);
        log.debug("[SUPERVISOR] Next {} in {} ms", name, delayMs);
    }

    // ========================================================================
    // Jobs (each one catches its own failures so the timer keeps firing)
    // ========================================================================

    void runHealthSweep() {
        try {
            healthMonitor.runHealthCheckCycle();
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Health sweep failed: {}", e.getMessage(), e);
        }
    }

    void runIdleSweep() {
        try {
            sessionPool.reclaimIdle();
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Idle session sweep failed: {}", e.getMessage(), e);
        }
    }

    void runStaleClaimSweep() {
        try {
            int expired = engagementScheduler.expireStaleClaims(config.staleClaimAge());
            if (expired > 0) {
                log.info("[SUPERVISOR] Expired {} stale task claim(s)", expired);
            }
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Stale claim sweep failed: {}", e.getMessage(), e);
        }
    }

    void runHourlyReset() {
        try {
            actionGate.resetHourlyCounters();
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Hourly counter reset failed: {}", e.getMessage(), e);
        }
    }

    void runDailyReset() {
        try {
            actionGate.resetDailyCounters();
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Daily counter reset failed: {}", e.getMessage(), e);
        }
        try {
            engagementScheduler.cleanupOldTasks();
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] Finished task cleanup failed: {}", e.getMessage(), e);
        }
    }
}
