package in.warmguard.infrastructure.metrics;

import in.warmguard.domain.gate.DenialReason;
import in.warmguard.domain.health.ActionType;
import in.warmguard.domain.health.ThrottleAction;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of SafetyMetrics.
 *
 * Key Metrics:
 * - safety_gate_decisions_total{action, result} - allowed or the denial reason
 * - safety_throttle_decisions_total{action} - NONE/THROTTLE/SUSPEND/ESCALATE
 * - safety_health_score - distribution of computed scores
 * - safety_health_cycle_seconds / safety_health_cycle_errors_total
 * - session_pool_active - live sessions
 * - session_pool_acquisitions_total{mode} - reused or created
 * - session_pool_releases_total{cause}
 * - engagement_tasks_scheduled_total
 */
public class PrometheusSafetyMetrics implements SafetyMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSafetyMetrics.class);

    private final CollectorRegistry registry;

    // Gate and throttle metrics
    private final Counter gateDecisions;
    private final Counter throttleDecisions;

    // Health metrics
    private final Histogram healthScore;
    private final Histogram healthCycleDuration;
    private final Gauge healthCycleAccounts;
    private final Counter healthCycleErrors;

    // Session pool metrics
    private final Gauge activeSessions;
    private final Counter sessionAcquisitions;
    private final Counter sessionReleases;
    private final Counter sessionCreationFailures;

    // Scheduler metrics
    private final Counter tasksScheduled;

    public PrometheusSafetyMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSafetyMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.gateDecisions = Counter.build()
            .name("safety_gate_decisions_total")
            .help("Action gate decisions")
            .labelNames("action", "result")
            .register(registry);

        this.throttleDecisions = Counter.build()
            .name("safety_throttle_decisions_total")
            .help("Throttle engine decisions")
            .labelNames("action")
            .register(registry);

        this.healthScore = Histogram.build()
            .name("safety_health_score")
            .help("Computed account health scores")
            .buckets(20, 40, 60, 70, 80, 90, 100)
            .register(registry);

        this.healthCycleDuration = Histogram.build()
            .name("safety_health_cycle_seconds")
            .help("Health sweep duration in seconds")
            .buckets(0.1, 0.5, 1.0, 5.0, 15.0, 60.0, 300.0)
            .register(registry);

        this.healthCycleAccounts = Gauge.build()
            .name("safety_health_cycle_accounts")
            .help("Accounts evaluated by the last health sweep")
            .register(registry);

        this.healthCycleErrors = Counter.build()
            .name("safety_health_cycle_errors_total")
            .help("Per-account failures during health sweeps")
            .register(registry);

        this.activeSessions = Gauge.build()
            .name("session_pool_active")
            .help("Live automation sessions")
            .register(registry);

        this.sessionAcquisitions = Counter.build()
            .name("session_pool_acquisitions_total")
            .help("Session acquisitions")
            .labelNames("mode")
            .register(registry);

        this.sessionReleases = Counter.build()
            .name("session_pool_releases_total")
            .help("Sessions removed from the pool")
            .labelNames("cause")
            .register(registry);

        this.sessionCreationFailures = Counter.build()
            .name("session_pool_creation_failures_total")
            .help("Automation contexts that failed to open")
            .register(registry);

        this.tasksScheduled = Counter.build()
            .name("engagement_tasks_scheduled_total")
            .help("Tasks returned by the engagement scheduler")
            .register(registry);

        log.info("[PrometheusSafetyMetrics] Initialized");
    }

    @Override
    public void recordGateDecision(ActionType actionType, DenialReason denialReason) {
        gateDecisions.labels(actionType.wireName(), denialReason == null ? "allowed" : denialReason.name()).inc();
    }

    @Override
    public void recordThrottleDecision(ThrottleAction action) {
        throttleDecisions.labels(action.name()).inc();
    }

    @Override
    public void recordHealthScore(int score) {
        healthScore.observe(score);
    }

    @Override
    public void recordHealthCycle(Duration duration, int accountsChecked, int errors) {
        healthCycleDuration.observe(duration.toMillis() / 1000.0);
        healthCycleAccounts.set(accountsChecked);
        healthCycleErrors.inc(errors);
    }

    @Override
    public void recordSessionAcquired(boolean reused) {
        sessionAcquisitions.labels(reused ? "reused" : "created").inc();
    }

    @Override
    public void recordSessionReleased(String cause) {
        sessionReleases.labels(cause).inc();
    }

    @Override
    public void recordSessionCreationFailure() {
        sessionCreationFailures.inc();
    }

    @Override
    public void setActiveSessions(int count) {
        activeSessions.set(count);
    }

    @Override
    public void recordTasksScheduled(int count) {
        tasksScheduled.inc(count);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
