package in.warmguard.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.application.engagement.EngagementScheduler;
import in.warmguard.application.gate.ActionGate;
import in.warmguard.application.health.AccountHealthService;
import in.warmguard.application.health.AccountLocks;
import in.warmguard.application.health.EscalationListener;
import in.warmguard.application.monitoring.AlertService;
import in.warmguard.application.monitoring.HealthMonitor;
import in.warmguard.application.port.output.AccountHealthRepository;
import in.warmguard.application.port.output.AutomationEngine;
import in.warmguard.application.port.output.EngagementLogRepository;
import in.warmguard.application.port.output.EngagementTaskRepository;
import in.warmguard.application.port.output.EscalationRepository;
import in.warmguard.application.port.output.HealthSignalRepository;
import in.warmguard.application.port.output.InteractionSettingsRepository;
import in.warmguard.application.port.output.SessionStateStore;
import in.warmguard.config.SafetyConfig;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import in.warmguard.infrastructure.session.FileSessionStateStore;
import in.warmguard.infrastructure.session.SessionPool;
import in.warmguard.repository.PostgresAccountHealthRepository;
import in.warmguard.repository.PostgresEngagementLogRepository;
import in.warmguard.repository.PostgresEngagementTaskRepository;
import in.warmguard.repository.PostgresEscalationRepository;
import in.warmguard.repository.PostgresHealthSignalRepository;
import in.warmguard.repository.PostgresInteractionSettingsRepository;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembled safety core: every service wired over one set of ports.
 *
 * The account health service and the action gate share a single {@link AccountLocks}
 * so all writers of a health record serialize on the same per-account lock.
 */
public final class SafetyCore {

    private final SafetyConfig config;
    private final AccountHealthService healthService;
    private final ActionGate actionGate;
    private final EngagementScheduler engagementScheduler;
    private final SessionPool sessionPool;
    private final AlertService alertService;
    private final HealthMonitor healthMonitor;
    private final MaintenanceSupervisor supervisor;

    private SafetyCore(Builder b) {
        this.config = b.config;
        this.alertService = new AlertService();
        EscalationListener listener = b.escalationListener != null ? b.escalationListener : alertService;
        AccountLocks locks = new AccountLocks();

        this.healthService = new AccountHealthService(
            b.healthRepo, b.signalRepo, b.escalationRepo, listener, locks,
            config.thresholds(), config.weights(), b.metrics, b.clock);
        this.actionGate = new ActionGate(
            b.healthRepo, b.signalRepo, locks, config.hourlyLimits(), b.metrics, b.clock, config.zone());
        this.engagementScheduler = new EngagementScheduler(
            b.taskRepo, b.logRepo, b.settingsRepo, config.dailyTaskLimits(), b.metrics, b.clock, config.zone());
        this.sessionPool = b.engine == null
            ? null
            : new SessionPool(b.engine, b.stateStore, config.pool(), b.metrics, b.clock);
        this.healthMonitor = new HealthMonitor(
            healthService, alertService, b.metrics, b.clock, config.thresholds().unthrottleAt());
        this.supervisor = new MaintenanceSupervisor(
            healthMonitor, actionGate, engagementScheduler, sessionPool, config, b.clock);
    }

    public SafetyConfig config() {
        return config;
    }

    public AccountHealthService healthService() {
        return healthService;
    }

    public ActionGate actionGate() {
        return actionGate;
    }

    public EngagementScheduler engagementScheduler() {
        return engagementScheduler;
    }

    /**
     * Session pool, empty when no automation engine was supplied.
     */
    public Optional<SessionPool> sessionPool() {
        return Optional.ofNullable(sessionPool);
    }

    public AlertService alertService() {
        return alertService;
    }

    public HealthMonitor healthMonitor() {
        return healthMonitor;
    }

    public MaintenanceSupervisor supervisor() {
        return supervisor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SafetyConfig config = SafetyConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private SafetyMetrics metrics = SafetyMetrics.NOOP;
        private AccountHealthRepository healthRepo;
        private HealthSignalRepository signalRepo;
        private EscalationRepository escalationRepo;
        private EngagementTaskRepository taskRepo;
        private EngagementLogRepository logRepo;
        private InteractionSettingsRepository settingsRepo;
        private SessionStateStore stateStore;
        private AutomationEngine engine;
        private EscalationListener escalationListener;

        public Builder config(SafetyConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metrics(SafetyMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Wire every persistence port to its PostgreSQL adapter and session state to
         * JSON files under the configured session directory.
         */
        public Builder postgres(DataSource dataSource, ObjectMapper mapper) {
            this.healthRepo = new PostgresAccountHealthRepository(dataSource);
            this.signalRepo = new PostgresHealthSignalRepository(dataSource);
            this.escalationRepo = new PostgresEscalationRepository(dataSource, mapper);
            this.taskRepo = new PostgresEngagementTaskRepository(dataSource);
            this.logRepo = new PostgresEngagementLogRepository(dataSource);
            this.settingsRepo = new PostgresInteractionSettingsRepository(dataSource);
            this.stateStore = new FileSessionStateStore(config.pool().sessionDir(), mapper);
            return this;
        }

        public Builder healthRepository(AccountHealthRepository healthRepo) {
            this.healthRepo = healthRepo;
            return this;
        }

        public Builder signalRepository(HealthSignalRepository signalRepo) {
            this.signalRepo = signalRepo;
            return this;
        }

        public Builder escalationRepository(EscalationRepository escalationRepo) {
            this.escalationRepo = escalationRepo;
            return this;
        }

        public Builder taskRepository(EngagementTaskRepository taskRepo) {
            this.taskRepo = taskRepo;
            return this;
        }

        public Builder logRepository(EngagementLogRepository logRepo) {
            this.logRepo = logRepo;
            return this;
        }

        public Builder settingsRepository(InteractionSettingsRepository settingsRepo) {
            this.settingsRepo = settingsRepo;
            return this;
        }

        public Builder sessionStateStore(SessionStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * Optional. Without an engine the core runs without a session pool.
         */
        public Builder automationEngine(AutomationEngine engine) {
            this.engine = engine;
            return this;
        }

        /**
         * Optional. Defaults to the core's {@link AlertService}.
         */
        public Builder escalationListener(EscalationListener escalationListener) {
            this.escalationListener = escalationListener;
            return this;
        }

        public SafetyCore build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(metrics, "metrics");
            Objects.requireNonNull(healthRepo, "healthRepository");
            Objects.requireNonNull(signalRepo, "signalRepository");
            Objects.requireNonNull(escalationRepo, "escalationRepository");
            Objects.requireNonNull(taskRepo, "taskRepository");
            Objects.requireNonNull(logRepo, "logRepository");
            Objects.requireNonNull(settingsRepo, "settingsRepository");
            if (engine != null) {
                Objects.requireNonNull(stateStore, "sessionStateStore");
            }
            return new SafetyCore(this);
        }
    }
}
