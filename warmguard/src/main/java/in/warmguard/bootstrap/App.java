package in.warmguard.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.warmguard.application.port.output.AutomationEngine;
import in.warmguard.config.SafetyConfig;
import in.warmguard.infrastructure.metrics.PrometheusSafetyMetrics;
import in.warmguard.migration.SafetySchemaMigration;
import in.warmguard.transport.http.OpsHandlers;
import in.warmguard.transport.http.OpsServer;
import in.warmguard.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Standalone entry point (NO Spring).
 *
 * Starts the safety core over PostgreSQL with:
 * - startup schema migration
 * - Prometheus metrics and the ops server
 * - maintenance supervisor (health sweeps, counter resets, stale claims, idle sessions)
 *
 * The automation engine is discovered through {@link ServiceLoader}; without one the
 * core runs with no session pool.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== WarmGuard safety core starting ===");

        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SafetyConfig config = SafetyConfig.fromEnv(mapper);
        Clock clock = Clock.system(config.zone());

        // Database
        HikariDataSource dataSource = createDataSource();
        new SafetySchemaMigration(dataSource).migrate();

        // Metrics
        PrometheusSafetyMetrics metrics = new PrometheusSafetyMetrics();
        log.info("✓ Prometheus metrics initialized");

        // Core
        AutomationEngine engine = loadAutomationEngine();
        SafetyCore core = SafetyCore.builder()
            .config(config)
            .clock(clock)
            .metrics(metrics)
            .postgres(dataSource, mapper)
            .automationEngine(engine)
            .build();

        core.supervisor().start();

        OpsServer opsServer = new OpsServer(config.metricsPort(), new OpsHandlers(core, clock), metrics.getRegistry());
        opsServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            opsServer.stop();
            core.supervisor().stop();
            dataSource.close();
            log.info("=== WarmGuard safety core stopped ===");
        }, "app-shutdown"));

        log.info("=== WarmGuard safety core started (zone={}, pool={}) ===",
            config.zone(), engine != null ? "enabled" : "disabled");
    }

    private static AutomationEngine loadAutomationEngine() {
        Iterator<AutomationEngine> engines = ServiceLoader.load(AutomationEngine.class).iterator();
        if (!engines.hasNext()) {
            log.warn("No AutomationEngine on the classpath, session pool disabled");
            return null;
        }
        AutomationEngine engine = engines.next();
        log.info("Automation engine: {}", engine.getClass().getName());
        return engine;
    }

    private static HikariDataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/warmguard");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("warmguard-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
