package in.warmguard.bootstrap;

import in.warmguard.application.monitoring.HealthCycleReport;
import in.warmguard.application.port.output.AutomationContext;
import in.warmguard.config.SafetyConfig;
import in.warmguard.domain.gate.ActionPermission;
import in.warmguard.domain.gate.DenialReason;
import in.warmguard.domain.health.AccountHealth;
import in.warmguard.domain.health.ActionType;
import in.warmguard.domain.health.Escalation;
import in.warmguard.domain.health.FreezeDetection;
import in.warmguard.domain.health.FreezeDetection.FreezeType;
import in.warmguard.support.FakeAutomationEngine;
import in.warmguard.support.InMemoryAccountHealthRepository;
import in.warmguard.support.InMemoryEngagementLogRepository;
import in.warmguard.support.InMemoryEngagementTaskRepository;
import in.warmguard.support.InMemoryEscalationRepository;
import in.warmguard.support.InMemoryHealthSignalRepository;
import in.warmguard.support.InMemorySessionStateStore;
import in.warmguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test wiring the whole safety core over in-memory ports.
 *
 * Tests:
 * - Gate and health engine share one view of the account
 * - A health sweep escalates a collapsed account and the gate then refuses it
 * - Session pool present only with an automation engine
 * - Builder rejects missing ports
 */
class SafetyCoreTest {

    private static final long ACCOUNT = 11L;

    private MutableClock clock;
    private InMemoryAccountHealthRepository healthRepo;
    private InMemoryHealthSignalRepository signalRepo;
    private InMemoryEscalationRepository escalationRepo;
    private FakeAutomationEngine engine;
    private List<Escalation> escalations;
    private SafetyCore core;

    @BeforeEach
    void setUp() {
        clock = MutableClock.utc("2024-03-01T10:15:00Z");
        healthRepo = new InMemoryAccountHealthRepository();
        signalRepo = new InMemoryHealthSignalRepository();
        escalationRepo = new InMemoryEscalationRepository();
        engine = new FakeAutomationEngine();
        escalations = new CopyOnWriteArrayList<>();

        core = baseBuilder()
            .automationEngine(engine)
            .sessionStateStore(new InMemorySessionStateStore())
            .escalationListener(escalations::add)
            .build();
    }

    @AfterEach
    void tearDown() {
        core.supervisor().stop();
    }

    private SafetyCore.Builder baseBuilder() {
        SafetyConfig d = SafetyConfig.defaults();
        SafetyConfig utc = new SafetyConfig(ZoneId.of("UTC"), d.thresholds(), d.weights(), d.hourlyLimits(),
            d.dailyTaskLimits(), d.pool(), d.healthCheckInterval(), d.staleClaimAge(),
            d.staleClaimSweepInterval(), d.metricsPort());
        return SafetyCore.builder()
            .config(utc)
            .clock(clock)
            .healthRepository(healthRepo)
            .signalRepository(signalRepo)
            .escalationRepository(escalationRepo)
            .taskRepository(new InMemoryEngagementTaskRepository())
            .logRepository(new InMemoryEngagementLogRepository())
            .settingsRepository(projectId -> Optional.empty());
    }

    @Test
    void testReservationVisibleToHealthEngine() {
        core.healthService().initAccountHealth(ACCOUNT);

        ActionPermission permission = core.actionGate().tryReserve(ACCOUNT, ActionType.POST);

        assertTrue(permission.allowed());
        AccountHealth health = core.healthService().getAccountHealth(ACCOUNT).orElseThrow();
        assertEquals(1, health.postsToday());
        assertEquals(1, health.postsThisHour());
    }

    @Test
    void testSweepEscalatesCollapsedAccountAndGateRefusesIt() {
        core.healthService().initAccountHealth(ACCOUNT);
        core.healthService().recordLoginAttempt(ACCOUNT, false);
        signalRepo.recordPostOutcome(ACCOUNT, false, clock.instant());
        for (int i = 0; i < 3; i++) {
            signalRepo.recordInteraction(ACCOUNT, ActionType.LIKE, clock.instant().plusSeconds(i));
        }
        for (int i = 0; i < 5; i++) {
            signalRepo.recordFreezeDetection(FreezeDetection.of(ACCOUNT, FreezeType.ACCOUNT_FREEZE, 100, clock.instant()));
        }

        HealthCycleReport report = core.healthMonitor().runHealthCheckCycle();

        assertEquals(1, report.accountsChecked());
        assertEquals(1, report.escalated());
        assertEquals(1, escalations.size(), "Custom listener should receive the escalation");
        assertEquals(1, escalationRepo.rows.size());

        ActionPermission permission = core.actionGate().canPerformAction(ACCOUNT, ActionType.LIKE);
        assertFalse(permission.allowed());
        assertEquals(DenialReason.SUSPENDED, permission.reason());
    }

    @Test
    void testSessionPoolWiredWithEngine() {
        assertTrue(core.sessionPool().isPresent());

        AutomationContext context = core.sessionPool().orElseThrow().acquireContext(ACCOUNT);

        assertNotNull(context);
        assertEquals(1, engine.starts.get());
    }

    @Test
    void testNoSessionPoolWithoutEngine() {
        SafetyCore bare = baseBuilder().build();
        try {
            assertTrue(bare.sessionPool().isEmpty());
            assertNotNull(bare.alertService());
        } finally {
            bare.supervisor().stop();
        }
    }

    @Test
    void testBuilderRejectsMissingPorts() {
        NullPointerException e = assertThrows(NullPointerException.class,
            () -> SafetyCore.builder().clock(clock).build());
        assertEquals("healthRepository", e.getMessage());

        assertThrows(NullPointerException.class,
            () -> baseBuilder().automationEngine(engine).build(),
            "An engine without a state store is incomplete");
    }
}
