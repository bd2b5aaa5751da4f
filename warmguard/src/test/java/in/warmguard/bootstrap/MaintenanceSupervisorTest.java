package in.warmguard.bootstrap;

import in.warmguard.application.engagement.EngagementScheduler;
import in.warmguard.application.gate.ActionGate;
import in.warmguard.application.monitoring.HealthMonitor;
import in.warmguard.config.SafetyConfig;
import in.warmguard.infrastructure.session.SessionPool;
import in.warmguard.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MaintenanceSupervisor.
 *
 * Tests:
 * - Each job delegates to its service and survives its failures
 * - Daily reset cleans up finished tasks even when the counter reset fails
 * - start/stop lifecycle, idempotent stop, session pool shutdown
 * - A concurrent stop waits for the first one to finish
 */
@ExtendWith(MockitoExtension.class)
class MaintenanceSupervisorTest {

    @Mock
    private HealthMonitor healthMonitor;

    @Mock
    private ActionGate actionGate;

    @Mock
    private EngagementScheduler engagementScheduler;

    @Mock
    private SessionPool sessionPool;

    private final SafetyConfig config = SafetyConfig.defaults();
    private MaintenanceSupervisor supervisor;

    @BeforeEach
    void setUp() {
        supervisor = new MaintenanceSupervisor(healthMonitor, actionGate, engagementScheduler, sessionPool,
            config, MutableClock.utc("2024-03-01T10:15:00Z"));
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
    }

    @Test
    void testHealthSweepSwallowsFailures() {
        when(healthMonitor.runHealthCheckCycle()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(supervisor::runHealthSweep);
        verify(healthMonitor).runHealthCheckCycle();
    }

    @Test
    void testIdleSweepDelegatesToPool() {
        when(sessionPool.reclaimIdle()).thenThrow(new IllegalStateException("engine gone"));

        assertDoesNotThrow(supervisor::runIdleSweep);
        verify(sessionPool).reclaimIdle();
    }

    @Test
    void testStaleClaimSweepUsesConfiguredAge() {
        when(engagementScheduler.expireStaleClaims(config.staleClaimAge())).thenReturn(2);

        supervisor.runStaleClaimSweep();

        verify(engagementScheduler).expireStaleClaims(config.staleClaimAge());
    }

    @Test
    void testHourlyResetSwallowsFailures() {
        when(actionGate.resetHourlyCounters()).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(supervisor::runHourlyReset);
        verify(actionGate).resetHourlyCounters();
    }

    @Test
    void testDailyResetCleansUpEvenWhenCounterResetFails() {
        when(actionGate.resetDailyCounters()).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(supervisor::runDailyReset);

        verify(actionGate).resetDailyCounters();
        verify(engagementScheduler).cleanupOldTasks();
    }

    @Test
    void testStartRunsHealthSweepImmediately() {
        supervisor.start();
        supervisor.start();

        assertTrue(supervisor.isStarted());
        verify(healthMonitor, timeout(2000)).runHealthCheckCycle();
    }

    @Test
    void testStopShutsDownPoolOnce() {
        supervisor.start();

        supervisor.stop();
        supervisor.stop();

        assertFalse(supervisor.isStarted());
        verify(sessionPool, times(1)).shutdownAll(config.pool().shutdownTimeout());
    }

    @Test
    void testConcurrentStopWaitsForSessionRelease() throws Exception {
        CountDownLatch releasing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(inv -> {
            releasing.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(sessionPool).shutdownAll(config.pool().shutdownTimeout());

        CompletableFuture<Void> first = CompletableFuture.runAsync(supervisor::stop);
        assertTrue(releasing.await(5, TimeUnit.SECONDS), "First stop should reach the session pool");

        CompletableFuture<Void> second = CompletableFuture.runAsync(supervisor::stop);
        assertThrows(TimeoutException.class, () -> second.get(300, TimeUnit.MILLISECONDS),
            "Second stop must not return while sessions are still being released");

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        verify(sessionPool, times(1)).shutdownAll(config.pool().shutdownTimeout());
    }

    @Test
    void testRunsWithoutSessionPool() {
        MaintenanceSupervisor noPool = new MaintenanceSupervisor(healthMonitor, actionGate, engagementScheduler, null,
            config, MutableClock.utc("2024-03-01T10:15:00Z"));

        noPool.start();
        assertTrue(noPool.isStarted());
        assertDoesNotThrow(noPool::stop);
        assertFalse(noPool.isStarted());
    }
}
