package in.warmguard.application.engagement;

import in.warmguard.config.DailyTaskLimits;
import in.warmguard.domain.engagement.BulkEnqueueResult;
import in.warmguard.domain.engagement.EngagementLogEntry;
import in.warmguard.domain.engagement.EngagementTask;
import in.warmguard.domain.engagement.InteractionSettings;
import in.warmguard.domain.engagement.QueueStats;
import in.warmguard.domain.engagement.QueuedTask;
import in.warmguard.domain.engagement.TaskRequest;
import in.warmguard.domain.engagement.TaskStatus;
import in.warmguard.domain.engagement.TaskType;
import in.warmguard.domain.health.ActionType;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import in.warmguard.repository.PostgresEngagementLogRepository;
import in.warmguard.repository.RepositoryException;
import in.warmguard.support.InMemoryEngagementLogRepository;
import in.warmguard.support.InMemoryEngagementTaskRepository;
import in.warmguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EngagementScheduler.
 *
 * Tests:
 * - Eligibility: settings, daily quotas, re-trigger intervals, candidate window
 * - Priority ordering
 * - Task lifecycle: enqueue, claim, complete, expire, cleanup
 * - Queue statistics
 */
class EngagementSchedulerTest {

    private static final long PROJECT = 3L;
    private static final long ACCOUNT = 11L;

    private MutableClock clock;
    private InMemoryEngagementTaskRepository taskRepo;
    private InMemoryEngagementLogRepository logRepo;
    private InteractionSettings settings;
    private EngagementScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.utc("2026-03-10T12:00:00Z");
        taskRepo = new InMemoryEngagementTaskRepository();
        logRepo = new InMemoryEngagementLogRepository();
        settings = allEnabled();
        scheduler = newScheduler(DailyTaskLimits.defaults());
    }

    private EngagementScheduler newScheduler(DailyTaskLimits limits) {
        return new EngagementScheduler(taskRepo, logRepo,
            projectId -> projectId == PROJECT ? Optional.ofNullable(settings) : Optional.empty(),
            limits, SafetyMetrics.NOOP, clock, ZoneId.of("UTC"));
    }

    private static InteractionSettings allEnabled() {
        return new InteractionSettings(PROJECT, true, true, true, true, null, null, null, null);
    }

    private long enqueueAndTick(TaskRequest request) {
        long id = scheduler.enqueue(request);
        clock.advance(Duration.ofMinutes(1));
        return id;
    }

    private void logAttempt(TaskType type, boolean success) {
        EngagementTask task = EngagementTask.create(PROJECT, ACCOUNT, type,
            type == TaskType.FOLLOW || type == TaskType.UNFOLLOW ? "@someone" : null,
            type == TaskType.LIKE || type == TaskType.COMMENT ? "https://x.com/p/1" : null,
            type == TaskType.COMMENT ? "nice" : null,
            null, clock.instant()).withId(999);
        logRepo.append(EngagementLogEntry.forTask(task, success, success ? null : "boom", clock.instant()));
    }

    // ========================================================================
    // Selection
    // ========================================================================

    @Test
    void getNextTasks_emptyWhenInteractionsDisabledOrUnknown() {
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));

        settings = new InteractionSettings(PROJECT, false, true, true, true, null, null, null, null);
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 5).isEmpty());

        settings = null;
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 5).isEmpty());
        assertTrue(scheduler.getNextTasks(PROJECT + 1, ACCOUNT, 5).isEmpty());
    }

    @Test
    void getNextTasks_handsOutNothingWhenAttemptCountsUnreadable() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));
        EngagementScheduler offline = new EngagementScheduler(taskRepo, new PostgresEngagementLogRepository(dataSource),
            projectId -> Optional.of(settings), DailyTaskLimits.defaults(), SafetyMetrics.NOOP, clock, ZoneId.of("UTC"));
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));

        assertThrows(RepositoryException.class, () -> offline.getNextTasks(PROJECT, ACCOUNT, 5),
            "Unknown daily usage must not be treated as zero");
        assertThrows(RepositoryException.class, () -> offline.getQueueStats(PROJECT, ACCOUNT));
        assertEquals(1, taskRepo.countPending(PROJECT, ACCOUNT, clock.instant()));
    }

    @Test
    void getNextTasks_nonPositiveLimit() {
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));

        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 0).isEmpty());
    }

    @Test
    void getNextTasks_respectsLimit() {
        for (int i = 0; i < 5; i++) {
            enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/" + i));
        }

        assertEquals(2, scheduler.getNextTasks(PROJECT, ACCOUNT, 2).size());
        assertEquals(5, scheduler.getNextTasks(PROJECT, ACCOUNT, 10).size());
    }

    @Test
    void getNextTasks_skipsTypesAtDailyQuota() {
        Map<ActionType, Integer> limits = new EnumMap<>(ActionType.class);
        limits.put(ActionType.LIKE, 2);
        limits.put(ActionType.FOLLOW, 20);
        scheduler = newScheduler(new DailyTaskLimits(limits));

        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        long follow = enqueueAndTick(TaskRequest.follow(PROJECT, ACCOUNT, "@alice"));
        logAttempt(TaskType.LIKE, true);
        logAttempt(TaskType.LIKE, false);

        List<QueuedTask> next = scheduler.getNextTasks(PROJECT, ACCOUNT, 10);

        assertEquals(1, next.size(), "Failed attempts count against the quota too");
        assertEquals(follow, next.get(0).task().id());
    }

    @Test
    void getNextTasks_quotaRollsOverAtMidnight() {
        Map<ActionType, Integer> limits = new EnumMap<>(ActionType.class);
        limits.put(ActionType.LIKE, 1);
        scheduler = newScheduler(new DailyTaskLimits(limits));

        logAttempt(TaskType.LIKE, true);
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 10).isEmpty());

        clock.set(clock.instant().plus(Duration.ofHours(12)));
        assertEquals(1, scheduler.getNextTasks(PROJECT, ACCOUNT, 10).size());
    }

    @Test
    void getNextTasks_skipsDisabledTypesButNotUnfollow() {
        settings = new InteractionSettings(PROJECT, true, false, false, false, null, null, null, null);
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        enqueueAndTick(TaskRequest.follow(PROJECT, ACCOUNT, "@alice"));
        long unfollow = enqueueAndTick(TaskRequest.unfollow(PROJECT, ACCOUNT, "@bob"));

        List<QueuedTask> next = scheduler.getNextTasks(PROJECT, ACCOUNT, 10);

        assertEquals(1, next.size());
        assertEquals(unfollow, next.get(0).task().id());
    }

    @Test
    void getNextTasks_ignoresReservedRetweetQuota() {
        scheduler = newScheduler(DailyTaskLimits.defaults().withOverrides(Map.of(ActionType.RETWEET, 0)));
        long like = enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));

        List<QueuedTask> next = scheduler.getNextTasks(PROJECT, ACCOUNT, 10);

        assertEquals(List.of(like), next.stream().map(q -> q.task().id()).toList(),
            "No task type maps to retweet, so its quota gates nothing");
    }

    @Test
    void getNextTasks_honoursMinimumInterval() {
        long like = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        EngagementTask recentlyRun = taskRepo.get(like);
        taskRepo.put(new EngagementTask(recentlyRun.id(), PROJECT, ACCOUNT, TaskType.LIKE, null,
            recentlyRun.targetPost(), null, clock.instant().minus(Duration.ofMinutes(3)), TaskStatus.PENDING,
            null, null, recentlyRun.createdAt(), recentlyRun.updatedAt()));

        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 10).isEmpty(), "Default interval is 5 minutes");

        clock.advance(Duration.ofMinutes(2));
        assertEquals(1, scheduler.getNextTasks(PROJECT, ACCOUNT, 10).size());

        settings = new InteractionSettings(PROJECT, true, true, true, true, 10, null, null, null);
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 10).isEmpty(), "Configured interval wins");
    }

    @Test
    void getNextTasks_onlyConsidersTwiceLimitNewestCandidates() {
        enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/old"));
        enqueueAndTick(TaskRequest.comment(PROJECT, ACCOUNT, "https://x.com/p/2", "great"));
        enqueueAndTick(TaskRequest.comment(PROJECT, ACCOUNT, "https://x.com/p/3", "agreed"));
        settings = new InteractionSettings(PROJECT, true, true, false, true, null, null, null, null);

        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 1).isEmpty(),
            "The two newest candidates are disabled comments; the older like is outside the window");
        assertEquals(1, scheduler.getNextTasks(PROJECT, ACCOUNT, 2).size());
    }

    @Test
    void getNextTasks_ordersByPriorityThenRecency() {
        long oldLike = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        clock.advance(Duration.ofDays(4));
        long comment = enqueueAndTick(TaskRequest.comment(PROJECT, ACCOUNT, "https://x.com/p/2", "great"));
        long like = enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/3"));
        long follow = enqueueAndTick(TaskRequest.follow(PROJECT, ACCOUNT, "@alice"));
        long newerLike = enqueueAndTick(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/4"));

        List<QueuedTask> next = scheduler.getNextTasks(PROJECT, ACCOUNT, 10);

        assertEquals(List.of(follow, newerLike, like, comment, oldLike),
            next.stream().map(q -> q.task().id()).toList());
        assertEquals(List.of(85, 80, 80, 75, 60),
            next.stream().map(QueuedTask::priorityScore).toList());
    }

    @Test
    void getNextTasks_excludesExpiredTasks() {
        scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1")
            .expiringAt(clock.instant().plus(Duration.ofMinutes(10))));
        assertEquals(1, scheduler.getNextTasks(PROJECT, ACCOUNT, 10).size());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 10).isEmpty());
    }

    // ========================================================================
    // Task lifecycle
    // ========================================================================

    @Test
    void enqueue_rejectsInvalidTargets() {
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.enqueue(new TaskRequest(PROJECT, ACCOUNT, TaskType.LIKE, "@alice", null, null, null)));
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.enqueue(new TaskRequest(PROJECT, ACCOUNT, TaskType.COMMENT, null, "https://x.com/p/1", " ", null)));
        assertThrows(IllegalArgumentException.class,
            () -> scheduler.enqueue(new TaskRequest(PROJECT, ACCOUNT, TaskType.FOLLOW, "@alice", null, "hi", null)));
        assertEquals(0, taskRepo.size());
    }

    @Test
    void enqueueAll_isolatesFailures() {
        BulkEnqueueResult result = scheduler.enqueueAll(List.of(
            TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"),
            TaskRequest.follow(PROJECT, ACCOUNT, null),
            TaskRequest.unfollow(PROJECT, ACCOUNT, "@bob")));

        assertEquals(2, result.added());
        assertEquals(1, result.failed());
        assertEquals(1, result.errors().size());
        assertEquals(2, taskRepo.size());
    }

    @Test
    void claimAndComplete() {
        long id = scheduler.enqueue(TaskRequest.follow(PROJECT, ACCOUNT, "@alice"));

        assertTrue(scheduler.claimTask(id));
        assertFalse(scheduler.claimTask(id), "Already claimed");
        assertEquals(TaskStatus.CLAIMED, taskRepo.get(id).status());
        assertTrue(scheduler.getNextTasks(PROJECT, ACCOUNT, 10).isEmpty(), "Claimed tasks are not handed out");

        clock.advance(Duration.ofMinutes(2));
        assertTrue(scheduler.markTaskCompleted(id));
        EngagementTask done = taskRepo.get(id);
        assertEquals(TaskStatus.COMPLETED, done.status());
        assertEquals(clock.instant(), done.lastExecutedAt());

        assertFalse(scheduler.markTaskCompleted(id), "Completed tasks stay completed");
        assertFalse(scheduler.markTaskCompleted(12345L));
        assertFalse(scheduler.claimTask(12345L));
    }

    @Test
    void markTaskCompleted_acceptsPendingTask() {
        long id = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));

        assertTrue(scheduler.markTaskCompleted(id));
        assertEquals(TaskStatus.COMPLETED, taskRepo.get(id).status());
    }

    @Test
    void expireStaleClaims_onlyTouchesOldClaims() {
        long stale = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        scheduler.claimTask(stale);
        clock.advance(Duration.ofMinutes(20));
        long fresh = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/2"));
        scheduler.claimTask(fresh);
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, scheduler.expireStaleClaims(Duration.ofMinutes(30)));
        assertEquals(TaskStatus.EXPIRED, taskRepo.get(stale).status());
        assertEquals(TaskStatus.CLAIMED, taskRepo.get(fresh).status());
        assertFalse(scheduler.markTaskCompleted(stale));
    }

    @Test
    void recordTaskOutcome_appendsLog() {
        long id = scheduler.enqueue(TaskRequest.comment(PROJECT, ACCOUNT, "https://x.com/p/1", "great"));
        EngagementTask task = taskRepo.get(id);

        scheduler.recordTaskOutcome(task, false, "Comment box not found");

        assertEquals(1, logRepo.entries.size());
        EngagementLogEntry entry = logRepo.entries.get(0);
        assertEquals(EngagementLogEntry.Outcome.FAILED, entry.status());
        assertEquals(id, entry.taskId());
        assertEquals("Comment box not found", entry.errorMessage());
    }

    @Test
    void getQueueStats_countsTodayOnly() {
        scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        scheduler.enqueue(TaskRequest.follow(PROJECT, ACCOUNT, "@alice"));
        clock.set(clock.instant().minus(Duration.ofDays(1)));
        logAttempt(TaskType.LIKE, true);
        clock.set(clock.instant().plus(Duration.ofDays(1)));
        logAttempt(TaskType.LIKE, true);
        logAttempt(TaskType.LIKE, true);
        logAttempt(TaskType.FOLLOW, false);

        QueueStats stats = scheduler.getQueueStats(PROJECT, ACCOUNT);

        assertEquals(2, stats.pending());
        assertEquals(2, stats.completedToday());
        assertEquals(1, stats.failedToday());
        assertEquals(67, stats.successRatePercent());
    }

    @Test
    void getQueueStats_zeroRateWithoutAttempts() {
        assertEquals(new QueueStats(0, 0, 0, 0), scheduler.getQueueStats(PROJECT, ACCOUNT));
    }

    @Test
    void cleanupOldTasks_deletesOnlyOldFinishedTasks() {
        long done = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/1"));
        long pending = scheduler.enqueue(TaskRequest.like(PROJECT, ACCOUNT, "https://x.com/p/2"));
        scheduler.markTaskCompleted(done);

        clock.advance(Duration.ofDays(6));
        assertEquals(0, scheduler.cleanupOldTasks());

        clock.advance(Duration.ofDays(2));
        assertEquals(1, scheduler.cleanupOldTasks());
        assertNull(taskRepo.get(done));
        assertNotNull(taskRepo.get(pending));
    }
}
