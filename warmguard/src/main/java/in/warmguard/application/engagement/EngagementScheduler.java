package in.warmguard.application.engagement;

import in.warmguard.application.port.output.EngagementLogRepository;
import in.warmguard.application.port.output.EngagementTaskRepository;
import in.warmguard.application.port.output.InteractionSettingsRepository;
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
import in.warmguard.domain.health.OutcomeCounts;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import in.warmguard.util.TimeBoundaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Engagement task queue: selection of the next eligible tasks plus queue upkeep.
 *
 * Selection respects the project's interaction settings, per-type daily quotas
 * counted from today's engagement log, and each type's minimum re-trigger interval.
 * The scheduler never creates work of its own; producers enqueue it.
 */
public final class EngagementScheduler {
    private static final Logger log = LoggerFactory.getLogger(EngagementScheduler.class);

    public static final int DEFAULT_CLEANUP_DAYS = 7;

    private final EngagementTaskRepository taskRepo;
    private final EngagementLogRepository logRepo;
    private final InteractionSettingsRepository settingsRepo;
    private final DailyTaskLimits dailyLimits;
    private final SafetyMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;

    public EngagementScheduler(
            EngagementTaskRepository taskRepo,
            EngagementLogRepository logRepo,
            InteractionSettingsRepository settingsRepo,
            DailyTaskLimits dailyLimits,
            SafetyMetrics metrics,
            Clock clock,
            ZoneId zone) {
        this.taskRepo = taskRepo;
        this.logRepo = logRepo;
        this.settingsRepo = settingsRepo;
        this.dailyLimits = dailyLimits;
        this.metrics = metrics;
        this.clock = clock;
        this.zone = zone;
    }

    // ========================================================================
    // Selection
    // ========================================================================

    /**
     * Up to {@code limit} eligible tasks for the project/account, highest priority first.
     *
     * Candidates are the {@code 2 * limit} newest pending tasks; those of unavailable types
     * or still inside their type's re-trigger interval are skipped. Ties keep recency order.
     * When today's attempt counts cannot be read the call fails instead of handing out work.
     */
    public List<QueuedTask> getNextTasks(long projectId, long accountId, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        Optional<InteractionSettings> found = settingsRepo.findByProjectId(projectId);
        if (found.isEmpty() || !found.get().enabled()) {
            log.info("[QUEUE] Interactions disabled for project {}", projectId);
            return List.of();
        }
        InteractionSettings settings = found.get();

        Instant now = clock.instant();
        Set<TaskType> available = availableTypes(accountId, settings, now);
        if (available.isEmpty()) {
            log.info("[QUEUE] All task types at daily limit for account {}", accountId);
            return List.of();
        }

        List<EngagementTask> candidates = taskRepo.findPending(projectId, accountId, now, limit * 2);
        List<QueuedTask> selected = new ArrayList<>();
        for (EngagementTask task : candidates) {
            if (!available.contains(task.taskType())) {
                continue;
            }
            if (task.lastExecutedAt() != null
                    && Duration.between(task.lastExecutedAt(), now).compareTo(settings.minInterval(task.taskType())) < 0) {
                continue;
            }
            selected.add(new QueuedTask(task, TaskPriorityScorer.score(task, now)));
            if (selected.size() >= limit) {
                break;
            }
        }

        // List.sort is stable, so equal priorities keep the repository's newest-first order.
        selected.sort(Comparator.comparingInt(QueuedTask::priorityScore).reversed());
        metrics.recordTasksScheduled(selected.size());
        log.debug("[QUEUE] {} task(s) ready for project {} account {} (types={})",
            selected.size(), projectId, accountId, available);
        return selected;
    }

    private Set<TaskType> availableTypes(long accountId, InteractionSettings settings, Instant now) {
        Map<TaskType, Integer> attemptsToday =
            logRepo.countAttemptsByType(accountId, TimeBoundaries.startOfDay(now, zone));
        Set<TaskType> available = EnumSet.noneOf(TaskType.class);
        for (TaskType type : TaskType.values()) {
            int used = attemptsToday.getOrDefault(type, 0);
            if (used < dailyLimits.limit(type.actionType()) && settings.isTypeEnabled(type)) {
                available.add(type);
            }
        }
        return available;
    }

    // ========================================================================
    // Task lifecycle
    // ========================================================================

    /**
     * Validate and insert a task.
     *
     * @return generated task id
     * @throws IllegalArgumentException when the type/target combination is invalid
     */
    public long enqueue(TaskRequest request) {
        EngagementTask stored = taskRepo.insert(request.toTask(clock.instant()));
        log.debug("[QUEUE] Enqueued {} task {} for account {}",
            stored.taskType().dbValue(), stored.id(), stored.accountId());
        return stored.id();
    }

    /**
     * Enqueue each request independently; one bad task does not stop the rest.
     */
    public BulkEnqueueResult enqueueAll(List<TaskRequest> requests) {
        int added = 0;
        List<String> errors = new ArrayList<>();
        for (TaskRequest request : requests) {
            try {
                enqueue(request);
                added++;
            } catch (RuntimeException e) {
                log.error("[QUEUE] Failed to add {} task for account {}: {}",
                    request.taskType(), request.accountId(), e.getMessage());
                errors.add(e.getMessage());
            }
        }
        return new BulkEnqueueResult(added, errors.size(), errors);
    }

    /**
     * Move a pending task to CLAIMED.
     *
     * @return false when the task does not exist or is no longer pending
     */
    public boolean claimTask(long taskId) {
        Optional<EngagementTask> found = taskRepo.findById(taskId);
        if (found.isEmpty() || found.get().status() != TaskStatus.PENDING) {
            return false;
        }
        return taskRepo.updateIfStatus(found.get().claimed(clock.instant()), TaskStatus.PENDING);
    }

    /**
     * Stamp {@code lastExecutedAt} and mark the task COMPLETED. Pending and claimed tasks qualify.
     *
     * @return false when the task does not exist or already finished
     */
    public boolean markTaskCompleted(long taskId) {
        Optional<EngagementTask> found = taskRepo.findById(taskId);
        if (found.isEmpty()) {
            log.warn("[QUEUE] Cannot complete task {}: not found", taskId);
            return false;
        }
        EngagementTask task = found.get();
        if (task.status().isTerminal()) {
            log.debug("[QUEUE] Task {} already {}", taskId, task.status());
            return false;
        }
        return taskRepo.updateIfStatus(task.completed(clock.instant()), task.status());
    }

    /**
     * Append the execution result to the engagement log. Failed attempts count against daily quotas too.
     */
    public void recordTaskOutcome(EngagementTask task, boolean success, String errorMessage) {
        logRepo.append(EngagementLogEntry.forTask(task, success, errorMessage, clock.instant()));
        if (!success) {
            log.info("[QUEUE] Task {} ({}) failed for account {}: {}",
                task.id(), task.taskType().dbValue(), task.accountId(), errorMessage);
        }
    }

    /**
     * Expire tasks claimed longer than {@code maxClaimAge} ago without completing.
     *
     * @return number of tasks expired
     */
    public int expireStaleClaims(Duration maxClaimAge) {
        Instant now = clock.instant();
        int expired = 0;
        for (EngagementTask task : taskRepo.findClaimedBefore(now.minus(maxClaimAge))) {
            if (taskRepo.updateIfStatus(task.expired(now), TaskStatus.CLAIMED)) {
                expired++;
                log.warn("[QUEUE] Task {} ({}) claimed at {} never completed; expired",
                    task.id(), task.taskType().dbValue(), task.claimedAt());
            }
        }
        return expired;
    }

    public QueueStats getQueueStats(long projectId, long accountId) {
        Instant now = clock.instant();
        int pending = taskRepo.countPending(projectId, accountId, now);
        OutcomeCounts today = logRepo.countOutcomes(accountId, TimeBoundaries.startOfDay(now, zone));
        return QueueStats.of(pending, today.succeeded(), today.failed());
    }

    public int cleanupOldTasks() {
        return cleanupOldTasks(DEFAULT_CLEANUP_DAYS);
    }

    /**
     * Delete completed and expired tasks not updated within {@code olderThanDays}.
     */
    public int cleanupOldTasks(int olderThanDays) {
        int deleted = taskRepo.deleteFinishedBefore(clock.instant().minus(Duration.ofDays(olderThanDays)));
        log.info("[QUEUE] Cleaned up {} finished task(s) older than {} days", deleted, olderThanDays);
        return deleted;
    }
}
