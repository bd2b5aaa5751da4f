package in.warmguard.support;

import in.warmguard.application.port.output.EngagementTaskRepository;
import in.warmguard.domain.engagement.EngagementTask;
import in.warmguard.domain.engagement.TaskStatus;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

public final class InMemoryEngagementTaskRepository implements EngagementTaskRepository {

    private final Map<Long, EngagementTask> tasks = new ConcurrentSkipListMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public EngagementTask insert(EngagementTask task) {
        EngagementTask stored = task.withId(ids.incrementAndGet());
        tasks.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<EngagementTask> findById(long taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<EngagementTask> findPending(long projectId, long accountId, Instant now, int limit) {
        return pending(projectId, accountId, now)
            .sorted(Comparator.comparing(EngagementTask::createdAt).reversed()
                .thenComparing(EngagementTask::id, Comparator.reverseOrder()))
            .limit(limit)
            .toList();
    }

    @Override
    public int countPending(long projectId, long accountId, Instant now) {
        return (int) pending(projectId, accountId, now).count();
    }

    @Override
    public synchronized boolean updateIfStatus(EngagementTask task, TaskStatus expected) {
        EngagementTask current = tasks.get(task.id());
        if (current == null || current.status() != expected) {
            return false;
        }
        tasks.put(task.id(), task);
        return true;
    }

    @Override
    public List<EngagementTask> findClaimedBefore(Instant cutoff) {
        return tasks.values().stream()
            .filter(t -> t.status() == TaskStatus.CLAIMED && t.claimedAt().isBefore(cutoff))
            .toList();
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        List<Long> doomed = tasks.values().stream()
            .filter(t -> t.status().isTerminal() && t.updatedAt().isBefore(cutoff))
            .map(EngagementTask::id)
            .toList();
        doomed.forEach(tasks::remove);
        return doomed.size();
    }

    /**
     * Store a task as-is, keeping its timestamps; assigns an id when missing.
     */
    public EngagementTask put(EngagementTask task) {
        EngagementTask stored = task.id() == null ? task.withId(ids.incrementAndGet()) : task;
        tasks.put(stored.id(), stored);
        return stored;
    }

    public EngagementTask get(long taskId) {
        return tasks.get(taskId);
    }

    public int size() {
        return tasks.size();
    }

    private Stream<EngagementTask> pending(long projectId, long accountId, Instant now) {
        return tasks.values().stream()
            .filter(t -> t.projectId() == projectId && t.accountId() == accountId)
            .filter(t -> t.status() == TaskStatus.PENDING)
            .filter(t -> !t.isExpired(now));
    }
}
