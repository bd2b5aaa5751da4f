package in.warmguard.support;

import in.warmguard.application.port.output.EngagementLogRepository;
import in.warmguard.domain.engagement.EngagementLogEntry;
import in.warmguard.domain.engagement.TaskType;
import in.warmguard.domain.health.OutcomeCounts;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryEngagementLogRepository implements EngagementLogRepository {

    public final List<EngagementLogEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(EngagementLogEntry entry) {
        entries.add(entry);
    }

    @Override
    public Map<TaskType, Integer> countAttemptsByType(long accountId, Instant since) {
        Map<TaskType, Integer> counts = new EnumMap<>(TaskType.class);
        for (EngagementLogEntry e : entries) {
            if (e.accountId() == accountId && !e.createdAt().isBefore(since)) {
                counts.merge(e.taskType(), 1, Integer::sum);
            }
        }
        return counts;
    }

    @Override
    public OutcomeCounts countOutcomes(long accountId, Instant since) {
        int ok = 0;
        int failed = 0;
        for (EngagementLogEntry e : entries) {
            if (e.accountId() != accountId || e.createdAt().isBefore(since)) {
                continue;
            }
            if (e.status() == EngagementLogEntry.Outcome.SUCCESS) {
                ok++;
            } else {
                failed++;
            }
        }
        return new OutcomeCounts(ok, failed);
    }
}
