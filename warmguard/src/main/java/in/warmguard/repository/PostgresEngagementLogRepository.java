package in.warmguard.repository;

import in.warmguard.application.port.output.EngagementLogRepository;
import in.warmguard.domain.engagement.EngagementLogEntry;
import in.warmguard.domain.engagement.TaskType;
import in.warmguard.domain.health.OutcomeCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static in.warmguard.repository.JdbcValues.ts;

/**
 * PostgreSQL implementation of EngagementLogRepository.
 */
public class PostgresEngagementLogRepository implements EngagementLogRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEngagementLogRepository.class);

    private final DataSource dataSource;

    public PostgresEngagementLogRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void append(EngagementLogEntry entry) {
        String sql = """
            INSERT INTO engagement_logs (
                account_id, task_id, task_type, status, target_user, target_post, error_message, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, entry.accountId());
            if (entry.taskId() != null) {
                stmt.setLong(2, entry.taskId());
            } else {
                stmt.setNull(2, Types.BIGINT);
            }
            stmt.setString(3, entry.taskType().dbValue());
            stmt.setString(4, entry.status().name().toLowerCase(Locale.ROOT));
            stmt.setString(5, entry.targetUser());
            stmt.setString(6, entry.targetPost());
            stmt.setString(7, entry.errorMessage());
            stmt.setTimestamp(8, ts(entry.createdAt()));

            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Error appending engagement log for account_id={}: {}", entry.accountId(), e.getMessage());
            throw new RepositoryException("Failed to append engagement log", e);
        }
    }

    @Override
    public Map<TaskType, Integer> countAttemptsByType(long accountId, Instant since) {
        String sql = """
            SELECT task_type, COUNT(*) AS attempts
            FROM engagement_logs
            WHERE account_id = ?
              AND created_at >= ?
            GROUP BY task_type
            """;

        Map<TaskType, Integer> counts = new EnumMap<>(TaskType.class);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);
            stmt.setTimestamp(2, ts(since));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(TaskType.fromDbValue(rs.getString("task_type")), rs.getInt("attempts"));
                }
            }
        } catch (SQLException e) {
            log.error("Error counting engagement attempts for account_id={}: {}", accountId, e.getMessage());
            throw new RepositoryException("Failed to count engagement attempts", e);
        }

        return counts;
    }

    @Override
    public OutcomeCounts countOutcomes(long accountId, Instant since) {
        String sql = """
            SELECT COUNT(*) FILTER (WHERE status = 'success') AS succeeded,
                   COUNT(*) FILTER (WHERE status = 'failed') AS failed
            FROM engagement_logs
            WHERE account_id = ?
              AND created_at >= ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);
            stmt.setTimestamp(2, ts(since));

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new OutcomeCounts(rs.getInt("succeeded"), rs.getInt("failed"));
                }
            }
        } catch (SQLException e) {
            log.error("Error counting engagement outcomes for account_id={}: {}", accountId, e.getMessage());
            throw new RepositoryException("Failed to count engagement outcomes", e);
        }

        return OutcomeCounts.none();
    }
}
