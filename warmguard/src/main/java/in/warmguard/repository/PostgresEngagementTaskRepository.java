package in.warmguard.repository;

import in.warmguard.application.port.output.EngagementTaskRepository;
import in.warmguard.domain.engagement.EngagementTask;
import in.warmguard.domain.engagement.TaskStatus;
import in.warmguard.domain.engagement.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static in.warmguard.repository.JdbcValues.instant;
import static in.warmguard.repository.JdbcValues.ts;

/**
 * PostgreSQL implementation of EngagementTaskRepository.
 */
public class PostgresEngagementTaskRepository implements EngagementTaskRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEngagementTaskRepository.class);

    private static final String COLUMNS = """
        id, project_id, account_id, task_type, target_user, target_post, comment_text,
        last_executed_at, status, claimed_at, expires_at, created_at, updated_at
        """;

    private final DataSource dataSource;

    public PostgresEngagementTaskRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public EngagementTask insert(EngagementTask task) {
        String sql = """
            INSERT INTO engagement_tasks (
                project_id, account_id, task_type, target_user, target_post, comment_text,
                last_executed_at, status, claimed_at, expires_at, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, task.projectId());
            stmt.setLong(2, task.accountId());
            stmt.setString(3, task.taskType().dbValue());
            stmt.setString(4, task.targetUser());
            stmt.setString(5, task.targetPost());
            stmt.setString(6, task.commentText());
            stmt.setTimestamp(7, ts(task.lastExecutedAt()));
            stmt.setString(8, task.status().dbValue());
            stmt.setTimestamp(9, ts(task.claimedAt()));
            stmt.setTimestamp(10, ts(task.expiresAt()));
            stmt.setTimestamp(11, ts(task.createdAt()));
            stmt.setTimestamp(12, ts(task.updatedAt()));

            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return task.withId(rs.getLong(1));
            }
        } catch (SQLException e) {
            log.error("Error inserting engagement task for account_id={}: {}", task.accountId(), e.getMessage());
            throw new RepositoryException("Failed to insert engagement task", e);
        }
    }

    @Override
    public Optional<EngagementTask> findById(long taskId) {
        String sql = "SELECT " + COLUMNS + " FROM engagement_tasks WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, taskId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding engagement task id={}: {}", taskId, e.getMessage());
        }

        return Optional.empty();
    }

    @Override
    public List<EngagementTask> findPending(long projectId, long accountId, Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
            FROM engagement_tasks
            WHERE project_id = ?
              AND account_id = ?
              AND status = 'pending'
              AND (expires_at IS NULL OR expires_at > ?)
            ORDER BY created_at DESC, id DESC
            LIMIT ?
            """;

        List<EngagementTask> tasks = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, projectId);
            stmt.setLong(2, accountId);
            stmt.setTimestamp(3, ts(now));
            stmt.setInt(4, limit);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding pending tasks for project={} account={}: {}", projectId, accountId, e.getMessage());
        }

        return tasks;
    }

    @Override
    public int countPending(long projectId, long accountId, Instant now) {
        String sql = """
            SELECT COUNT(*)
            FROM engagement_tasks
            WHERE project_id = ?
              AND account_id = ?
              AND status = 'pending'
              AND (expires_at IS NULL OR expires_at > ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, projectId);
            stmt.setLong(2, accountId);
            stmt.setTimestamp(3, ts(now));

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
        } catch (SQLException e) {
            log.error("Error counting pending tasks for project={} account={}: {}", projectId, accountId, e.getMessage());
        }

        return 0;
    }

    @Override
    public boolean updateIfStatus(EngagementTask task, TaskStatus expected) {
        String sql = """
            UPDATE engagement_tasks
            SET status = ?, last_executed_at = ?, claimed_at = ?, updated_at = ?
            WHERE id = ?
              AND status = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, task.status().dbValue());
            stmt.setTimestamp(2, ts(task.lastExecutedAt()));
            stmt.setTimestamp(3, ts(task.claimedAt()));
            stmt.setTimestamp(4, ts(task.updatedAt()));
            stmt.setLong(5, task.id());
            stmt.setString(6, expected.dbValue());

            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            log.error("Error updating engagement task id={}: {}", task.id(), e.getMessage());
            throw new RepositoryException("Failed to update engagement task", e);
        }
    }

    @Override
    public List<EngagementTask> findClaimedBefore(Instant cutoff) {
        String sql = "SELECT " + COLUMNS + """
            FROM engagement_tasks
            WHERE status = 'claimed'
              AND claimed_at < ?
            ORDER BY claimed_at
            """;

        List<EngagementTask> tasks = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, ts(cutoff));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    tasks.add(mapResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding stale claimed tasks: {}", e.getMessage());
        }

        return tasks;
    }

    @Override
    public int deleteFinishedBefore(Instant cutoff) {
        String sql = """
            DELETE FROM engagement_tasks
            WHERE status IN ('completed', 'expired')
              AND updated_at < ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, ts(cutoff));
            return stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Error deleting finished tasks: {}", e.getMessage());
            throw new RepositoryException("Failed to delete finished tasks", e);
        }
    }

    private EngagementTask mapResultSet(ResultSet rs) throws SQLException {
        return new EngagementTask(
            rs.getLong("id"),
            rs.getLong("project_id"),
            rs.getLong("account_id"),
            TaskType.fromDbValue(rs.getString("task_type")),
            rs.getString("target_user"),
            rs.getString("target_post"),
            rs.getString("comment_text"),
            instant(rs, "last_executed_at"),
            TaskStatus.fromDbValue(rs.getString("status")),
            instant(rs, "claimed_at"),
            instant(rs, "expires_at"),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
        );
    }
}
