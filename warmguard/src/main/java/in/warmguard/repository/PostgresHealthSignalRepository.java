package in.warmguard.repository;

import in.warmguard.application.port.output.HealthSignalRepository;
import in.warmguard.domain.health.ActionType;
import in.warmguard.domain.health.FreezeDetection;
import in.warmguard.domain.health.FreezeDetection.FreezeType;
import in.warmguard.domain.health.OutcomeCounts;
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

import static in.warmguard.repository.JdbcValues.instant;
import static in.warmguard.repository.JdbcValues.ts;

/**
 * PostgreSQL implementation of HealthSignalRepository.
 *
 * Tables: account_login_attempts, account_post_outcomes, account_interactions, freeze_detections.
 */
public class PostgresHealthSignalRepository implements HealthSignalRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresHealthSignalRepository.class);

    private final DataSource dataSource;

    public PostgresHealthSignalRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public OutcomeCounts countLoginAttempts(long accountId, Instant since) {
        String sql = """
            SELECT COUNT(*) FILTER (WHERE status = 'success') AS succeeded,
                   COUNT(*) FILTER (WHERE status <> 'success') AS failed
            FROM account_login_attempts
            WHERE account_id = ?
              AND attempted_at >= ?
            """;
        return countOutcomes(sql, accountId, since, "login attempts");
    }

    @Override
    public OutcomeCounts countPostOutcomes(long accountId, Instant since) {
        String sql = """
            SELECT COUNT(*) FILTER (WHERE status = 'published') AS succeeded,
                   COUNT(*) FILTER (WHERE status = 'failed') AS failed
            FROM account_post_outcomes
            WHERE account_id = ?
              AND recorded_at >= ?
            """;
        return countOutcomes(sql, accountId, since, "post outcomes");
    }

    private OutcomeCounts countOutcomes(String sql, long accountId, Instant since, String what) {
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
            log.error("Error counting {} for account_id={}: {}", what, accountId, e.getMessage());
            throw new RepositoryException("Failed to count " + what, e);
        }

        return OutcomeCounts.none();
    }

    @Override
    public List<Instant> findInteractionTimes(long accountId, Instant since) {
        String sql = """
            SELECT executed_at
            FROM account_interactions
            WHERE account_id = ?
              AND executed_at >= ?
            ORDER BY executed_at
            """;

        List<Instant> times = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);
            stmt.setTimestamp(2, ts(since));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    times.add(instant(rs, "executed_at"));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding interactions for account_id={}: {}", accountId, e.getMessage());
            throw new RepositoryException("Failed to find interactions", e);
        }

        return times;
    }

    @Override
    public List<FreezeDetection> findFreezeDetections(long accountId, Instant since) {
        String sql = """
            SELECT id, account_id, freeze_type, confidence, detected_at
            FROM freeze_detections
            WHERE account_id = ?
              AND detected_at >= ?
            ORDER BY detected_at DESC
            """;

        List<FreezeDetection> detections = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);
            stmt.setTimestamp(2, ts(since));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    detections.add(new FreezeDetection(
                        rs.getLong("id"),
                        rs.getLong("account_id"),
                        FreezeType.fromDbValue(rs.getString("freeze_type")),
                        rs.getInt("confidence"),
                        instant(rs, "detected_at")
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding freeze detections for account_id={}: {}", accountId, e.getMessage());
            throw new RepositoryException("Failed to find freeze detections", e);
        }

        return detections;
    }

    @Override
    public void recordLoginAttempt(long accountId, boolean success, Instant at) {
        String sql = "INSERT INTO account_login_attempts (account_id, status, attempted_at) VALUES (?, ?, ?)";
        insertSignal(sql, accountId, success ? "success" : "failed", at, "login attempt");
    }

    @Override
    public void recordPostOutcome(long accountId, boolean published, Instant at) {
        String sql = "INSERT INTO account_post_outcomes (account_id, status, recorded_at) VALUES (?, ?, ?)";
        insertSignal(sql, accountId, published ? "published" : "failed", at, "post outcome");
    }

    @Override
    public void recordInteraction(long accountId, ActionType actionType, Instant at) {
        String sql = "INSERT INTO account_interactions (account_id, action_type, executed_at) VALUES (?, ?, ?)";
        insertSignal(sql, accountId, actionType.wireName(), at, "interaction");
    }

    private void insertSignal(String sql, long accountId, String value, Instant at, String what) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);
            stmt.setString(2, value);
            stmt.setTimestamp(3, ts(at));
            stmt.executeUpdate();

        } catch (SQLException e) {
            log.error("Error recording {} for account_id={}: {}", what, accountId, e.getMessage());
            throw new RepositoryException("Failed to record " + what, e);
        }
    }

    @Override
    public FreezeDetection recordFreezeDetection(FreezeDetection d) {
        String sql = """
            INSERT INTO freeze_detections (account_id, freeze_type, confidence, detected_at)
            VALUES (?, ?, ?, ?)
            RETURNING id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, d.accountId());
            stmt.setString(2, d.freezeType().dbValue());
            stmt.setInt(3, d.confidence());
            stmt.setTimestamp(4, ts(d.detectedAt()));

            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return new FreezeDetection(rs.getLong(1), d.accountId(), d.freezeType(), d.confidence(), d.detectedAt());
            }
        } catch (SQLException e) {
            log.error("Error inserting freeze detection for account_id={}: {}", d.accountId(), e.getMessage());
            throw new RepositoryException("Failed to insert freeze detection", e);
        }
    }
}
