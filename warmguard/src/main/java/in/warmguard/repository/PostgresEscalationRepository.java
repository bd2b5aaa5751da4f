package in.warmguard.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warmguard.application.port.output.EscalationRepository;
import in.warmguard.domain.health.Escalation;
import in.warmguard.domain.health.HealthScoreBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static in.warmguard.repository.JdbcValues.instant;
import static in.warmguard.repository.JdbcValues.ts;

/**
 * PostgreSQL implementation of EscalationRepository. The score breakdown is stored as JSONB.
 */
public class PostgresEscalationRepository implements EscalationRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEscalationRepository.class);

    private final DataSource dataSource;
    private final ObjectMapper mapper;

    public PostgresEscalationRepository(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    @Override
    public Escalation insert(Escalation escalation) {
        String sql = """
            INSERT INTO health_escalations (account_id, health_score, reason, breakdown, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            RETURNING id
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, escalation.accountId());
            stmt.setInt(2, escalation.healthScore());
            stmt.setString(3, escalation.reason());
            stmt.setString(4, mapper.writeValueAsString(escalation.breakdown()));
            stmt.setTimestamp(5, ts(escalation.createdAt()));

            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long id = rs.getLong(1);
                log.info("Inserted escalation id={} for account_id={} (score={})",
                    id, escalation.accountId(), escalation.healthScore());
                return new Escalation(id, escalation.accountId(), escalation.healthScore(), escalation.reason(),
                    escalation.breakdown(), escalation.createdAt());
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error inserting escalation for account_id={}: {}", escalation.accountId(), e.getMessage());
            throw new RepositoryException("Failed to insert escalation", e);
        }
    }

    @Override
    public List<Escalation> findByAccountId(long accountId) {
        String sql = """
            SELECT id, account_id, health_score, reason, breakdown::text AS breakdown, created_at
            FROM health_escalations
            WHERE account_id = ?
            ORDER BY created_at DESC
            """;

        List<Escalation> escalations = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, accountId);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    escalations.add(new Escalation(
                        rs.getLong("id"),
                        rs.getLong("account_id"),
                        rs.getInt("health_score"),
                        rs.getString("reason"),
                        mapper.readValue(rs.getString("breakdown"), HealthScoreBreakdown.class),
                        instant(rs, "created_at")
                    ));
                }
            }
        } catch (SQLException | JsonProcessingException e) {
            log.error("Error finding escalations for account_id={}: {}", accountId, e.getMessage());
        }

        return escalations;
    }
}
