package in.warmguard.repository;

import in.warmguard.application.port.output.InteractionSettingsRepository;
import in.warmguard.domain.engagement.InteractionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

import static in.warmguard.repository.JdbcValues.nullableInt;

/**
 * PostgreSQL implementation of InteractionSettingsRepository.
 */
public class PostgresInteractionSettingsRepository implements InteractionSettingsRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresInteractionSettingsRepository.class);

    private final DataSource dataSource;

    public PostgresInteractionSettingsRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<InteractionSettings> findByProjectId(long projectId) {
        String sql = """
            SELECT project_id, is_enabled, like_enabled, comment_enabled, follow_enabled,
                   like_delay_min_minutes, comment_delay_min_minutes, follow_delay_min_minutes,
                   unfollow_delay_min_minutes
            FROM interaction_settings
            WHERE project_id = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, projectId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new InteractionSettings(
                        rs.getLong("project_id"),
                        rs.getBoolean("is_enabled"),
                        rs.getBoolean("like_enabled"),
                        rs.getBoolean("comment_enabled"),
                        rs.getBoolean("follow_enabled"),
                        nullableInt(rs, "like_delay_min_minutes"),
                        nullableInt(rs, "comment_delay_min_minutes"),
                        nullableInt(rs, "follow_delay_min_minutes"),
                        nullableInt(rs, "unfollow_delay_min_minutes")
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Error finding interaction settings for project_id={}: {}", projectId, e.getMessage());
        }

        return Optional.empty();
    }
}
